package com.callcenter.backend.common.exception;

import com.callcenter.backend.agent.capability.CapabilityNotFoundException;
import com.callcenter.backend.agent.exception.OrchestrationException;
import com.callcenter.backend.agent.exception.ProviderException;
import com.callcenter.backend.agent.exception.RoutingException;
import com.callcenter.backend.dialog.exception.DialogBusyException;
import com.callcenter.backend.dialog.exception.DialogNotFoundException;
import com.callcenter.backend.dialog.exception.DialogStateException;
import com.callcenter.backend.dialog.exception.DialogStorageException;
import com.callcenter.backend.dialog.exception.DialogValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String RETRY_AFTER_SECONDS = "5";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    return badRequest(resolveValidationMessage(ex));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ProblemDetail> handleUnreadableRequest(Exception ex) {
    log.debug("Rejected malformed request: {}", ex.getMessage());
    return badRequest("Malformed request payload or parameter");
  }

  @ExceptionHandler(DialogValidationException.class)
  public ResponseEntity<ProblemDetail> handleDialogValidation(DialogValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler({DialogNotFoundException.class, CapabilityNotFoundException.class})
  public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setTitle("Not found");
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
  }

  @ExceptionHandler(DialogStateException.class)
  public ResponseEntity<ProblemDetail> handleDialogState(DialogStateException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setTitle("Dialog state conflict");
    if (ex.getStatus() != null) {
      problem.setProperty("dialogStatus", ex.getStatus().value());
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DialogBusyException.class)
  public ResponseEntity<ProblemDetail> handleDialogBusy(DialogBusyException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setTitle("Dialog busy");
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(problem);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ProblemDetail> handleProviderFailure(ProviderException ex) {
    log.warn("Generation provider failure: {}", ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.SERVICE_UNAVAILABLE,
            "The assistant is temporarily unavailable. Please retry the request.");
    problem.setTitle("Provider unavailable");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(problem);
  }

  @ExceptionHandler(RoutingException.class)
  public ResponseEntity<ProblemDetail> handleRoutingFailure(RoutingException ex) {
    log.warn("Routing failure: {}", ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.SERVICE_UNAVAILABLE, "No specialist is available to handle the request.");
    problem.setTitle("No handler available");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(OrchestrationException.class)
  public ResponseEntity<ProblemDetail> handleOrchestrationFailure(OrchestrationException ex) {
    log.error("Orchestration failure", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Orchestration error");
    problem.setDetail("The message could not be processed. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(DialogStorageException.class)
  public ResponseEntity<ProblemDetail> handleStorageFailure(DialogStorageException ex) {
    log.error("Dialog storage failure", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Storage error");
    problem.setDetail("The dialog could not be stored. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private ResponseEntity<ProblemDetail> badRequest(String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(detail);
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException
          .getBindingResult()
          .getFieldErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getAllErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
