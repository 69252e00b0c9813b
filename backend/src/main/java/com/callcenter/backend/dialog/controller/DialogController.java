package com.callcenter.backend.dialog.controller;

import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.orchestrator.TurnResult;
import com.callcenter.backend.dialog.api.DialogCreateRequest;
import com.callcenter.backend.dialog.api.DialogDeleteResponse;
import com.callcenter.backend.dialog.api.DialogHistoryResponse;
import com.callcenter.backend.dialog.api.DialogMaintenanceResponse;
import com.callcenter.backend.dialog.api.DialogMessageResponse;
import com.callcenter.backend.dialog.api.DialogMessageView;
import com.callcenter.backend.dialog.api.DialogStatusResponse;
import com.callcenter.backend.dialog.api.MessageRequest;
import com.callcenter.backend.dialog.domain.DialogRecord;
import com.callcenter.backend.dialog.service.DialogService;
import com.callcenter.backend.dialog.service.DialogStatusView;
import com.callcenter.backend.dialog.service.DialogTurn;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/dialogue")
public class DialogController {

  private final DialogService dialogService;

  public DialogController(DialogService dialogService) {
    this.dialogService = dialogService;
  }

  @PostMapping("/create")
  @ResponseStatus(HttpStatus.CREATED)
  public DialogHistoryResponse create(@Valid @RequestBody DialogCreateRequest request) {
    DialogRecord dialog =
        dialogService.create(
            request.customerInfo(), request.initialMessage(), request.source(), request.priority());
    return toHistoryResponse(dialog);
  }

  @PostMapping("/{dialogId}/message")
  public DialogMessageResponse sendMessage(
      @PathVariable String dialogId, @Valid @RequestBody MessageRequest request) {
    DialogTurn turn =
        dialogService.sendMessage(
            dialogId, request.message(), request.messageType(), request.metadata());
    TurnResult result = turn.result();
    return new DialogMessageResponse(
        turn.dialogId(),
        turn.messageId(),
        result.responseText(),
        result.currentHandler(),
        result.previousHandler(),
        result.handoffReason(),
        result.intent(),
        turn.timestamp(),
        result.metadata());
  }

  @GetMapping("/{dialogId}/history")
  public DialogHistoryResponse history(@PathVariable String dialogId) {
    return toHistoryResponse(dialogService.history(dialogId));
  }

  @GetMapping("/{dialogId}/status")
  public DialogStatusResponse status(@PathVariable String dialogId) {
    DialogStatusView view = dialogService.status(dialogId);
    return new DialogStatusResponse(
        view.dialogId(),
        view.status(),
        view.priority(),
        view.currentAgent(),
        view.messageCount(),
        view.createdAt(),
        view.updatedAt(),
        view.customerName());
  }

  @PostMapping("/{dialogId}/close")
  public DialogHistoryResponse close(
      @PathVariable String dialogId,
      @RequestParam(name = "reason", defaultValue = "manual") String reason) {
    return toHistoryResponse(dialogService.close(dialogId, reason));
  }

  @DeleteMapping("/{dialogId}")
  public DialogDeleteResponse delete(
      @PathVariable String dialogId,
      @RequestParam(name = "force", defaultValue = "false") boolean force) {
    dialogService.delete(dialogId, force);
    return new DialogDeleteResponse(dialogId, true);
  }

  @DeleteMapping("/cleanup")
  public DialogMaintenanceResponse closeInactive() {
    int closed = dialogService.closeInactiveDialogs();
    return new DialogMaintenanceResponse("Closed " + closed + " inactive dialogs", closed);
  }

  @DeleteMapping("/cleanup/closed")
  public DialogMaintenanceResponse deleteClosed(
      @RequestParam(name = "olderThanDays", defaultValue = "7") int olderThanDays) {
    int deleted = dialogService.deleteClosedDialogs(olderThanDays);
    return new DialogMaintenanceResponse(
        "Deleted " + deleted + " closed dialogs older than " + olderThanDays + " days", deleted);
  }

  private DialogHistoryResponse toHistoryResponse(DialogRecord dialog) {
    List<DialogMessageView> messages =
        dialog.getMessages().stream().map(DialogController::toMessageView).toList();
    return new DialogHistoryResponse(
        dialog.getDialogId(),
        dialog.getCustomerInfo(),
        dialog.getStatus(),
        dialog.getPriority(),
        dialog.getSource(),
        dialog.getCurrentAgent(),
        dialog.getSummary() != null ? dialog.getSummary().text() : null,
        dialog.getSummary() != null ? dialog.getSummary().coveredMessageCount() : 0,
        messages,
        dialog.getCreatedAt(),
        dialog.getUpdatedAt(),
        dialog.getMetadata());
  }

  private static DialogMessageView toMessageView(MessageRecord message) {
    return new DialogMessageView(
        message.id(),
        message.sender(),
        message.text(),
        message.handlerName(),
        message.timestamp(),
        message.metadata());
  }
}
