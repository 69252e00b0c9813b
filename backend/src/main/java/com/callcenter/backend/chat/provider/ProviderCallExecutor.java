package com.callcenter.backend.chat.provider;

import com.callcenter.backend.agent.exception.ProviderException;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;

/**
 * Runs provider calls with a per-attempt timeout under a {@link RetryTemplate}. Only transient
 * failures are retried: upstream 5xx/429 responses, I/O errors, timeouts and unusable payloads.
 * Client errors such as a rejected API key fail on the first attempt.
 */
@Slf4j
public class ProviderCallExecutor {

  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();
  private static final double BACKOFF_MULTIPLIER = 2.0d;

  private final Duration timeout;
  private final RetryTemplate retryTemplate;
  private final ExecutorService executor;

  public ProviderCallExecutor(
      Duration timeout, int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    this(timeout, retryTemplate(maxAttempts, initialBackoff, maxBackoff));
  }

  public ProviderCallExecutor(Duration timeout, RetryTemplate retryTemplate) {
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    this.retryTemplate = Objects.requireNonNull(retryTemplate, "retryTemplate must not be null");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.executor = Executors.newCachedThreadPool(workerThreadFactory());
  }

  public static RetryTemplate retryTemplate(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    long initialInterval = Math.max(1L, initialBackoff.toMillis());
    long maxInterval = Math.max(initialInterval + 1, maxBackoff.toMillis());
    return RetryTemplate.builder()
        .maxAttempts(Math.max(1, maxAttempts))
        .exponentialBackoff(initialInterval, BACKOFF_MULTIPLIER, maxInterval)
        .retryOn(ProviderCallExecutor::isTransient)
        .build();
  }

  static boolean isTransient(Throwable throwable) {
    if (throwable instanceof ProviderException providerException) {
      return providerException.isRetryable();
    }
    return throwable instanceof TransientAiException
        || throwable instanceof ResourceAccessException;
  }

  public <T> T call(String operation, Supplier<T> action) {
    AtomicInteger attempts = new AtomicInteger();
    try {
      return retryTemplate.execute(
          context -> {
            int attempt = attempts.incrementAndGet();
            if (context.getLastThrowable() != null) {
              log.debug(
                  "{} attempt {} after failure: {}",
                  operation,
                  attempt,
                  context.getLastThrowable().getMessage());
            }
            return invokeWithTimeout(operation, action);
          });
    } catch (BackOffInterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new ProviderException(operation + " interrupted during backoff", exception, false);
    } catch (ProviderException exception) {
      if (!exception.isRetryable()) {
        throw exception;
      }
      throw exhausted(operation, attempts.get(), exception);
    } catch (RuntimeException exception) {
      if (isTransient(exception)) {
        throw exhausted(operation, attempts.get(), exception);
      }
      throw new ProviderException(
          operation + " was rejected by the provider: " + exception.getMessage(), exception, false);
    }
  }

  private static ProviderException exhausted(
      String operation, int attempts, RuntimeException exception) {
    return new ProviderException(
        operation + " failed after " + attempts + " attempts: " + exception.getMessage(),
        exception);
  }

  private <T> T invokeWithTimeout(String operation, Supplier<T> action) {
    Callable<T> task = action::get;
    Future<T> future = executor.submit(task);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException exception) {
      future.cancel(true);
      throw new ProviderException(operation + " timed out after " + timeout, exception);
    } catch (ExecutionException exception) {
      Throwable cause = exception.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new ProviderException(operation + " failed", cause);
    } catch (InterruptedException exception) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProviderException(operation + " interrupted", exception, false);
    }
  }

  private ThreadFactory workerThreadFactory() {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("provider-call-" + WORKER_SEQUENCE.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdownNow();
  }
}
