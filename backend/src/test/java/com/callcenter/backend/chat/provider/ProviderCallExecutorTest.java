package com.callcenter.backend.chat.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.callcenter.backend.agent.exception.ProviderException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

class ProviderCallExecutorTest {

  private ProviderCallExecutor executor;

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdown();
    }
  }

  @Test
  void retriesTransientFailuresUntilSuccess() {
    executor = new ProviderCallExecutor(Duration.ofSeconds(2), 3, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    String result =
        executor.call(
            "completion",
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new TransientAiException("503 from upstream");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(attempts).hasValue(3);
  }

  @Test
  void givesUpAfterMaxAttempts() {
    executor = new ProviderCallExecutor(Duration.ofSeconds(2), 2, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.call(
                    "classification",
                    () -> {
                      attempts.incrementAndGet();
                      throw new TransientAiException("boom");
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("classification failed after 2 attempts")
        .hasRootCauseMessage("boom");
    assertThat(attempts).hasValue(2);
  }

  @Test
  void nonRetryableFailureAbortsImmediately() {
    executor = new ProviderCallExecutor(Duration.ofSeconds(2), 5, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.call(
                    "completion",
                    () -> {
                      attempts.incrementAndGet();
                      throw new ProviderException("rejected", null, false);
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessage("rejected");
    assertThat(attempts).hasValue(1);
  }

  @Test
  void clientErrorIsNotRetried() {
    executor = new ProviderCallExecutor(Duration.ofSeconds(2), 3, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.call(
                    "completion",
                    () -> {
                      attempts.incrementAndGet();
                      throw new NonTransientAiException("401 invalid api key");
                    }))
        .isInstanceOfSatisfying(
            ProviderException.class, exception -> assertThat(exception.isRetryable()).isFalse())
        .hasMessageContaining("rejected by the provider")
        .hasCauseInstanceOf(NonTransientAiException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  void unexpectedFailureIsNotRetried() {
    executor = new ProviderCallExecutor(Duration.ofSeconds(2), 3, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.call(
                    "classification",
                    () -> {
                      attempts.incrementAndGet();
                      throw new IllegalStateException("bad state");
                    }))
        .isInstanceOf(ProviderException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  void timeoutsAreRetried() {
    executor = new ProviderCallExecutor(Duration.ofMillis(50), 2, Duration.ofMillis(1), Duration.ofMillis(5));
    AtomicInteger attempts = new AtomicInteger();

    String result =
        executor.call(
            "completion",
            () -> {
              if (attempts.incrementAndGet() == 1) {
                sleepQuietly(5_000);
              }
              return "second";
            });

    assertThat(result).isEqualTo("second");
    assertThat(attempts).hasValue(2);
  }

  @Test
  void slowCallTimesOut() {
    executor = new ProviderCallExecutor(Duration.ofMillis(50), 1, Duration.ofMillis(1), Duration.ofMillis(1));

    assertThatThrownBy(
            () ->
                executor.call(
                    "completion",
                    () -> {
                      try {
                        Thread.sleep(5_000);
                      } catch (InterruptedException exception) {
                        Thread.currentThread().interrupt();
                      }
                      return "late";
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("timed out");
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
    }
  }
}
