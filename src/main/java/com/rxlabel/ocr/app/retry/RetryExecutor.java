package com.rxlabel.ocr.app.retry;

import com.rxlabel.ocr.app.error.ExhaustedRetriesException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;

/**
 * Runs one idempotent network call with bounded retries and exponential backoff, on top of a
 * resilience4j {@link Retry}.
 *
 * <p>Delays start at {@code baseDelay} and double after every failed attempt, capped at {@link
 * #MAX_DELAY}. The pause happens on the calling thread. After {@code maxAttempts} failures the
 * call fails with {@link ExhaustedRetriesException} carrying the last cause. An interrupted
 * caller stops retrying at once and keeps its interrupt flag.
 */
@Log4j2
public class RetryExecutor {

  public static final Duration MAX_DELAY = Duration.ofSeconds(30);

  // IntervalFunction rejects intervals below one millisecond
  private static final Duration MIN_DELAY = Duration.ofMillis(1);

  private final Consumer<Retry> listener;

  public RetryExecutor() {
    this(retry -> {});
  }

  /** @param listener sees every {@link Retry} before it runs, e.g. to subscribe to its events */
  public RetryExecutor(Consumer<Retry> listener) {
    this.listener = Objects.requireNonNull(listener, "listener must not be null");
  }

  public <T> T execute(Callable<T> call, int maxAttempts, Duration baseDelay) {
    return execute("call", call, maxAttempts, baseDelay);
  }

  /**
   * @param label short name used in log lines, e.g. the provider id
   * @throws ExhaustedRetriesException when every attempt failed or the caller was interrupted
   */
  public <T> T execute(String label, Callable<T> call, int maxAttempts, Duration baseDelay) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    Retry retry = Retry.of(label, config(maxAttempts, baseDelay));
    retry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "retry.attempt label={} n={}/{} kind={} waitMs={} msg={}",
                    label,
                    e.getNumberOfRetryAttempts(),
                    maxAttempts,
                    FailureClassifier.classify(e.getLastThrowable()),
                    e.getWaitInterval().toMillis(),
                    message(e.getLastThrowable())));
    listener.accept(retry);

    AtomicInteger attempts = new AtomicInteger();
    AtomicReference<Exception> lastFailure = new AtomicReference<>();
    try {
      return retry.executeCallable(
          () -> {
            attempts.incrementAndGet();
            try {
              return call.call();
            } catch (Exception e) {
              lastFailure.set(e);
              throw e;
            }
          });
    } catch (Exception e) {
      Exception cause = lastFailure.get() == null ? e : lastFailure.get();
      FailureKind kind = FailureClassifier.classify(cause);
      // an interrupted backoff pause ends the loop early and clears the flag
      if (isInterruption(cause)
          || Thread.currentThread().isInterrupted()
          || attempts.get() < maxAttempts) {
        Thread.currentThread().interrupt();
        log.warn("retry.interrupted label={} attempts={}", label, attempts.get());
      } else {
        log.warn(
            "retry.exhausted label={} attempts={} kind={} msg={}",
            label,
            attempts.get(),
            kind,
            message(cause));
      }
      throw new ExhaustedRetriesException(attempts.get(), kind, cause);
    }
  }

  /** Doubling delays from {@code base}, capped at {@link #MAX_DELAY}. */
  static IntervalFunction backoff(Duration base) {
    Duration initial = base == null || base.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : base;
    if (initial.compareTo(MAX_DELAY) > 0) {
      initial = MAX_DELAY;
    }
    return IntervalFunction.ofExponentialBackoff(initial, 2.0, MAX_DELAY);
  }

  static boolean isInterruption(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof InterruptedException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  private static RetryConfig config(int maxAttempts, Duration baseDelay) {
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(backoff(baseDelay))
        .retryOnException(e -> !isInterruption(e) && !Thread.currentThread().isInterrupted())
        .build();
  }

  private static String message(Throwable t) {
    return t == null ? null : t.getMessage();
  }
}
