package com.rxlabel.ocr.app.provider;

import com.rxlabel.ocr.app.config.OcrProperties.CallPolicy;
import com.rxlabel.ocr.app.error.ExhaustedRetriesException;
import com.rxlabel.ocr.app.error.MalformedResponseException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Shared call path of the network adapters: run {@link #callBackend} through the retry executor,
 * treat blank text as a malformed response, and turn exhausted retries into {@link
 * RecognitionFailedException}.
 */
@Log4j2
public abstract class AbstractOcrProvider implements OcrProvider {

  private final RetryExecutor retryExecutor;
  private final int maxAttempts;
  private final Duration retryDelay;
  private final Duration timeout;

  protected AbstractOcrProvider(RetryExecutor retryExecutor, CallPolicy policy) {
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    this.maxAttempts = Math.max(1, policy.getMaxAttempts());
    this.retryDelay = policy.getRetryDelay() == null ? Duration.ZERO : policy.getRetryDelay();
    this.timeout = policy.getTimeout() == null ? Duration.ofSeconds(30) : policy.getTimeout();
  }

  @Override
  public Duration callTimeout() {
    return timeout;
  }

  @Override
  public final String recognizeImage(byte[] imageBytes) {
    long t0 = System.nanoTime();
    try {
      String text =
          retryExecutor.execute(
              id(),
              () -> {
                String raw = callBackend(imageBytes);
                if (raw == null || raw.isBlank()) {
                  throw new MalformedResponseException(id() + " returned no text");
                }
                return raw.strip();
              },
              maxAttempts,
              retryDelay);
      log.info(
          "provider.ok id={} chars={} durationMs={}",
          id(),
          text.length(),
          (System.nanoTime() - t0) / 1_000_000);
      return text;
    } catch (ExhaustedRetriesException e) {
      return recoverAfterRetries(imageBytes, e);
    }
  }

  /** One attempt against the backend. Any exception counts as a failed attempt. */
  protected abstract String callBackend(byte[] imageBytes) throws Exception;

  /** Called once every attempt has failed. Default: report the provider as failed. */
  protected String recoverAfterRetries(byte[] imageBytes, ExhaustedRetriesException cause) {
    log.warn("provider.failed id={} msg={}", id(), cause.getMessage());
    throw new RecognitionFailedException(id(), cause.getMessage(), cause);
  }

  protected int maxAttempts() {
    return maxAttempts;
  }
}
