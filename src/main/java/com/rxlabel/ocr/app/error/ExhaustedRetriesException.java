package com.rxlabel.ocr.app.error;

import com.rxlabel.ocr.app.retry.FailureKind;
import lombok.Getter;

/** Every attempt of a retried call failed; the cause is the last attempt's failure. */
@Getter
public final class ExhaustedRetriesException extends OcrException {

  private final int attempts;
  private final FailureKind lastFailureKind;

  public ExhaustedRetriesException(int attempts, FailureKind lastFailureKind, Throwable lastCause) {
    super(
        ErrorKind.EXHAUSTED_RETRIES,
        "gave up after "
            + attempts
            + " attempt(s), last failure "
            + lastFailureKind
            + ": "
            + (lastCause == null ? "unknown" : lastCause.getMessage()),
        lastCause);
    this.attempts = attempts;
    this.lastFailureKind = lastFailureKind;
  }
}
