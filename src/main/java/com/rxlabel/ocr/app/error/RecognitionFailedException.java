package com.rxlabel.ocr.app.error;

import lombok.Getter;

/** A provider could not turn an image into text, after any retries it performs itself. */
@Getter
public final class RecognitionFailedException extends OcrException {

  private final String providerId;

  public RecognitionFailedException(String providerId, String message, Throwable cause) {
    super(ErrorKind.RECOGNITION_FAILED, providerId + ": " + message, cause);
    this.providerId = providerId;
  }
}
