package com.rxlabel.ocr.app.provider.local;

/** Failure of the on-box OCR engine. */
public class LocalOcrException extends RuntimeException {

  public LocalOcrException(String message) {
    super(message);
  }

  public LocalOcrException(String message, Throwable cause) {
    super(message, cause);
  }
}
