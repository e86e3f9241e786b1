package com.rxlabel.ocr.app.error;

/**
 * Base type of every error the OCR engine raises.
 *
 * <p>The set of subclasses is closed: each one maps to exactly one {@link ErrorKind}, so callers
 * can switch on {@link #getKind()} to tell retry-worthy conditions from fatal ones.
 */
public abstract class OcrException extends RuntimeException {

  private final ErrorKind kind;

  OcrException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
