package com.rxlabel.ocr.app.error;

/** Provider replied successfully but the body held no text. */
public final class MalformedResponseException extends OcrException {

  public MalformedResponseException(String message) {
    super(ErrorKind.MALFORMED_RESPONSE, message, null);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(ErrorKind.MALFORMED_RESPONSE, message, cause);
  }
}
