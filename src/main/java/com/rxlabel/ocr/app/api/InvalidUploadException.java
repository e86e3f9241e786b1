package com.rxlabel.ocr.app.api;

/** The uploaded part is missing, empty or of a type the route does not accept. */
public class InvalidUploadException extends RuntimeException {

  public InvalidUploadException(String message) {
    super(message);
  }

  public InvalidUploadException(String message, Throwable cause) {
    super(message, cause);
  }
}
