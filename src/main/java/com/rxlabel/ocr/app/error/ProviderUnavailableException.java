package com.rxlabel.ocr.app.error;

/** Raised by an adapter constructor when its endpoint or credentials are missing. */
public final class ProviderUnavailableException extends OcrException {

  public ProviderUnavailableException(String message) {
    super(ErrorKind.PROVIDER_UNAVAILABLE, message, null);
  }

  public ProviderUnavailableException(String message, Throwable cause) {
    super(ErrorKind.PROVIDER_UNAVAILABLE, message, cause);
  }
}
