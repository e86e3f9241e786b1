package com.rxlabel.ocr.app.error;

/** PDF could not be opened or rendered into page images. */
public final class ConversionFailedException extends OcrException {

  public ConversionFailedException(String message) {
    super(ErrorKind.CONVERSION_FAILED, message, null);
  }

  public ConversionFailedException(String message, Throwable cause) {
    super(ErrorKind.CONVERSION_FAILED, message, cause);
  }
}
