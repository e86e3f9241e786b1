package com.rxlabel.ocr.app.error;

/** The engine started without any usable provider; requests fail fast. */
public final class NoEngineAvailableException extends OcrException {

  public NoEngineAvailableException() {
    super(
        ErrorKind.NO_ENGINE_AVAILABLE,
        "No OCR engine available. Configure a cloud credential or start the local model server.",
        null);
  }
}
