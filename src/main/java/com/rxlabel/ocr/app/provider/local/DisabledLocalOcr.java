package com.rxlabel.ocr.app.provider.local;

/** Stand-in when Tesseract is switched off or missing: always fails. */
public class DisabledLocalOcr implements LocalOcr {

  @Override
  public String recognizeLocally(byte[] imageBytes) {
    throw new LocalOcrException("local OCR is disabled (ocr.tesseract.enabled=false)");
  }

  @Override
  public String name() {
    return "disabled";
  }
}
