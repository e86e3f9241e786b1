package com.rxlabel.ocr.app.provider.local;

/** Deterministic on-box OCR used as the last resort behind the local model server. */
public interface LocalOcr {

  /**
   * @return recognized text, possibly empty
   * @throws LocalOcrException when the engine cannot run or the image cannot be read
   */
  String recognizeLocally(byte[] imageBytes);

  /**
   * Short engine name for log lines. Results keep the adapter's model name even when this engine
   * produced the text.
   */
  String name();
}
