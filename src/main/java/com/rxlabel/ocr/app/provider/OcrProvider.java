package com.rxlabel.ocr.app.provider;

import java.time.Duration;

/**
 * One OCR backend. Adapters only ever see single images; splitting PDFs into pages is done by
 * the page scheduler.
 */
public interface OcrProvider {

  /** Stable identifier, e.g. {@code cloud-vision}. */
  String id();

  /** Model or engine name reported in results. */
  String modelName();

  /** Timeout of one network call, used to size per-page deadlines. */
  Duration callTimeout();

  /**
   * @return recognized text, never blank
   * @throws com.rxlabel.ocr.app.error.RecognitionFailedException when the backend could not
   *     produce text after the adapter's own retries
   */
  String recognizeImage(byte[] imageBytes);
}
