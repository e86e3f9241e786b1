package com.rxlabel.ocr.app.error;

/** Closed set of failure categories raised by the OCR engine. */
public enum ErrorKind {
  /** Provider configuration absent at startup; the provider is left out of selection. */
  PROVIDER_UNAVAILABLE,
  /** Provider answered but the payload carried no usable text. */
  MALFORMED_RESPONSE,
  /** A single provider call failed after its own retries. */
  RECOGNITION_FAILED,
  /** Every attempt of a retried call failed. */
  EXHAUSTED_RETRIES,
  /** The PDF could not be rasterized. Fatal for the document. */
  CONVERSION_FAILED,
  /** One page did not finish within its deadline. */
  PAGE_TIMEOUT,
  /** Primary and fallback both failed. */
  ALL_ENGINES_FAILED,
  /** No provider could be constructed at startup. */
  NO_ENGINE_AVAILABLE;

  /** Whether the facade should move on to the next provider when it sees this kind. */
  public boolean triggersFailover() {
    return this == MALFORMED_RESPONSE || this == RECOGNITION_FAILED || this == EXHAUSTED_RETRIES;
  }
}
