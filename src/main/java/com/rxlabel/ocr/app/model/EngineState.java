package com.rxlabel.ocr.app.model;

/** Lifecycle of the OCR facade, decided once when it is built. */
public enum EngineState {
  /** A cloud primary is configured; the local model may back it up. */
  READY,
  /** Only the local fallback is available. */
  DEGRADED,
  /** Nothing could be constructed; every request fails fast. */
  UNAVAILABLE
}
