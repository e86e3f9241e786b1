package com.rxlabel.ocr.app.preprocess;

/**
 * Normalizes a raw label photo or scan into bytes tuned for recognition.
 *
 * <p>Implementations must be pure: identical input bytes always give identical output bytes, which
 * the result cache relies on. They never fail; input they cannot handle is returned unchanged.
 */
public interface ImagePreprocessor {

  byte[] preprocess(byte[] raw);
}
