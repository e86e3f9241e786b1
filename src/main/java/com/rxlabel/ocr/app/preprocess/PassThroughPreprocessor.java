package com.rxlabel.ocr.app.preprocess;

/** Used when the OpenCV native library is not available: images go to providers as uploaded. */
public class PassThroughPreprocessor implements ImagePreprocessor {

  @Override
  public byte[] preprocess(byte[] raw) {
    return raw;
  }
}
