package com.rxlabel.ocr.app.model;

import java.util.Objects;
import lombok.Value;

/** One rasterized PDF page. Owned by the worker that recognizes it. */
@Value
public class PageTask {

  /** Zero-based page index in the source document. */
  int index;

  byte[] imageBytes;

  public PageTask(int index, byte[] imageBytes) {
    this.index = index;
    this.imageBytes = Objects.requireNonNull(imageBytes, "imageBytes must not be null").clone();
  }

  /** A copy; the task itself never changes. */
  public byte[] getImageBytes() {
    return imageBytes.clone();
  }

  public int pageNumber() {
    return index + 1;
  }
}
