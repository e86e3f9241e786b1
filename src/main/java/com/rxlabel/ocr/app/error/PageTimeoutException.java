package com.rxlabel.ocr.app.error;

import java.time.Duration;
import lombok.Getter;

/** A single PDF page missed its deadline. Never fatal to the document. */
@Getter
public final class PageTimeoutException extends OcrException {

  private final int pageNumber;

  public PageTimeoutException(int pageNumber, Duration deadline) {
    super(
        ErrorKind.PAGE_TIMEOUT,
        "page " + pageNumber + " did not finish within " + deadline.toMillis() + "ms",
        null);
    this.pageNumber = pageNumber;
  }
}
