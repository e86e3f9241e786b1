package com.rxlabel.ocr.app.pdf;

import java.util.List;

/** Turns a PDF into one encoded image per page, in page order. */
public interface PageRasterizer {

  /**
   * @throws com.rxlabel.ocr.app.error.ConversionFailedException if any page cannot be rendered;
   *     there is no partial conversion
   */
  List<byte[]> rasterize(byte[] pdfBytes, int dpi);
}
