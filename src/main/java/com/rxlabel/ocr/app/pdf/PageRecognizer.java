package com.rxlabel.ocr.app.pdf;

import com.rxlabel.ocr.app.model.PageTask;

/** Recognizes the text of one page image. Called concurrently from page workers. */
@FunctionalInterface
public interface PageRecognizer {

  String recognize(PageTask page);
}
