package com.rxlabel.ocr.app.pdf;

import com.rxlabel.ocr.app.error.OcrException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Value;

/** Ordered page texts of one document; failed pages hold their inline marker. */
@Value
public class PageResults {

  List<String> pageTexts;

  /** Why each marked page failed, keyed by one-based page number in page order. */
  Map<Integer, OcrException> failures;

  public int pageCount() {
    return pageTexts.size();
  }

  public List<Integer> getFailedPages() {
    return new ArrayList<>(failures.keySet());
  }

  /** True when no page produced text. */
  public boolean allFailed() {
    return !pageTexts.isEmpty() && failures.size() == pageTexts.size();
  }

  public String combinedText() {
    return String.join(PageScheduler.PAGE_SEPARATOR, pageTexts);
  }
}
