package com.rxlabel.ocr.app.error;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Terminal failure: every provider tried for a request failed. Causes keep try order. */
@Getter
public final class AllEnginesFailedException extends OcrException {

  private final List<OcrException> causes;

  public AllEnginesFailedException(List<OcrException> causes) {
    super(
        ErrorKind.ALL_ENGINES_FAILED,
        "All OCR engines failed. Errors: "
            + causes.stream().map(Throwable::getMessage).collect(Collectors.joining(" | ")),
        null);
    this.causes = List.copyOf(causes);
    causes.forEach(this::addSuppressed);
  }
}
