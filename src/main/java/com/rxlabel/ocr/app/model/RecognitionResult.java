package com.rxlabel.ocr.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one successful OCR request. Built once and handed to the caller.
 *
 * <ul>
 *   <li>{@code engineUsed} is the role that answered: {@code primary} or {@code fallback}
 *   <li>{@code provider} is the backend identifier, e.g. {@code cloud-vision}
 *   <li>{@code pagesProcessed} is only set for PDFs
 * </ul>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecognitionResult {

  String extractedText;
  long processingTimeMs;
  String modelName;
  String engineUsed;
  String provider;
  Integer pagesProcessed;
}
