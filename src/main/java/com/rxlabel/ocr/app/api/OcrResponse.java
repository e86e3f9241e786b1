package com.rxlabel.ocr.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rxlabel.ocr.app.error.ErrorKind;
import com.rxlabel.ocr.app.model.RecognitionResult;
import lombok.Builder;
import lombok.Value;

/** Envelope returned by every OCR route: either {@code data} or {@code error} is set. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OcrResponse {
  boolean success;
  RecognitionResult data;
  String error;
  ErrorKind errorKind;

  public static OcrResponse ok(RecognitionResult data) {
    return OcrResponse.builder().success(true).data(data).build();
  }

  public static OcrResponse failed(String error, ErrorKind kind) {
    return OcrResponse.builder().success(false).error(error).errorKind(kind).build();
  }
}
