package com.rxlabel.ocr.app.api;

import com.rxlabel.ocr.app.error.OcrException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps OCR failures to HTTP statuses and the {@link OcrResponse} envelope. */
@Log4j2
@RestControllerAdvice
public class OcrExceptionHandler {

  @ExceptionHandler(OcrException.class)
  public ResponseEntity<OcrResponse> handleOcr(OcrException e) {
    HttpStatus status = statusFor(e);
    log.warn(
        "api.ocr.failed kind={} status={} msg={}", e.getKind(), status.value(), e.getMessage());
    return ResponseEntity.status(status).body(OcrResponse.failed(e.getMessage(), e.getKind()));
  }

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<OcrResponse> handleUpload(InvalidUploadException e) {
    log.info("api.ocr.rejected msg={}", e.getMessage());
    return ResponseEntity.badRequest().body(OcrResponse.failed(e.getMessage(), null));
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MaxUploadSizeExceededException.class
  })
  public ResponseEntity<OcrResponse> handleMultipart(Exception e) {
    log.info("api.ocr.rejected msg={}", e.getMessage());
    return ResponseEntity.badRequest().body(OcrResponse.failed(e.getMessage(), null));
  }

  static HttpStatus statusFor(OcrException e) {
    switch (e.getKind()) {
      case NO_ENGINE_AVAILABLE:
      case PROVIDER_UNAVAILABLE:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case CONVERSION_FAILED:
        return HttpStatus.UNPROCESSABLE_ENTITY;
      default:
        return HttpStatus.BAD_GATEWAY;
    }
  }
}
