package com.rxlabel.ocr.app.retry;

/** Why a single network attempt failed. Every kind is retried. */
public enum FailureKind {
  TIMEOUT,
  CONNECTION,
  MALFORMED_RESPONSE,
  HTTP_STATUS,
  OTHER
}
