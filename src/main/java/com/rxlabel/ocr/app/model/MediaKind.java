package com.rxlabel.ocr.app.model;

/** Declared kind of the bytes handed to the engine. */
public enum MediaKind {
  IMAGE,
  PDF
}
