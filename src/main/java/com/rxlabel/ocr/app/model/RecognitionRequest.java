package com.rxlabel.ocr.app.model;

import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * Input to one OCR call: the raw file bytes, what kind of file they are, and an optional filename
 * extension used only for format sniffing. Owned by the call that created it.
 */
@Value
public class RecognitionRequest {

  byte[] content;
  MediaKind mediaKind;

  /** Lower-case extension without the dot, e.g. {@code png}. May be null. */
  String extension;

  public static RecognitionRequest image(byte[] content) {
    return image(content, null);
  }

  public static RecognitionRequest image(byte[] content, String extension) {
    return RecognitionRequest.builder()
        .content(content)
        .mediaKind(MediaKind.IMAGE)
        .extension(extension)
        .build();
  }

  public static RecognitionRequest pdf(byte[] content) {
    return RecognitionRequest.builder()
        .content(content)
        .mediaKind(MediaKind.PDF)
        .extension("pdf")
        .build();
  }

  /** A copy; the request itself never changes. */
  public byte[] getContent() {
    return content.clone();
  }

  @Builder
  private RecognitionRequest(byte[] content, MediaKind mediaKind, String extension) {
    this.content = Objects.requireNonNull(content, "content must not be null").clone();
    this.mediaKind = Objects.requireNonNull(mediaKind, "mediaKind must not be null");
    this.extension = extension;
  }
}
