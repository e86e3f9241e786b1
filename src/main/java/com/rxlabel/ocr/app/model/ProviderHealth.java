package com.rxlabel.ocr.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/** Startup availability check for one provider. Read-only after the engine is built. */
@Value
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ProviderHealth {

  boolean available;
  String lastError;

  public static ProviderHealth up() {
    return new ProviderHealth(true, null);
  }

  public static ProviderHealth down(String reason) {
    return new ProviderHealth(false, reason);
  }
}
