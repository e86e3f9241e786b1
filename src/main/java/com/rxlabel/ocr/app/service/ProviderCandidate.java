package com.rxlabel.ocr.app.service;

import com.rxlabel.ocr.app.provider.OcrProvider;
import java.util.function.Supplier;
import lombok.Value;

/**
 * A named way of building one provider. The factory throws {@link
 * com.rxlabel.ocr.app.error.ProviderUnavailableException} (or anything else) when the provider
 * cannot be used; the engine records that instead of failing startup.
 */
@Value
public class ProviderCandidate {

  String id;
  Supplier<OcrProvider> factory;

  public static ProviderCandidate of(String id, Supplier<OcrProvider> factory) {
    return new ProviderCandidate(id, factory);
  }
}
