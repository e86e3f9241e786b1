package com.rxlabel.ocr.app.service;

import com.rxlabel.ocr.app.cache.ResultCache;
import com.rxlabel.ocr.app.preprocess.ImagePreprocessor;
import com.rxlabel.ocr.app.provider.OcrProvider;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Preprocess, look up the cache, then ask the provider. Used for single images and by every PDF
 * page worker. Only successful recognitions are cached.
 */
@Log4j2
public class RecognitionPipeline {

  private final ImagePreprocessor preprocessor;
  private final ResultCache cache;

  public RecognitionPipeline(ImagePreprocessor preprocessor, ResultCache cache) {
    this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
  }

  public String recognize(OcrProvider provider, byte[] rawImage) {
    byte[] prepared = preprocessor.preprocess(rawImage);
    String digest = ResultCache.digest(prepared);

    Optional<String> cached = cache.get(digest);
    if (cached.isPresent()) {
      log.debug("cache.hit provider={} digest={}", provider.id(), digest);
      return cached.get();
    }

    String text = provider.recognizeImage(prepared);
    cache.put(digest, text);
    return text;
  }

  ResultCache cache() {
    return cache;
  }
}
