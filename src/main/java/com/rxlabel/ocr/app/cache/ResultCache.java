package com.rxlabel.ocr.app.cache;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Bounded, content-addressed cache of recognized text for the lifetime of the process.
 *
 * <p>Keys are SHA-256 digests of the exact bytes sent to a provider. Eviction is by insertion
 * order: once {@code capacity} is exceeded the oldest inserted entry goes, reads do not refresh an
 * entry. Only successful recognitions are ever stored. All access is synchronized on the instance;
 * two workers racing on the same digest simply write the same value twice.
 */
@Log4j2
public class ResultCache {

  public static final int DEFAULT_CAPACITY = 128;

  private final int capacity;
  private final Map<String, String> entries;

  public ResultCache() {
    this(DEFAULT_CAPACITY);
  }

  public ResultCache(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.capacity = capacity;
    this.entries =
        new LinkedHashMap<>(16, 0.75f, false) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
            boolean evict = size() > ResultCache.this.capacity;
            if (evict) {
              log.debug("cache.evict digest={}", eldest.getKey());
            }
            return evict;
          }
        };
  }

  public synchronized Optional<String> get(String digest) {
    return Optional.ofNullable(entries.get(digest));
  }

  public synchronized void put(String digest, String text) {
    if (digest == null || text == null) {
      throw new IllegalArgumentException("digest and text must not be null");
    }
    entries.put(digest, text);
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  /** Lower-case hex SHA-256 of {@code bytes}. */
  public static String digest(byte[] bytes) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not supported by this JVM", e);
    }
  }
}
