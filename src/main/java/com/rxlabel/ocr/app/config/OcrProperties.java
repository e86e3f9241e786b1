package com.rxlabel.ocr.app.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

/**
 * All OCR settings, bound once at startup from {@code application.yml} (prefix {@code ocr}).
 *
 * <p>Cloud providers are switched on by the presence of their credential. The local model is
 * always checked and, when constructible, becomes the permanent fallback.
 */
@Data
@ConfigurationProperties(prefix = "ocr")
public class OcrProperties {

  private Engine engine = new Engine();
  private Preprocess preprocess = new Preprocess();
  private LocalModel localModel = new LocalModel();
  private CloudVision cloudVision = new CloudVision();
  private CloudOcr cloudOcr = new CloudOcr();
  private Textract textract = new Textract();
  private Tesseract tesseract = new Tesseract();

  @Data
  public static class Engine {
    /** Upper bound on page workers per PDF; the pool is min(workers, pages). */
    private int workers = 4;

    private int renderDpi = 150;

    /** Added on top of the provider call timeout to form the per-page deadline. */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pageTimeoutGrace = Duration.ofSeconds(10);

    private int cacheCapacity = 128;
  }

  @Data
  public static class Preprocess {
    /** Off sends images to providers as uploaded. */
    private boolean enabled = true;

    private int maxWidth = 1600;
    private double binarizeStddevCutoff = 40.0;

    /** Side of the square neighbourhood used for local thresholding; must be odd. */
    private int blockSize = 11;

    private int offset = 2;
  }

  /** Shared call policy for every network backend. Bare numbers are read as seconds. */
  @Data
  public static class CallPolicy {
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(30);

    private int maxAttempts = 3;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration retryDelay = Duration.ofSeconds(1);
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class LocalModel extends CallPolicy {
    private String endpoint = "http://127.0.0.1:11434";
    private String model = "glm-ocr:latest";
    private String prompt = "Extract all text from this image. Return only the extracted text.";

    public LocalModel() {
      setTimeout(Duration.ofSeconds(120));
      setRetryDelay(Duration.ofSeconds(5));
    }
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class CloudVision extends CallPolicy {
    /** Service-account JSON. Empty disables the provider. */
    private String credentialsPath = "";

    private String feature = "DOCUMENT_TEXT_DETECTION";
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class CloudOcr extends CallPolicy {
    /** OCR.space key. Empty disables the provider. */
    private String apiKey = "";

    private String endpoint = "https://api.ocr.space";
    private String language = "eng";

    public CloudOcr() {
      setTimeout(Duration.ofSeconds(60));
    }
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class Textract extends CallPolicy {
    /** Use the default AWS credential chain when no static keys are given. */
    private boolean enabled = false;

    private String region = "us-east-1";
    private String accessKeyId = "";
    private String secretAccessKey = "";

    public boolean hasStaticCredentials() {
      return notBlank(accessKeyId) && notBlank(secretAccessKey);
    }
  }

  @Data
  public static class Tesseract {
    private boolean enabled = true;

    /** Directory holding {@code tessdata}; empty relies on the OS installation. */
    private String datapath = "";

    private String language = "eng";
    private int dpi = 300;
  }

  static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}
