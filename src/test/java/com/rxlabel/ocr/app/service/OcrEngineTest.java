package com.rxlabel.ocr.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rxlabel.ocr.app.cache.ResultCache;
import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.AllEnginesFailedException;
import com.rxlabel.ocr.app.error.ConversionFailedException;
import com.rxlabel.ocr.app.error.ErrorKind;
import com.rxlabel.ocr.app.error.NoEngineAvailableException;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.model.EngineState;
import com.rxlabel.ocr.app.model.PageTask;
import com.rxlabel.ocr.app.pdf.PageRasterizer;
import com.rxlabel.ocr.app.pdf.PageScheduler;
import com.rxlabel.ocr.app.preprocess.PassThroughPreprocessor;
import com.rxlabel.ocr.app.provider.CloudOcrAdapter;
import com.rxlabel.ocr.app.provider.LocalModelAdapter;
import com.rxlabel.ocr.app.provider.OcrProvider;
import com.rxlabel.ocr.app.provider.StubExchange;
import com.rxlabel.ocr.app.provider.local.DisabledLocalOcr;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class OcrEngineTest {

  private static final byte[] IMAGE = "label-photo".getBytes(StandardCharsets.UTF_8);
  private static final String SEP = PageScheduler.PAGE_SEPARATOR;

  private final RecognitionPipeline pipeline =
      new RecognitionPipeline(new PassThroughPreprocessor(), new ResultCache());

  // ------------------------------------------------------------
  // Selection
  // ------------------------------------------------------------

  @Test
  void firstConstructibleCloudProvider_isPrimary() {
    OcrEngine engine =
        new OcrEngine(
            List.of(
                unavailable("cloud-vision", "ocr.cloud-vision.credentials-path is not set"),
                candidate(fake("cloud-ocr", img -> "x")),
                candidate(fake("textract", img -> "y"))),
            candidate(fake("local-model", img -> "z")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    assertEquals(EngineState.READY, engine.state());
    assertEquals("cloud-ocr", engine.activeEngine());
    assertFalse(engine.health().get("cloud-vision").isAvailable());
    assertEquals(
        "ocr.cloud-vision.credentials-path is not set",
        engine.health().get("cloud-vision").getLastError());
    assertTrue(engine.health().get("cloud-ocr").isAvailable());
    assertFalse(engine.health().get("textract").isAvailable());
    assertTrue(engine.health().get("local-model").isAvailable());
  }

  @Test
  void laterCloudCandidates_areNotBuiltOncePrimaryIsChosen() {
    AtomicInteger textractBuilds = new AtomicInteger();
    new OcrEngine(
        List.of(
            candidate(fake("cloud-vision", img -> "x")),
            ProviderCandidate.of(
                "textract",
                () -> {
                  textractBuilds.incrementAndGet();
                  return fake("textract", img -> "y");
                })),
        candidate(fake("local-model", img -> "z")),
        pipeline,
        scheduler(1),
        Duration.ZERO);

    assertEquals(0, textractBuilds.get());
  }

  @Test
  void onlyLocalModel_isDegraded() {
    OcrEngine engine =
        new OcrEngine(
            List.of(unavailable("cloud-vision", "no key"), unavailable("cloud-ocr", "no key")),
            candidate(fake("local-model", img -> "Aspirin 81 mg")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    assertEquals(EngineState.DEGRADED, engine.state());
    assertEquals("local-model", engine.activeEngine());
    assertEquals("fallback", engine.processImage(IMAGE).getEngineUsed());
  }

  @Test
  void nothingConstructible_failsFastWithoutCallingAnyone() {
    OcrEngine engine =
        new OcrEngine(
            List.of(unavailable("cloud-vision", "no key")),
            unavailable("local-model", "ocr.local-model.endpoint is not set"),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    assertEquals(EngineState.UNAVAILABLE, engine.state());
    assertEquals(OcrEngine.NONE, engine.activeEngine());
    NoEngineAvailableException ex =
        assertThrows(NoEngineAvailableException.class, () -> engine.processImage(IMAGE));
    assertEquals(ErrorKind.NO_ENGINE_AVAILABLE, ex.getKind());
    assertThrows(NoEngineAvailableException.class, () -> engine.processPdf(new byte[] {1}));
  }

  // ------------------------------------------------------------
  // Images
  // ------------------------------------------------------------

  @Test
  void primarySuccess_isTaggedPrimary() {
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(fake("cloud-vision", img -> "Omeprazole 20 mg"))),
            candidate(fake("local-model", img -> "unused")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    var result = engine.processImage(IMAGE);

    assertEquals("Omeprazole 20 mg", result.getExtractedText());
    assertEquals("primary", result.getEngineUsed());
    assertEquals("cloud-vision", result.getProvider());
    assertEquals("cloud-vision-model", result.getModelName());
    assertNull(result.getPagesProcessed());
    assertTrue(result.getProcessingTimeMs() >= 0);
  }

  @Test
  void primaryHttp500OnEveryAttempt_failsOverToFallback() {
    RetryExecutor retry = new RetryExecutor();

    OcrProperties.CloudOcr cloudSettings = new OcrProperties.CloudOcr();
    cloudSettings.setApiKey("k");
    cloudSettings.setRetryDelay(Duration.ofMillis(1));
    StubExchange cloud =
        StubExchange.create().json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"down\"}");

    OcrProperties.LocalModel localSettings = new OcrProperties.LocalModel();
    StubExchange local =
        StubExchange.create().json(HttpStatus.OK, "{\"response\":\"BATCH AB-2024-123456\"}");

    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(new CloudOcrAdapter(cloud.builder(), cloudSettings, retry))),
            candidate(
                new LocalModelAdapter(
                    local.builder(), localSettings, retry, new DisabledLocalOcr())),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    var result = engine.processImage(IMAGE);

    assertEquals(3, cloud.requests().size());
    assertEquals(1, local.requests().size());
    assertEquals("fallback", result.getEngineUsed());
    assertEquals("local-model", result.getProvider());
    assertEquals("BATCH AB-2024-123456", result.getExtractedText());
  }

  @Test
  void bothFailing_listsBothCauses() {
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(failing("cloud-vision", "quota exceeded"))),
            candidate(failing("local-model", "connection refused")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    AllEnginesFailedException ex =
        assertThrows(AllEnginesFailedException.class, () -> engine.processImage(IMAGE));

    assertEquals(ErrorKind.ALL_ENGINES_FAILED, ex.getKind());
    assertEquals(2, ex.getCauses().size());
    assertEquals(
        "All OCR engines failed. Errors: cloud-vision: quota exceeded | local-model: connection"
            + " refused",
        ex.getMessage());
  }

  @Test
  void unexpectedRuntimeFailure_alsoTriggersFailover() {
    OcrEngine engine =
        new OcrEngine(
            List.of(
                candidate(
                    fake(
                        "cloud-vision",
                        img -> {
                          throw new IllegalStateException("bug");
                        }))),
            candidate(fake("local-model", img -> "Salbutamol")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    assertEquals("fallback", engine.processImage(IMAGE).getEngineUsed());
  }

  @Test
  void successfulText_isCachedAcrossProviders() {
    AtomicInteger calls = new AtomicInteger();
    OcrEngine engine =
        new OcrEngine(
            List.of(
                candidate(
                    fake(
                        "cloud-vision",
                        img -> {
                          calls.incrementAndGet();
                          return "Levothyroxine";
                        }))),
            candidate(fake("local-model", img -> "unused")),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    engine.processImage(IMAGE);
    engine.processImage(IMAGE);

    assertEquals(1, calls.get());
  }

  // ------------------------------------------------------------
  // PDFs
  // ------------------------------------------------------------

  @Test
  void pdf_joinsPagesAndCountsThem() {
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(fake("cloud-vision", img -> "page-" + img[0]))),
            candidate(fake("local-model", img -> "unused")),
            pipeline,
            scheduler(3),
            Duration.ZERO);

    var result = engine.processPdf(new byte[] {42});

    assertEquals("page-0" + SEP + "page-1" + SEP + "page-2", result.getExtractedText());
    assertEquals(3, result.getPagesProcessed());
    assertEquals("primary", result.getEngineUsed());
  }

  @Test
  void pdfWithOneSlowPage_keepsOtherPages() {
    OcrEngine engine =
        new OcrEngine(
            List.of(
                candidate(
                    fake(
                        "cloud-vision",
                        Duration.ofMillis(200),
                        img -> {
                          if (img[0] == 1) {
                            sleep(10_000);
                          }
                          return "text " + (img[0] + 1);
                        }))),
            candidate(fake("local-model", img -> "unused")),
            pipeline,
            scheduler(3),
            Duration.ofMillis(100));

    var result = engine.processPdf(new byte[] {7});

    assertEquals(
        "text 1" + SEP + "[Page 2: timeout]" + SEP + "text 3", result.getExtractedText());
    assertEquals(3, result.getPagesProcessed());
    assertEquals("primary", result.getEngineUsed());
  }

  @Test
  void pdfWhereEveryPageFails_failsOver() {
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(failing("cloud-vision", "down"))),
            candidate(fake("local-model", img -> "local " + img[0])),
            pipeline,
            scheduler(2),
            Duration.ZERO);

    var result = engine.processPdf(new byte[] {7});

    assertEquals("fallback", result.getEngineUsed());
    assertEquals("local 0" + SEP + "local 1", result.getExtractedText());
  }

  @Test
  void pdfWhosePagesTimeOutEverywhere_returnsMarkersFromFallback() {
    Function<byte[], String> hang =
        img -> {
          sleep(10_000);
          return "never";
        };
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(fake("cloud-vision", Duration.ofMillis(100), hang))),
            candidate(fake("local-model", Duration.ofMillis(100), hang)),
            pipeline,
            scheduler(1),
            Duration.ZERO);

    var result = engine.processPdf(new byte[] {3});

    assertEquals("[Page 1: timeout]", result.getExtractedText());
    assertEquals(1, result.getPagesProcessed());
    assertEquals("fallback", result.getEngineUsed());
    assertEquals("local-model", result.getProvider());
  }

  @Test
  void pdfWithoutFallback_keepsErrorMarkersFromPrimary() {
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(failing("cloud-vision", "quota exceeded"))),
            null,
            pipeline,
            scheduler(2),
            Duration.ZERO);

    var result = engine.processPdf(new byte[] {5});

    assertEquals("[Page 1: error]" + SEP + "[Page 2: error]", result.getExtractedText());
    assertEquals(2, result.getPagesProcessed());
    assertEquals("primary", result.getEngineUsed());
  }

  @Test
  void unreadablePdf_isConversionFailedWithoutFailover() {
    AtomicInteger calls = new AtomicInteger();
    PageRasterizer broken =
        (bytes, dpi) -> {
          throw new ConversionFailedException("Document could not be parsed as PDF: junk");
        };
    OcrEngine engine =
        new OcrEngine(
            List.of(candidate(fake("cloud-vision", img -> "x" + calls.incrementAndGet()))),
            candidate(fake("local-model", img -> "y" + calls.incrementAndGet())),
            pipeline,
            new PageScheduler(broken, 2, 150),
            Duration.ZERO);

    ConversionFailedException ex =
        assertThrows(ConversionFailedException.class, () -> engine.processPdf(new byte[] {1}));

    assertEquals(ErrorKind.CONVERSION_FAILED, ex.getKind());
    assertEquals(0, calls.get());
  }

  @Test
  void close_closesCloseableProviders() {
    CloseableFake primary = new CloseableFake();
    OcrEngine engine =
        new OcrEngine(List.of(candidate(primary)), null, pipeline, scheduler(1), Duration.ZERO);

    engine.close();

    assertTrue(primary.closed);
    assertSame(EngineState.READY, engine.state());
  }

  // ------------------------------------------------------------
  // Fixtures
  // ------------------------------------------------------------

  private static ProviderCandidate candidate(OcrProvider provider) {
    return ProviderCandidate.of(provider.id(), () -> provider);
  }

  private static ProviderCandidate unavailable(String id, String reason) {
    return ProviderCandidate.of(
        id,
        () -> {
          throw new ProviderUnavailableException(reason);
        });
  }

  private static PageScheduler scheduler(int pages) {
    return new PageScheduler(
        (bytes, dpi) -> {
          List<byte[]> out = new ArrayList<>();
          for (int i = 0; i < pages; i++) {
            out.add(new byte[] {(byte) i});
          }
          return out;
        },
        4,
        150);
  }

  private static OcrProvider fake(String id, Function<byte[], String> fn) {
    return fake(id, Duration.ofSeconds(5), fn);
  }

  private static OcrProvider fake(String id, Duration timeout, Function<byte[], String> fn) {
    return new OcrProvider() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public String modelName() {
        return id + "-model";
      }

      @Override
      public Duration callTimeout() {
        return timeout;
      }

      @Override
      public String recognizeImage(byte[] imageBytes) {
        return fn.apply(imageBytes);
      }
    };
  }

  private static OcrProvider failing(String id, String message) {
    return fake(
        id,
        img -> {
          throw new RecognitionFailedException(id, message, null);
        });
  }

  private static void sleep(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", e);
    }
  }

  private static final class CloseableFake implements OcrProvider, AutoCloseable {
    private boolean closed;

    @Override
    public String id() {
      return "cloud-vision";
    }

    @Override
    public String modelName() {
      return "fake";
    }

    @Override
    public Duration callTimeout() {
      return Duration.ofSeconds(1);
    }

    @Override
    public String recognizeImage(byte[] imageBytes) {
      return "text";
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
