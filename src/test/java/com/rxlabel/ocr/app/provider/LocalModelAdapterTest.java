package com.rxlabel.ocr.app.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.ErrorKind;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.provider.local.LocalOcr;
import com.rxlabel.ocr.app.provider.local.LocalOcrException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

class LocalModelAdapterTest {

  private static final byte[] IMAGE = {1, 2, 3, 4};

  private final List<Duration> waits = new ArrayList<>();
  private final RetryExecutor retryExecutor =
      new RetryExecutor(
          retry -> retry.getEventPublisher().onRetry(e -> waits.add(e.getWaitInterval())));
  private final LocalOcr localOcr = mock(LocalOcr.class);
  private OcrProperties.LocalModel settings;

  @BeforeEach
  void setUp() {
    settings = new OcrProperties.LocalModel();
    settings.setEndpoint("http://ollama.test:11434/");
    settings.setModel("glm-ocr:latest");
    settings.setRetryDelay(Duration.ofMillis(5));
    when(localOcr.name()).thenReturn("tesseract");
  }

  @Test
  void success_returnsResponseFieldStripped() {
    StubExchange stub =
        StubExchange.create().json(HttpStatus.OK, "{\"response\":\"  Ibuprofen 200mg \\n\"}");
    LocalModelAdapter adapter = adapter(stub);

    String text = adapter.recognizeImage(IMAGE);

    assertEquals("Ibuprofen 200mg", text);
    assertEquals(1, stub.requests().size());
    assertEquals(HttpMethod.POST, stub.requests().get(0).method());
    assertEquals(
        "http://ollama.test:11434/api/generate", stub.requests().get(0).url().toString());
    verify(localOcr, never()).recognizeLocally(any());
  }

  @Test
  void serverErrors_areRetriedThenLocalOcrIsUsed() {
    StubExchange stub =
        StubExchange.create().json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}");
    when(localOcr.recognizeLocally(IMAGE)).thenReturn("BATCH AB-2024-123456\n");
    LocalModelAdapter adapter = adapter(stub);

    String text = adapter.recognizeImage(IMAGE);

    assertEquals("BATCH AB-2024-123456", text);
    assertEquals(3, stub.requests().size());
    assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(10)), waits);
    assertEquals("glm-ocr:latest", adapter.modelName());
  }

  @Test
  void emptyResponse_isRetried() {
    StubExchange stub =
        StubExchange.create()
            .json(HttpStatus.OK, "{\"response\":\"   \"}")
            .json(HttpStatus.OK, "{\"response\":\"Amoxicillin\"}");
    LocalModelAdapter adapter = adapter(stub);

    assertEquals("Amoxicillin", adapter.recognizeImage(IMAGE));
    assertEquals(2, stub.requests().size());
  }

  @Test
  void modelAndLocalOcrBothFailing_isRecognitionFailed() {
    StubExchange stub = StubExchange.create().json(HttpStatus.SERVICE_UNAVAILABLE, "{}");
    when(localOcr.recognizeLocally(IMAGE)).thenThrow(new LocalOcrException("no tessdata"));
    LocalModelAdapter adapter = adapter(stub);

    RecognitionFailedException ex =
        assertThrows(RecognitionFailedException.class, () -> adapter.recognizeImage(IMAGE));

    assertEquals(ErrorKind.RECOGNITION_FAILED, ex.getKind());
    assertEquals(LocalModelAdapter.ID, ex.getProviderId());
    assertTrue(ex.getMessage().contains("no tessdata"), ex.getMessage());
  }

  @Test
  void blankLocalOcrText_isRecognitionFailed() {
    StubExchange stub = StubExchange.create().json(HttpStatus.BAD_GATEWAY, "{}");
    when(localOcr.recognizeLocally(IMAGE)).thenReturn("  ");
    LocalModelAdapter adapter = adapter(stub);

    assertThrows(RecognitionFailedException.class, () -> adapter.recognizeImage(IMAGE));
  }

  @Test
  void interruptedCaller_skipsRetriesAndLocalOcr() {
    StubExchange stub = StubExchange.create().json(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
    LocalModelAdapter adapter = adapter(stub);

    Thread.currentThread().interrupt();
    try {
      assertThrows(RecognitionFailedException.class, () -> adapter.recognizeImage(IMAGE));

      assertTrue(stub.requests().size() <= 1, "requests: " + stub.requests().size());
      assertTrue(waits.isEmpty());
      verify(localOcr, never()).recognizeLocally(any());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void blankEndpoint_isProviderUnavailable() {
    settings.setEndpoint(" ");

    assertThrows(
        ProviderUnavailableException.class,
        () -> adapter(StubExchange.create()));
  }

  @Test
  void trailingSlash_isStrippedFromEndpoint() {
    LocalModelAdapter adapter = adapter(StubExchange.create());

    assertEquals("http://ollama.test:11434", adapter.endpoint());
    assertEquals("glm-ocr:latest", adapter.modelName());
    assertEquals(Duration.ofSeconds(120), adapter.callTimeout());
  }

  private LocalModelAdapter adapter(StubExchange stub) {
    return new LocalModelAdapter(stub.builder(), settings, retryExecutor, localOcr);
  }
}
