package com.rxlabel.ocr.app.provider;

import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.ExhaustedRetriesException;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.provider.local.LocalOcr;
import com.rxlabel.ocr.app.provider.local.LocalOcrException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Self-hosted vision model served by Ollama ({@code POST /api/generate}).
 *
 * <p>This is the engine's permanent fallback. When every network attempt has failed it hands the
 * image to the on-box {@link LocalOcr} before giving up.
 */
@Log4j2
public class LocalModelAdapter extends AbstractOcrProvider {

  public static final String ID = "local-model";

  private final WebClient webClient;
  private final String endpoint;
  private final String model;
  private final String prompt;
  private final LocalOcr localOcr;

  public LocalModelAdapter(
      WebClient.Builder builder,
      OcrProperties.LocalModel settings,
      RetryExecutor retryExecutor,
      LocalOcr localOcr) {
    super(retryExecutor, settings);
    if (settings.getEndpoint() == null || settings.getEndpoint().isBlank()) {
      throw new ProviderUnavailableException("ocr.local-model.endpoint is not set");
    }
    if (settings.getModel() == null || settings.getModel().isBlank()) {
      throw new ProviderUnavailableException("ocr.local-model.model is not set");
    }
    this.endpoint = stripTrailingSlash(settings.getEndpoint().trim());
    this.model = settings.getModel().trim();
    this.prompt = settings.getPrompt();
    this.localOcr = Objects.requireNonNull(localOcr, "localOcr must not be null");
    this.webClient = builder.clone().baseUrl(endpoint).build();
    log.info("provider.init id={} endpoint={} model={}", ID, endpoint, model);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String modelName() {
    return model;
  }

  @Override
  protected String callBackend(byte[] imageBytes) {
    Map<String, Object> body =
        Map.of(
            "model", model,
            "prompt", prompt,
            "images", List.of(Base64.getEncoder().encodeToString(imageBytes)),
            "stream", false);

    Map<String, Object> response =
        webClient
            .post()
            .uri("/api/generate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
            .timeout(callTimeout())
            .block();

    Object text = response == null ? null : response.get("response");
    return text == null ? null : text.toString();
  }

  @Override
  protected String recoverAfterRetries(byte[] imageBytes, ExhaustedRetriesException cause) {
    if (Thread.currentThread().isInterrupted()) {
      log.warn("provider.local-ocr.skip id={} reason=interrupted", ID);
      throw new RecognitionFailedException(ID, cause.getMessage() + "; interrupted", cause);
    }
    log.warn(
        "provider.local-ocr id={} engine={} reason={}", ID, localOcr.name(), cause.getMessage());
    String text;
    try {
      text = localOcr.recognizeLocally(imageBytes);
    } catch (LocalOcrException e) {
      throw new RecognitionFailedException(
          ID, cause.getMessage() + "; local OCR also failed: " + e.getMessage(), cause);
    }
    if (text == null || text.isBlank()) {
      throw new RecognitionFailedException(
          ID, cause.getMessage() + "; local OCR returned no text", cause);
    }
    log.info("provider.local-ocr.ok id={} chars={}", ID, text.length());
    return text.strip();
  }

  String endpoint() {
    return endpoint;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
