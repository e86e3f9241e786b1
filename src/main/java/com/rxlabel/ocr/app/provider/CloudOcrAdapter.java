package com.rxlabel.ocr.app.provider;

import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/** OCR.space REST API ({@code POST /parse/image}, multipart upload). */
@Log4j2
public class CloudOcrAdapter extends AbstractOcrProvider {

  public static final String ID = "cloud-ocr";
  static final String MODEL_NAME = "ocr.space";

  private final WebClient webClient;
  private final String apiKey;
  private final String language;

  public CloudOcrAdapter(
      WebClient.Builder builder, OcrProperties.CloudOcr settings, RetryExecutor retryExecutor) {
    super(retryExecutor, settings);
    if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
      throw new ProviderUnavailableException("ocr.cloud-ocr.api-key is not set");
    }
    if (settings.getEndpoint() == null || settings.getEndpoint().isBlank()) {
      throw new ProviderUnavailableException("ocr.cloud-ocr.endpoint is not set");
    }
    this.apiKey = settings.getApiKey().trim();
    this.language = settings.getLanguage();
    this.webClient = builder.clone().baseUrl(settings.getEndpoint().trim()).build();
    log.info("provider.init id={} endpoint={} language={}", ID, settings.getEndpoint(), language);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String modelName() {
    return MODEL_NAME;
  }

  @Override
  protected String callBackend(byte[] imageBytes) {
    ByteArrayResource file =
        new ByteArrayResource(imageBytes) {
          @Override
          public String getFilename() {
            return "label.png";
          }
        };

    MultipartBodyBuilder parts = new MultipartBodyBuilder();
    parts.part("file", file).contentType(MediaType.IMAGE_PNG);
    parts.part("apikey", apiKey);
    parts.part("language", language);
    parts.part("isOverlayRequired", "false");

    Map<String, Object> response =
        webClient
            .post()
            .uri("/parse/image")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(parts.build()))
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
            .timeout(callTimeout())
            .block();

    return parse(response);
  }

  /** Pulls {@code ParsedText} out of an OCR.space reply; errors flagged in the body throw. */
  static String parse(Map<String, Object> response) {
    if (response == null) {
      return null;
    }
    if (Boolean.TRUE.equals(response.get("IsErroredOnProcessing"))) {
      throw new IllegalStateException(
          "OCR.space processing error: " + Objects.toString(response.get("ErrorMessage"), ""));
    }
    Object parsed = response.get("ParsedResults");
    if (!(parsed instanceof List<?>)) {
      return null;
    }
    return ((List<?>) parsed)
        .stream()
        .filter(Map.class::isInstance)
        .map(r -> Objects.toString(((Map<?, ?>) r).get("ParsedText"), ""))
        .collect(Collectors.joining("\n"));
  }
}
