package com.rxlabel.ocr.app.config;

import com.google.api.gax.retrying.RetrySettings;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.rxlabel.ocr.app.cache.ResultCache;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.pdf.PageRasterizer;
import com.rxlabel.ocr.app.pdf.PageScheduler;
import com.rxlabel.ocr.app.pdf.PdfBoxPageRasterizer;
import com.rxlabel.ocr.app.preprocess.ImagePreprocessor;
import com.rxlabel.ocr.app.preprocess.OpenCvImagePreprocessor;
import com.rxlabel.ocr.app.preprocess.PassThroughPreprocessor;
import com.rxlabel.ocr.app.provider.CloudOcrAdapter;
import com.rxlabel.ocr.app.provider.CloudVisionAdapter;
import com.rxlabel.ocr.app.provider.LocalModelAdapter;
import com.rxlabel.ocr.app.provider.TextractAdapter;
import com.rxlabel.ocr.app.provider.local.DisabledLocalOcr;
import com.rxlabel.ocr.app.provider.local.LocalOcr;
import com.rxlabel.ocr.app.provider.local.TesseractLocalOcr;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import com.rxlabel.ocr.app.service.OcrEngine;
import com.rxlabel.ocr.app.service.ProviderCandidate;
import com.rxlabel.ocr.app.service.RecognitionPipeline;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * Wires the OCR engine from {@link OcrProperties}.
 *
 * <p>Cloud providers are offered to the engine as candidates in priority order: Cloud Vision,
 * OCR.space, then Textract. A candidate that lacks its credential throws {@link
 * ProviderUnavailableException} and the engine moves on to the next one. Client libraries make a
 * single attempt per call; retries happen in {@link RetryExecutor}.
 */
@Log4j2
@Configuration
@RequiredArgsConstructor
public class OcrEngineConfig {

  private final OcrProperties props;

  // -------------------
  // Building blocks
  // -------------------

  @Bean
  public ResultCache resultCache() {
    return new ResultCache(props.getEngine().getCacheCapacity());
  }

  @Bean
  public ImagePreprocessor imagePreprocessor() {
    OcrProperties.Preprocess p = props.getPreprocess();
    if (!p.isEnabled()) {
      log.info("preprocess.disabled");
      return new PassThroughPreprocessor();
    }
    try {
      OpenCvImagePreprocessor.loadNativeLibrary();
    } catch (RuntimeException | LinkageError e) {
      log.warn("preprocess.opencv.unavailable msg={} (images are sent as uploaded)", e.toString());
      return new PassThroughPreprocessor();
    }
    return new OpenCvImagePreprocessor(
        p.getMaxWidth(), p.getBinarizeStddevCutoff(), p.getBlockSize(), p.getOffset());
  }

  @Bean
  public RetryExecutor retryExecutor() {
    return new RetryExecutor();
  }

  @Bean
  public LocalOcr localOcr() {
    if (!props.getTesseract().isEnabled()) {
      log.info("tesseract.disabled");
      return new DisabledLocalOcr();
    }
    return new TesseractLocalOcr(props.getTesseract());
  }

  @Bean
  public PageRasterizer pageRasterizer() {
    return new PdfBoxPageRasterizer();
  }

  @Bean
  public PageScheduler pageScheduler(PageRasterizer pageRasterizer) {
    OcrProperties.Engine e = props.getEngine();
    return new PageScheduler(pageRasterizer, e.getWorkers(), e.getRenderDpi());
  }

  @Bean
  public RecognitionPipeline recognitionPipeline(
      ImagePreprocessor imagePreprocessor, ResultCache resultCache) {
    return new RecognitionPipeline(imagePreprocessor, resultCache);
  }

  // -------------------
  // Engine
  // -------------------

  @Bean(destroyMethod = "close")
  public OcrEngine ocrEngine(
      WebClient.Builder webClientBuilder,
      RetryExecutor retryExecutor,
      LocalOcr localOcr,
      RecognitionPipeline recognitionPipeline,
      PageScheduler pageScheduler) {

    List<ProviderCandidate> cloudCandidates =
        List.of(
            ProviderCandidate.of(
                CloudVisionAdapter.ID,
                () ->
                    new CloudVisionAdapter(
                        imageAnnotatorClient(props.getCloudVision()),
                        props.getCloudVision(),
                        retryExecutor)),
            ProviderCandidate.of(
                CloudOcrAdapter.ID,
                () -> new CloudOcrAdapter(webClientBuilder, props.getCloudOcr(), retryExecutor)),
            ProviderCandidate.of(
                TextractAdapter.ID,
                () ->
                    new TextractAdapter(
                        textractClient(props.getTextract()), props.getTextract(), retryExecutor)));

    ProviderCandidate localCandidate =
        ProviderCandidate.of(
            LocalModelAdapter.ID,
            () ->
                new LocalModelAdapter(
                    webClientBuilder, props.getLocalModel(), retryExecutor, localOcr));

    return new OcrEngine(
        cloudCandidates,
        localCandidate,
        recognitionPipeline,
        pageScheduler,
        props.getEngine().getPageTimeoutGrace());
  }

  // -------------------
  // Cloud clients
  // -------------------

  static ImageAnnotatorClient imageAnnotatorClient(OcrProperties.CloudVision settings) {
    String path = settings.getCredentialsPath();
    if (!OcrProperties.notBlank(path)) {
      throw new ProviderUnavailableException("ocr.cloud-vision.credentials-path is not set");
    }
    try (InputStream in = Files.newInputStream(Path.of(path.trim()))) {
      GoogleCredentials credentials = GoogleCredentials.fromStream(in);
      ImageAnnotatorSettings.Builder builder =
          ImageAnnotatorSettings.newBuilder().setCredentialsProvider(() -> credentials);
      builder
          .batchAnnotateImagesSettings()
          .setRetrySettings(
              singleAttempt(
                  builder.batchAnnotateImagesSettings().getRetrySettings(),
                  settings.getTimeout()));
      return ImageAnnotatorClient.create(builder.build());
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "Cloud Vision credentials could not be loaded from " + path + ": " + e.getMessage(), e);
    }
  }

  /** One gRPC attempt per adapter attempt, bounded by the provider call timeout. */
  static RetrySettings singleAttempt(RetrySettings defaults, Duration timeout) {
    org.threeten.bp.Duration deadline = org.threeten.bp.Duration.ofMillis(timeout.toMillis());
    return defaults.toBuilder()
        .setMaxAttempts(1)
        .setInitialRpcTimeout(deadline)
        .setMaxRpcTimeout(deadline)
        .setRpcTimeoutMultiplier(1.0)
        .setTotalTimeout(deadline)
        .build();
  }

  static TextractClient textractClient(OcrProperties.Textract settings) {
    if (!settings.isEnabled() && !settings.hasStaticCredentials()) {
      throw new ProviderUnavailableException(
          "ocr.textract is disabled and no access keys are set");
    }
    AwsCredentialsProvider credentials =
        settings.hasStaticCredentials()
            ? StaticCredentialsProvider.create(
                AwsBasicCredentials.create(
                    settings.getAccessKeyId().trim(), settings.getSecretAccessKey().trim()))
            : DefaultCredentialsProvider.create();

    return TextractClient.builder()
        .region(Region.of(settings.getRegion()))
        .credentialsProvider(credentials)
        .overrideConfiguration(
            c -> c.apiCallTimeout(settings.getTimeout()).retryPolicy(RetryPolicy.none()))
        .build();
  }
}
