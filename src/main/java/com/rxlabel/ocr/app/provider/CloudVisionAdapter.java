package com.rxlabel.ocr.app.provider;

import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.protobuf.ByteString;
import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/** Google Cloud Vision text detection. */
@Log4j2
public class CloudVisionAdapter extends AbstractOcrProvider implements AutoCloseable {

  public static final String ID = "cloud-vision";

  private final ImageAnnotatorClient client;
  private final Feature.Type featureType;

  public CloudVisionAdapter(
      ImageAnnotatorClient client,
      OcrProperties.CloudVision settings,
      RetryExecutor retryExecutor) {
    super(retryExecutor, settings);
    if (client == null) {
      throw new ProviderUnavailableException("Cloud Vision client could not be created");
    }
    this.client = client;
    this.featureType = parseFeature(settings.getFeature());
    log.info("provider.init id={} feature={}", ID, featureType);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String modelName() {
    return "google-vision/" + featureType.name().toLowerCase();
  }

  @Override
  protected String callBackend(byte[] imageBytes) {
    Image img = Image.newBuilder().setContent(ByteString.copyFrom(imageBytes)).build();
    Feature feat = Feature.newBuilder().setType(featureType).build();
    AnnotateImageRequest req =
        AnnotateImageRequest.newBuilder().addFeatures(feat).setImage(img).build();

    BatchAnnotateImagesResponse batch = client.batchAnnotateImages(List.of(req));
    if (batch == null || batch.getResponsesCount() == 0) {
      return null;
    }
    AnnotateImageResponse resp = batch.getResponses(0);
    if (resp.hasError()) {
      throw new IllegalStateException("GCV error: " + resp.getError().getMessage());
    }
    if (resp.hasFullTextAnnotation()) {
      return resp.getFullTextAnnotation().getText();
    }
    if (resp.getTextAnnotationsCount() > 0) {
      return resp.getTextAnnotations(0).getDescription();
    }
    return null;
  }

  @Override
  public void close() {
    client.close();
  }

  private static Feature.Type parseFeature(String feature) {
    if (feature == null || feature.isBlank()) {
      return Feature.Type.DOCUMENT_TEXT_DETECTION;
    }
    try {
      return Feature.Type.valueOf(feature.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new ProviderUnavailableException("unknown ocr.cloud-vision.feature " + feature, e);
    }
  }
}
