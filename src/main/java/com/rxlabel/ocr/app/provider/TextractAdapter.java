package com.rxlabel.ocr.app.provider;

import com.rxlabel.ocr.app.config.OcrProperties;
import com.rxlabel.ocr.app.error.ProviderUnavailableException;
import com.rxlabel.ocr.app.retry.RetryExecutor;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;

/** AWS Textract synchronous {@code DetectDocumentText} on raw image bytes. */
@Log4j2
public class TextractAdapter extends AbstractOcrProvider implements AutoCloseable {

  public static final String ID = "textract";

  private final TextractClient textractClient;

  public TextractAdapter(
      TextractClient textractClient, OcrProperties.Textract settings, RetryExecutor retryExecutor) {
    super(retryExecutor, settings);
    if (textractClient == null) {
      throw new ProviderUnavailableException("Textract client could not be created");
    }
    this.textractClient = textractClient;
    log.info("provider.init id={} region={}", ID, settings.getRegion());
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String modelName() {
    return "aws-textract";
  }

  @Override
  protected String callBackend(byte[] imageBytes) {
    DetectDocumentTextResponse response =
        textractClient.detectDocumentText(
            DetectDocumentTextRequest.builder()
                .document(Document.builder().bytes(SdkBytes.fromByteArray(imageBytes)).build())
                .build());

    if (response == null || !response.hasBlocks()) {
      return null;
    }
    return response.blocks().stream()
        .filter(b -> b.blockType() == BlockType.LINE)
        .map(Block::text)
        .filter(t -> t != null && !t.isBlank())
        .collect(Collectors.joining("\n"));
  }

  @Override
  public void close() {
    textractClient.close();
  }
}
