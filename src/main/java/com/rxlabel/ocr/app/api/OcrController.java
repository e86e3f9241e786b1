package com.rxlabel.ocr.app.api;

import com.rxlabel.ocr.app.model.EngineState;
import com.rxlabel.ocr.app.model.ProviderHealth;
import com.rxlabel.ocr.app.model.RecognitionRequest;
import com.rxlabel.ocr.app.model.RecognitionResult;
import com.rxlabel.ocr.app.service.OcrEngine;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Log4j2
@Validated
@RestController
@RequiredArgsConstructor
public class OcrController {

  static final Set<String> IMAGE_EXTENSIONS =
      Set.of("png", "jpg", "jpeg", "bmp", "tiff", "tif", "webp");
  static final Set<String> PDF_EXTENSIONS = Set.of("pdf");

  private final OcrEngine ocrEngine;

  // ------------------------------------------------------------
  // /api/ocr/image
  // ------------------------------------------------------------
  @PostMapping(
      path = "/api/ocr/image",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OcrResponse> image(@RequestPart("file") @NotNull MultipartFile file) {
    byte[] bytes = read(file, IMAGE_EXTENSIONS);
    log.info("api.ocr.image filename={} bytes={}", file.getOriginalFilename(), bytes.length);
    RecognitionResult result =
        ocrEngine.process(RecognitionRequest.image(bytes, extension(file.getOriginalFilename())));
    return ResponseEntity.ok(OcrResponse.ok(result));
  }

  // ------------------------------------------------------------
  // /api/ocr/pdf
  // ------------------------------------------------------------
  @PostMapping(
      path = "/api/ocr/pdf",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OcrResponse> pdf(@RequestPart("file") @NotNull MultipartFile file) {
    byte[] bytes = read(file, PDF_EXTENSIONS);
    log.info("api.ocr.pdf filename={} bytes={}", file.getOriginalFilename(), bytes.length);
    RecognitionResult result = ocrEngine.process(RecognitionRequest.pdf(bytes));
    return ResponseEntity.ok(OcrResponse.ok(result));
  }

  // ------------------------------------------------------------
  // /health
  // ------------------------------------------------------------
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    EngineState state = ocrEngine.state();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", state == EngineState.UNAVAILABLE ? "down" : "ok");
    body.put("ocrEngine", ocrEngine.activeEngine());
    body.put("engineState", state);
    Map<String, ProviderHealth> providers = ocrEngine.health();
    body.put("providers", providers);
    HttpStatus status =
        state == EngineState.UNAVAILABLE ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    return ResponseEntity.status(status).body(body);
  }

  // ============================================================
  // Helpers
  // ============================================================
  static String extension(String filename) {
    return filename == null ? "" : FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
  }

  private static byte[] read(MultipartFile file, Set<String> allowed) {
    if (file == null || file.isEmpty()) {
      throw new InvalidUploadException("No file uploaded");
    }
    String ext = extension(file.getOriginalFilename());
    if (!allowed.contains(ext)) {
      throw new InvalidUploadException(
          "Unsupported file type '"
              + ext
              + "'. Allowed: "
              + String.join(", ", new TreeSet<>(allowed)));
    }
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new InvalidUploadException("Upload could not be read: " + e.getMessage(), e);
    }
  }
}
