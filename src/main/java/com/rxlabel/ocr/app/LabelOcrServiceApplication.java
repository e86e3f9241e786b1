package com.rxlabel.ocr.app;

import com.rxlabel.ocr.app.config.OcrProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Label OCR Service.
 *
 * <p>Extracts text from medication-label photos and scanned PDFs through a primary cloud OCR
 * provider with a self-hosted fallback. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(OcrProperties.class)
public class LabelOcrServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Label OCR Service application...");
    SpringApplication.run(LabelOcrServiceApplication.class, args);
    log.info("Label OCR Service application started successfully.");
  }
}
