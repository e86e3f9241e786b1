package com.rxlabel.ocr.app.provider.local;

import com.rxlabel.ocr.app.config.OcrProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tess4J-backed local OCR. {@link Tesseract} is not thread-safe, so each page worker thread gets
 * its own instance.
 */
@Log4j2
public class TesseractLocalOcr implements LocalOcr {

  private final OcrProperties.Tesseract settings;
  private final ThreadLocal<Tesseract> engines;

  public TesseractLocalOcr(OcrProperties.Tesseract settings) {
    this.settings = settings;
    this.engines = ThreadLocal.withInitial(this::createTesseract);
  }

  @Override
  public String recognizeLocally(byte[] imageBytes) {
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(imageBytes));
    } catch (IOException e) {
      throw new LocalOcrException("could not decode image for Tesseract", e);
    }
    if (image == null) {
      throw new LocalOcrException("unsupported image format for Tesseract");
    }

    try {
      String text = engines.get().doOCR(image);
      return text == null ? "" : text.strip();
    } catch (TesseractException e) {
      throw new LocalOcrException("Tesseract failed: " + e.getMessage(), e);
    } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
      // native library not installed on this host
      throw new LocalOcrException("Tesseract native library unavailable: " + e.getMessage(), e);
    } finally {
      image.flush();
    }
  }

  @Override
  public String name() {
    return "tesseract";
  }

  private Tesseract createTesseract() {
    Tesseract t = new Tesseract();
    String datapath = settings.getDatapath();
    if (datapath != null && !datapath.isBlank()) {
      t.setDatapath(datapath);
    }
    String language = settings.getLanguage();
    if (language != null && !language.isBlank()) {
      t.setLanguage(language);
    }
    t.setVariable("user_defined_dpi", String.valueOf(settings.getDpi()));
    log.debug("tesseract.init thread={} lang={}", Thread.currentThread().getName(), language);
    return t;
  }
}
