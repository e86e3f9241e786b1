package com.rxlabel.ocr.app.pdf;

import com.rxlabel.ocr.app.error.ConversionFailedException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/** PDFBox renderer producing PNG page images. */
@Log4j2
public class PdfBoxPageRasterizer implements PageRasterizer {

  @Override
  public List<byte[]> rasterize(byte[] pdfBytes, int dpi) {
    if (pdfBytes == null || pdfBytes.length == 0) {
      throw new ConversionFailedException("PDF is empty");
    }
    long t0 = System.nanoTime();

    try (PDDocument document = PDDocument.load(pdfBytes)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int pageCount = document.getNumberOfPages();
      if (pageCount == 0) {
        throw new ConversionFailedException("PDF has no pages");
      }

      List<byte[]> pages = new ArrayList<>(pageCount);
      for (int i = 0; i < pageCount; i++) {
        BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
        try {
          ByteArrayOutputStream baos = new ByteArrayOutputStream();
          ImageIO.write(image, "png", baos);
          pages.add(baos.toByteArray());
        } finally {
          image.flush();
        }
      }

      log.info(
          "pdf.rasterize pages={} dpi={} durationMs={}",
          pageCount,
          dpi,
          (System.nanoTime() - t0) / 1_000_000);
      return pages;

    } catch (IOException | RuntimeException e) {
      if (e instanceof ConversionFailedException) {
        throw (ConversionFailedException) e;
      }
      log.warn("pdf.rasterize.failed msg={}", e.getMessage());
      throw new ConversionFailedException(
          "Document could not be parsed as PDF: " + e.getMessage(), e);
    }
  }
}
