package com.rxlabel.ocr.app.preprocess;

import lombok.extern.log4j.Log4j2;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * OpenCV implementation of {@link ImagePreprocessor}.
 *
 * <ol>
 *   <li>Decode; undecodable input is passed through untouched.
 *   <li>Reduce to one 8-bit grey channel.
 *   <li>Downscale with {@code INTER_AREA} when wider than {@code maxWidth}, keeping aspect ratio.
 *   <li>Binarize with a mean adaptive threshold, but only when the grey-level standard deviation
 *       is above {@code stddevCutoff}; near-monochrome scans are left alone.
 *   <li>Encode as PNG.
 * </ol>
 *
 * <p>Call {@link #loadNativeLibrary()} once before the first instance is used.
 */
@Log4j2
public class OpenCvImagePreprocessor implements ImagePreprocessor {

  public static final int DEFAULT_MAX_WIDTH = 1600;
  public static final double DEFAULT_STDDEV_CUTOFF = 40.0;

  private final int maxWidth;
  private final double stddevCutoff;
  private final int blockSize;
  private final int offset;

  public OpenCvImagePreprocessor() {
    this(DEFAULT_MAX_WIDTH, DEFAULT_STDDEV_CUTOFF, 11, 2);
  }

  public OpenCvImagePreprocessor(int maxWidth, double stddevCutoff, int blockSize, int offset) {
    if (maxWidth < 1) throw new IllegalArgumentException("maxWidth must be positive");
    if (blockSize < 3 || blockSize % 2 == 0) {
      throw new IllegalArgumentException("blockSize must be odd and >= 3, got " + blockSize);
    }
    this.maxWidth = maxWidth;
    this.stddevCutoff = stddevCutoff;
    this.blockSize = blockSize;
    this.offset = offset;
  }

  /**
   * Extracts and loads the native library bundled with the OpenCV jar.
   *
   * @throws UnsatisfiedLinkError when no native build matches this platform
   */
  public static void loadNativeLibrary() {
    nu.pattern.OpenCV.loadLocally();
    log.info("preprocess.opencv.loaded version={}", Core.VERSION);
  }

  @Override
  public byte[] preprocess(byte[] raw) {
    if (raw == null || raw.length == 0) {
      return raw;
    }
    MatOfByte encoded = null;
    Mat decoded = null;
    Mat gray = null;
    Mat resized = null;
    Mat binary = null;
    MatOfDouble mean = null;
    MatOfDouble std = null;
    MatOfByte png = null;

    try {
      encoded = new MatOfByte(raw);
      decoded = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_ANYCOLOR);
      if (decoded.empty()) {
        log.debug("preprocess.skip reason=undecodable bytes={}", raw.length);
        return raw;
      }

      gray = new Mat();
      if (decoded.channels() > 1) {
        Imgproc.cvtColor(decoded, gray, Imgproc.COLOR_BGR2GRAY);
      } else {
        decoded.copyTo(gray);
      }

      Mat current = gray;
      if (gray.cols() > maxWidth) {
        int height = Math.max(1, (int) Math.round((double) gray.rows() * maxWidth / gray.cols()));
        resized = new Mat();
        Imgproc.resize(gray, resized, new Size(maxWidth, height), 0, 0, Imgproc.INTER_AREA);
        current = resized;
      }

      mean = new MatOfDouble();
      std = new MatOfDouble();
      Core.meanStdDev(current, mean, std);
      double stddev = std.get(0, 0)[0];
      boolean binarize = stddev > stddevCutoff;
      if (binarize) {
        binary = new Mat();
        Imgproc.adaptiveThreshold(
            current,
            binary,
            255,
            Imgproc.ADAPTIVE_THRESH_MEAN_C,
            Imgproc.THRESH_BINARY,
            blockSize,
            offset);
        current = binary;
      }

      png = new MatOfByte();
      if (!Imgcodecs.imencode(".png", current, png)) {
        log.warn("preprocess.skip reason=encode-failed");
        return raw;
      }
      log.debug(
          "preprocess.ok in={}x{} out={}x{} stddev={} binarized={}",
          decoded.cols(),
          decoded.rows(),
          current.cols(),
          current.rows(),
          String.format("%.1f", stddev),
          binarize);
      return png.toArray();
    } catch (RuntimeException e) {
      log.warn("preprocess.skip reason=error msg={}", e.getMessage());
      return raw;
    } finally {
      release(encoded, decoded, gray, resized, binary, mean, std, png);
    }
  }

  private static void release(Mat... mats) {
    for (Mat m : mats) {
      if (m != null) {
        m.release();
      }
    }
  }
}
