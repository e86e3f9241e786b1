package com.rxlabel.ocr.app.pdf;

import com.rxlabel.ocr.app.error.ConversionFailedException;
import com.rxlabel.ocr.app.error.OcrException;
import com.rxlabel.ocr.app.error.PageTimeoutException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.model.PageTask;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Splits a PDF into page images and recognizes them on a bounded, per-document worker pool.
 *
 * <p>Results come back in original page order whatever order the workers finish in. Each page has
 * its own deadline, counted from the moment a worker picks it up; a page that misses it, or whose
 * recognition fails, is replaced by an inline marker and the other pages are kept.
 */
@Log4j2
public class PageScheduler {

  public static final String PAGE_SEPARATOR = "\n--- Page Break ---\n";

  private final PageRasterizer rasterizer;
  private final int workers;
  private final int dpi;

  public PageScheduler(PageRasterizer rasterizer, int workers, int dpi) {
    this.rasterizer = Objects.requireNonNull(rasterizer, "rasterizer must not be null");
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1, got " + workers);
    }
    this.workers = workers;
    this.dpi = dpi;
  }

  /** Rasterize then recognize. Conversion failures propagate untouched. */
  public PageResults processPdf(byte[] pdfBytes, PageRecognizer recognizer, Duration pageTimeout) {
    return recognizePages(rasterize(pdfBytes), recognizer, pageTimeout);
  }

  public List<PageTask> rasterize(byte[] pdfBytes) {
    List<byte[]> images = rasterizer.rasterize(pdfBytes, dpi);
    if (images == null || images.isEmpty()) {
      throw new ConversionFailedException("PDF produced no pages");
    }
    List<PageTask> tasks = new ArrayList<>(images.size());
    for (int i = 0; i < images.size(); i++) {
      tasks.add(new PageTask(i, images.get(i)));
    }
    return tasks;
  }

  public PageResults recognizePages(
      List<PageTask> pages, PageRecognizer recognizer, Duration pageTimeout) {
    int n = pages.size();
    int poolSize = Math.min(workers, n);
    long timeoutNanos = pageTimeout.toNanos();
    // a page can only start once earlier ones have finished or timed out
    long startWaitNanos = timeoutNanos * (n + 1);

    String[] slots = new String[n];
    Map<Integer, OcrException> failures = new LinkedHashMap<>();

    ThreadPoolTaskExecutor pool = newPool(poolSize, n);
    try {
      List<CompletableFuture<Long>> started = new ArrayList<>(n);
      List<Future<String>> futures = new ArrayList<>(n);
      long submittedAt = System.nanoTime();

      for (PageTask page : pages) {
        CompletableFuture<Long> startSignal = new CompletableFuture<>();
        started.add(startSignal);
        futures.add(
            pool.submit(
                () -> {
                  startSignal.complete(System.nanoTime());
                  return recognizer.recognize(page);
                }));
      }

      for (int i = 0; i < n; i++) {
        PageTask page = pages.get(i);
        Future<String> future = futures.get(i);
        try {
          long startWait = Math.max(0, submittedAt + startWaitNanos - System.nanoTime());
          long startedAt = started.get(i).get(startWait, TimeUnit.NANOSECONDS);
          long remaining = Math.max(0, startedAt + timeoutNanos - System.nanoTime());
          slots[i] = future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
          future.cancel(true);
          PageTimeoutException timeout = new PageTimeoutException(page.pageNumber(), pageTimeout);
          log.warn("pdf.page.timeout page={} msg={}", page.pageNumber(), timeout.getMessage());
          slots[i] = timeoutMarker(page.pageNumber());
          failures.put(page.pageNumber(), timeout);
        } catch (ExecutionException e) {
          Throwable cause = e.getCause() == null ? e : e.getCause();
          log.warn("pdf.page.failed page={} msg={}", page.pageNumber(), cause.getMessage());
          slots[i] = errorMarker(page.pageNumber());
          failures.put(page.pageNumber(), asOcrException(page, cause));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          futures.forEach(f -> f.cancel(true));
          throw new RecognitionFailedException(
              "page-scheduler", "interrupted while waiting for page " + page.pageNumber(), e);
        }
      }
    } finally {
      pool.shutdown();
    }

    log.info("pdf.pages.done pages={} workers={} failed={}", n, poolSize, failures.keySet());
    return new PageResults(List.of(slots), Collections.unmodifiableMap(failures));
  }

  public int workers() {
    return workers;
  }

  static String timeoutMarker(int pageNumber) {
    return "[Page " + pageNumber + ": timeout]";
  }

  static String errorMarker(int pageNumber) {
    return "[Page " + pageNumber + ": error]";
  }

  private static OcrException asOcrException(PageTask page, Throwable cause) {
    if (cause instanceof OcrException) {
      return (OcrException) cause;
    }
    return new RecognitionFailedException(
        "page-scheduler", "page " + page.pageNumber() + ": " + cause, cause);
  }

  private static ThreadPoolTaskExecutor newPool(int poolSize, int queueCapacity) {
    ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(poolSize);
    pool.setMaxPoolSize(poolSize);
    pool.setQueueCapacity(queueCapacity);
    pool.setThreadNamePrefix("ocr-page-");
    // interrupt anything still running once the document is assembled
    pool.setWaitForTasksToCompleteOnShutdown(false);
    pool.initialize();
    return pool;
  }
}
