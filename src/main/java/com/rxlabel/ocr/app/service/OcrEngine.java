package com.rxlabel.ocr.app.service;

import com.rxlabel.ocr.app.error.AllEnginesFailedException;
import com.rxlabel.ocr.app.error.NoEngineAvailableException;
import com.rxlabel.ocr.app.error.OcrException;
import com.rxlabel.ocr.app.error.RecognitionFailedException;
import com.rxlabel.ocr.app.model.EngineState;
import com.rxlabel.ocr.app.model.MediaKind;
import com.rxlabel.ocr.app.model.PageTask;
import com.rxlabel.ocr.app.model.ProviderHealth;
import com.rxlabel.ocr.app.model.RecognitionRequest;
import com.rxlabel.ocr.app.model.RecognitionResult;
import com.rxlabel.ocr.app.pdf.PageResults;
import com.rxlabel.ocr.app.pdf.PageScheduler;
import com.rxlabel.ocr.app.provider.OcrProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Single entry point for OCR. Hides provider selection and failover from callers.
 *
 * <p>At construction the cloud candidates are tried in priority order; the first that builds
 * becomes the primary. The local candidate is always tried and, when it builds, is the permanent
 * fallback. Per request the primary is tried first, then the fallback; if both fail the request
 * fails with every cause attached. When nothing could be built the engine is {@link
 * EngineState#UNAVAILABLE} and requests fail fast without touching the network.
 */
@Log4j2
public class OcrEngine implements AutoCloseable {

  public static final String ROLE_PRIMARY = "primary";
  public static final String ROLE_FALLBACK = "fallback";
  public static final String NONE = "none";

  private final RecognitionPipeline pipeline;
  private final PageScheduler pageScheduler;
  private final Duration pageTimeoutGrace;

  private final OcrProvider primary;
  private final OcrProvider fallback;
  private final Map<String, ProviderHealth> health;
  private final EngineState state;

  public OcrEngine(
      List<ProviderCandidate> cloudCandidates,
      ProviderCandidate localCandidate,
      RecognitionPipeline pipeline,
      PageScheduler pageScheduler,
      Duration pageTimeoutGrace) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    this.pageScheduler = Objects.requireNonNull(pageScheduler, "pageScheduler must not be null");
    this.pageTimeoutGrace = pageTimeoutGrace == null ? Duration.ZERO : pageTimeoutGrace;

    Map<String, ProviderHealth> checked = new LinkedHashMap<>();
    OcrProvider selected = null;
    for (ProviderCandidate candidate : cloudCandidates) {
      if (selected != null) {
        checked.put(
            candidate.getId(), ProviderHealth.down("skipped: " + selected.id() + " is primary"));
        continue;
      }
      selected = tryBuild(candidate, checked);
    }
    this.primary = selected;
    this.fallback = localCandidate == null ? null : tryBuild(localCandidate, checked);
    this.health = Collections.unmodifiableMap(checked);

    if (primary != null) {
      this.state = EngineState.READY;
      log.info(
          "ocr.engine.ready primary={} fallback={}",
          primary.id(),
          fallback == null ? NONE : fallback.id());
    } else if (fallback != null) {
      this.state = EngineState.DEGRADED;
      log.info("ocr.engine.degraded fallback={} (no cloud provider configured)", fallback.id());
    } else {
      this.state = EngineState.UNAVAILABLE;
      log.error(
          "ocr.engine.unavailable NO OCR engine available. Set a cloud credential or make the"
              + " local model reachable. health={}",
          health);
    }
  }

  public RecognitionResult processImage(byte[] imageBytes) {
    return process(RecognitionRequest.image(imageBytes));
  }

  public RecognitionResult processPdf(byte[] pdfBytes) {
    return process(RecognitionRequest.pdf(pdfBytes));
  }

  /**
   * @throws NoEngineAvailableException when no provider was built at startup
   * @throws com.rxlabel.ocr.app.error.ConversionFailedException when a PDF cannot be rasterized
   * @throws AllEnginesFailedException when every provider tried failed
   */
  public RecognitionResult process(RecognitionRequest request) {
    if (state == EngineState.UNAVAILABLE) {
      throw new NoEngineAvailableException();
    }
    long t0 = System.nanoTime();
    byte[] content = request.getContent();
    log.debug(
        "ocr.engine.request kind={} ext={} bytes={}",
        request.getMediaKind(),
        request.getExtension(),
        content.length);
    if (request.getMediaKind() == MediaKind.PDF) {
      // rasterize once; a bad document is fatal and never fails over
      List<PageTask> pages = pageScheduler.rasterize(content);
      return runWithFailover(
          t0, (provider, lastResort) -> recognizePdf(provider, pages, lastResort));
    }
    return runWithFailover(
        t0, (provider, lastResort) -> new Attempt(pipeline.recognize(provider, content), null));
  }

  /** Identifier of the provider serving requests first, or {@code none}. */
  public String activeEngine() {
    if (primary != null) return primary.id();
    if (fallback != null) return fallback.id();
    return NONE;
  }

  public EngineState state() {
    return state;
  }

  public Map<String, ProviderHealth> health() {
    return health;
  }

  @Override
  public void close() {
    closeQuietly(primary);
    closeQuietly(fallback);
  }

  // ------------------------------------------------------------------
  // Internal
  // ------------------------------------------------------------------

  private RecognitionResult runWithFailover(long t0, ProviderCall call) {
    List<OcrException> errors = new ArrayList<>(2);

    if (primary != null) {
      try {
        return toResult(call.run(primary, fallback == null), primary, ROLE_PRIMARY, t0);
      } catch (OcrException e) {
        if (!e.getKind().triggersFailover()) throw e;
        errors.add(e);
        log.warn(
            "ocr.engine.failover from={} to={} cause={}",
            primary.id(),
            fallback == null ? NONE : fallback.id(),
            e.getMessage());
      }
    }

    if (fallback != null) {
      try {
        return toResult(call.run(fallback, true), fallback, ROLE_FALLBACK, t0);
      } catch (OcrException e) {
        if (!e.getKind().triggersFailover()) throw e;
        errors.add(e);
        log.error("ocr.engine.fallback.failed id={} cause={}", fallback.id(), e.getMessage());
      }
    }

    throw new AllEnginesFailedException(errors);
  }

  /**
   * A document where every page failed counts as a provider failure while another provider is
   * left to try. The last provider returns the document with its page markers.
   */
  private Attempt recognizePdf(OcrProvider provider, List<PageTask> pages, boolean lastResort) {
    Duration pageTimeout = provider.callTimeout().plus(pageTimeoutGrace);
    PageResults results =
        pageScheduler.recognizePages(
            pages, page -> pipeline.recognize(provider, page.getImageBytes()), pageTimeout);
    if (results.allFailed()) {
      OcrException first = results.getFailures().values().iterator().next();
      if (!lastResort) {
        throw new RecognitionFailedException(
            provider.id(),
            "all " + results.pageCount() + " page(s) failed, first: " + first.getMessage(),
            first);
      }
      log.warn(
          "ocr.engine.pdf.no-text provider={} pages={} first={}",
          provider.id(),
          results.pageCount(),
          first.getMessage());
    }
    return new Attempt(results.combinedText(), results.pageCount());
  }

  private static RecognitionResult toResult(
      Attempt attempt, OcrProvider provider, String role, long t0) {
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "ocr.engine.ok role={} provider={} chars={} pages={} durationMs={}",
        role,
        provider.id(),
        attempt.text.length(),
        attempt.pages,
        ms);
    return RecognitionResult.builder()
        .extractedText(attempt.text)
        .processingTimeMs(ms)
        .modelName(provider.modelName())
        .engineUsed(role)
        .provider(provider.id())
        .pagesProcessed(attempt.pages)
        .build();
  }

  private static OcrProvider tryBuild(
      ProviderCandidate candidate, Map<String, ProviderHealth> checked) {
    try {
      OcrProvider provider = candidate.getFactory().get();
      if (provider == null) {
        checked.put(candidate.getId(), ProviderHealth.down("not configured"));
        return null;
      }
      checked.put(candidate.getId(), ProviderHealth.up());
      return provider;
    } catch (RuntimeException e) {
      log.warn(
          "ocr.engine.provider id={} available=false reason={}",
          candidate.getId(),
          e.getMessage());
      checked.put(candidate.getId(), ProviderHealth.down(e.getMessage()));
      return null;
    }
  }

  private static void closeQuietly(OcrProvider provider) {
    if (provider instanceof AutoCloseable) {
      try {
        ((AutoCloseable) provider).close();
      } catch (Exception e) {
        log.warn("ocr.engine.close id={} msg={}", provider.id(), e.getMessage());
      }
    }
  }

  /**
   * One provider attempt; unexpected runtime failures are reported as recognition failures.
   * {@code lastResort} is set when no other provider would be tried after this one.
   */
  @FunctionalInterface
  private interface ProviderCall {
    Attempt attempt(OcrProvider provider, boolean lastResort);

    default Attempt run(OcrProvider provider, boolean lastResort) {
      try {
        return attempt(provider, lastResort);
      } catch (OcrException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new RecognitionFailedException(provider.id(), e.toString(), e);
      }
    }
  }

  private static final class Attempt {
    private final String text;
    private final Integer pages;

    private Attempt(String text, Integer pages) {
      this.text = text;
      this.pages = pages;
    }
  }
}
