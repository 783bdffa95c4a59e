package ca.bsd.logcheck.application.pipeline;

import ca.bsd.logcheck.application.analysis.CrossSensorMatcher;
import ca.bsd.logcheck.application.analysis.DetectionOrdering;
import ca.bsd.logcheck.application.analysis.RadarCategorizer;
import ca.bsd.logcheck.application.ingest.IngestException;
import ca.bsd.logcheck.application.ingest.IngestResult;
import ca.bsd.logcheck.application.ingest.LogIngestor;
import ca.bsd.logcheck.application.port.LogSource;
import ca.bsd.logcheck.application.port.MetricsPort;
import ca.bsd.logcheck.application.port.ReportPort;
import ca.bsd.logcheck.config.AnalyzeConfig;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarCategories;
import ca.bsd.logcheck.domain.detection.RadarCategory;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one batch analysis over a folder of sensor logs.
 * <p><strong>Role:</strong> Application-layer use case coordinating the ingest and analysis components with the
 * report and metrics ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Ingest detections through {@link LogIngestor}.</li>
 *   <li>Categorize radar detections and match them against image detections in encounter order.</li>
 *   <li>Optionally sort both collections chronologically before they are exported.</li>
 *   <li>Export results via {@link ReportPort}; log a summary and record {@code logcheck.*} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per pipeline execution.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);
  private static final String MDC_INPUT = "logcheck.in";

  private final AnalyzeConfig config;
  private final LogSource source;
  private final LogIngestor ingestor;
  private final RadarCategorizer categorizer;
  private final CrossSensorMatcher matcher;
  private final ReportPort reports;
  private final MetricsPort metrics;

  /**
   * Creates the use case with explicit dependencies.
   *
   * @param config analysis configuration; must not be {@code null}
   * @param source log source to ingest; must not be {@code null}
   * @param ingestor log ingestor; must not be {@code null}
   * @param categorizer radar categorizer; must not be {@code null}
   * @param matcher cross-sensor matcher; must not be {@code null}
   * @param reports report sink, closed at the end of {@link #run()}; must not be {@code null}
   * @param metrics metrics port; must not be {@code null}
   */
  public AnalyzeUseCase(
      AnalyzeConfig config,
      LogSource source,
      LogIngestor ingestor,
      RadarCategorizer categorizer,
      CrossSensorMatcher matcher,
      ReportPort reports,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
    this.categorizer = Objects.requireNonNull(categorizer, "categorizer");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Ingests, analyzes, and exports.
   *
   * @return results of the run
   * @throws IngestException if the log source has no usable input
   * @throws IOException if a report cannot be written
   */
  public AnalysisResult run() throws IngestException, IOException {
    long started = System.nanoTime();
    MDC.put(MDC_INPUT, source.description());
    try (ReportPort sink = reports) {
      log.info("Analysis reading sensor logs from {}", source.description());
      IngestResult ingest = ingestor.ingest(source);
      if (ingest.radar().isEmpty()) {
        log.warn("There is no radar data in {}", source.description());
      }
      if (ingest.image().isEmpty()) {
        log.warn("There is no image data in {}", source.description());
      }

      // categories and time-frames keep encounter order; the sort applies to the detection export only
      RadarCategories categories = categorizer.categorize(ingest.radar());
      MatchReport comparison = matcher.match(ingest.radar(), ingest.image());
      if (config.sortDetections()) {
        ingest = ingest.withDetections(
            DetectionOrdering.chronological(ingest.radar()),
            DetectionOrdering.chronological(ingest.image()));
      }

      sink.writeDetections(ingest);
      sink.writeCategories(categories);
      sink.writeComparison(comparison);

      AnalysisResult result = new AnalysisResult(ingest, categories, comparison);
      logSummary(result);
      record(result, started);
      return result;
    } catch (IngestException ex) {
      log.error("Analysis aborted: {}", ex.getMessage());
      throw ex;
    } catch (IOException ex) {
      log.error("Analysis failed while writing reports for {}", source.description(), ex);
      throw ex;
    } finally {
      MDC.remove(MDC_INPUT);
    }
  }

  private void logSummary(AnalysisResult result) {
    IngestResult ingest = result.ingest();
    log.info("Ingested {} radar and {} image detections from {} file(s) ({} failed, {} dropped without timestamp)",
        ingest.radar().size(),
        ingest.image().size(),
        ingest.filesRead() + ingest.filesFailed(),
        ingest.filesFailed(),
        ingest.droppedDetections());
    for (RadarCategory category : RadarCategory.values()) {
      log.info("  {}: {} entries", category.label(), result.categories().count(category));
    }
    MatchReport comparison = result.comparison();
    log.info("Overall match percentage: {} ({} of {} radar detections; {} matched, {} unmatched time-frames)",
        String.format(Locale.ROOT, "%.2f", comparison.matchPercentage()),
        comparison.matchedCount(),
        comparison.totalCount(),
        comparison.matched().size(),
        comparison.unmatched().size());
  }

  private void record(AnalysisResult result, long startedNanos) {
    IngestResult ingest = result.ingest();
    metrics.add("logcheck.files.read", ingest.filesRead());
    metrics.add("logcheck.files.failed", ingest.filesFailed());
    metrics.add("logcheck.detections.radar", ingest.radar().size());
    metrics.add("logcheck.detections.image", ingest.image().size());
    metrics.add("logcheck.detections.dropped", ingest.droppedDetections());
    metrics.add("logcheck.timeframes.matched", result.comparison().matched().size());
    metrics.add("logcheck.timeframes.unmatched", result.comparison().unmatched().size());
    metrics.observe("logcheck.match.percent", Math.round(result.comparison().matchPercentage()));
    metrics.observe("logcheck.run.durationMillis",
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
  }
}
