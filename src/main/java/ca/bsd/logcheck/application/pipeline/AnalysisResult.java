package ca.bsd.logcheck.application.pipeline;

import ca.bsd.logcheck.application.ingest.IngestResult;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarCategories;
import java.util.Objects;

/**
 * Everything one analysis run produced.
 *
 * @param ingest ingested detections and counters
 * @param categories radar categories
 * @param comparison cross-sensor match report
 * @since 0.1.0
 */
public record AnalysisResult(IngestResult ingest, RadarCategories categories, MatchReport comparison) {

  /**
   * Validates that all parts are present.
   */
  public AnalysisResult {
    Objects.requireNonNull(ingest, "ingest");
    Objects.requireNonNull(categories, "categories");
    Objects.requireNonNull(comparison, "comparison");
  }
}
