package ca.bsd.logcheck.application.port;

import ca.bsd.logcheck.application.ingest.IngestResult;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarCategories;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port receiving the results of one analysis run.
 * <p><strong>Role:</strong> Sink side of the hexagon; {@code FileReportAdapter} writes JSON and text reports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Export all ingested detections.</li>
 *   <li>Export radar categories.</li>
 *   <li>Export the cross-sensor comparison.</li>
 * </ul>
 * <p>The pipeline calls each method once, in the order above, then {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public interface ReportPort extends AutoCloseable {

  /**
   * Exports the ingested detections.
   *
   * @param ingest ingest result; must not be {@code null}
   * @throws IOException if the report cannot be written
   */
  void writeDetections(IngestResult ingest) throws IOException;

  /**
   * Exports the radar categories.
   *
   * @param categories categorized radar detections; must not be {@code null}
   * @throws IOException if the report cannot be written
   */
  void writeCategories(RadarCategories categories) throws IOException;

  /**
   * Exports the cross-sensor comparison.
   *
   * @param report match report; must not be {@code null}
   * @throws IOException if the report cannot be written
   */
  void writeComparison(MatchReport report) throws IOException;

  /**
   * Releases resources; the default implementation does nothing.
   *
   * @throws IOException if pending output cannot be flushed
   */
  @Override
  default void close() throws IOException {}

  /**
   * Report sink that discards everything.
   */
  ReportPort DISCARD = new ReportPort() {
    @Override public void writeDetections(IngestResult ingest) {}

    @Override public void writeCategories(RadarCategories categories) {}

    @Override public void writeComparison(MatchReport report) {}
  };
}
