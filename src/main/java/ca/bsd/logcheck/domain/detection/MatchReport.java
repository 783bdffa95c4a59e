package ca.bsd.logcheck.domain.detection;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of cross-sensor matching.
 * <p><strong>Role:</strong> Domain aggregate handed from the matcher to report adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; lists are copied.</p>
 *
 * @param matched time-frames whose radar detections all found an image counterpart, ascending by timestamp
 * @param unmatched time-frames with at least one unmatched radar detection, ascending by timestamp
 * @param matchedCount radar detections inside {@code matched} time-frames
 * @param totalCount radar detections across all visited time-frames
 * @param matchPercentage {@code 100 * matchedCount / totalCount}, or {@code 0.0} when nothing was visited
 * @since 0.1.0
 */
public record MatchReport(
    List<TimeFrame> matched,
    List<TimeFrame> unmatched,
    int matchedCount,
    int totalCount,
    double matchPercentage) {

  /**
   * Copies the time-frame lists and checks the counters.
   *
   * @throws IllegalArgumentException if the counters are negative or inconsistent
   */
  public MatchReport {
    matched = List.copyOf(Objects.requireNonNull(matched, "matched"));
    unmatched = List.copyOf(Objects.requireNonNull(unmatched, "unmatched"));
    if (matchedCount < 0 || totalCount < matchedCount) {
      throw new IllegalArgumentException(
          "invalid counts: matched=" + matchedCount + ", total=" + totalCount);
    }
  }

  /**
   * Returns an empty report for a run without radar detections.
   *
   * @return report with no time-frames and a {@code 0.0} percentage
   */
  public static MatchReport empty() {
    return new MatchReport(List.of(), List.of(), 0, 0, 0.0);
  }
}
