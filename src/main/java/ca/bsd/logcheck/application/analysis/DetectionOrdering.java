package ca.bsd.logcheck.application.analysis;

import ca.bsd.logcheck.domain.detection.Detection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Chronological ordering for detections gathered across files.
 * <p>Folder enumeration does not imply time order, so consumers that need a global timeline sort explicitly.</p>
 *
 * @since 0.1.0
 */
public final class DetectionOrdering {
  private static final Comparator<Detection> CHRONOLOGICAL =
      Comparator.comparing(Detection::timestamp)
          .thenComparing(Detection::y, Comparator.nullsLast(Comparator.naturalOrder()));

  private DetectionOrdering() {}

  /**
   * Returns a copy sorted by timestamp, then {@code y} with missing values last; ties keep input order.
   *
   * @param detections stamped detections; must not be {@code null}
   * @param <T> detection type
   * @return new sorted, unmodifiable list
   * @throws NullPointerException if a detection is unstamped
   */
  public static <T extends Detection> List<T> chronological(List<T> detections) {
    Objects.requireNonNull(detections, "detections");
    List<T> sorted = new ArrayList<>(detections);
    sorted.sort(CHRONOLOGICAL);
    return List.copyOf(sorted);
  }
}
