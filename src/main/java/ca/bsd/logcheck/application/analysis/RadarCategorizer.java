package ca.bsd.logcheck.application.analysis;

import ca.bsd.logcheck.domain.detection.RadarCategories;
import ca.bsd.logcheck.domain.detection.RadarCategory;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns radar detections to the four {@link RadarCategory} buckets.
 * <p>Every category is evaluated over the whole input, so one detection may appear in several buckets. Buckets 1 to 3
 * are stably sorted by ascending {@code y}; bucket 4 keeps encounter order.</p>
 *
 * @since 0.1.0
 */
public final class RadarCategorizer {
  private static final Comparator<RadarDetection> BY_Y = Comparator.comparing(RadarDetection::y);

  /**
   * Creates a categorizer.
   */
  public RadarCategorizer() {}

  /**
   * Categorizes radar detections.
   *
   * @param radar radar detections; must not be {@code null}
   * @return all four categories, possibly empty
   */
  public RadarCategories categorize(List<RadarDetection> radar) {
    Objects.requireNonNull(radar, "radar");
    Map<RadarCategory, List<RadarDetection>> buckets = new EnumMap<>(RadarCategory.class);
    for (RadarCategory category : RadarCategory.values()) {
      buckets.put(category, new ArrayList<>());
    }
    for (RadarDetection detection : radar) {
      for (RadarCategory category : RadarCategory.values()) {
        if (category.matches(detection)) {
          buckets.get(category).add(detection);
        }
      }
    }
    for (RadarCategory category : RadarCategory.values()) {
      if (category.sortedByY()) {
        // List.sort is stable, ties keep input order
        buckets.get(category).sort(BY_Y);
      }
    }
    return new RadarCategories(buckets);
  }
}
