package ca.bsd.logcheck.domain.detection;

/**
 * <strong>What:</strong> Operational categories for radar detections.
 * <p><strong>Role:</strong> Fixed keys of {@link RadarCategories}; each constant owns its predicate.</p>
 * <p>Categories are evaluated independently and are not mutually exclusive. A {@code null} velocity or a missing
 * coordinate fails every predicate.</p>
 *
 * @since 0.1.0
 */
public enum RadarCategory {
  /** Moving object closer than 20 (no lower bound on {@code y}). */
  CATEGORY_1("Category 1 (y < 20 and velocity ≠ 0)", true) {
    @Override
    public boolean matches(RadarDetection detection) {
      return detection.y() != null && detection.y() < 20 && detection.moving();
    }
  },
  /** Moving object between 20 and 80 inclusive. */
  CATEGORY_2("Category 2 (20 ≤ y ≤ 80 and velocity ≠ 0)", true) {
    @Override
    public boolean matches(RadarDetection detection) {
      return detection.y() != null && detection.y() >= 20 && detection.y() <= 80 && detection.moving();
    }
  },
  /** Moving object beyond 80. */
  CATEGORY_3("Category 3 (y > 80 and velocity ≠ 0)", true) {
    @Override
    public boolean matches(RadarDetection detection) {
      return detection.y() != null && detection.y() > 80 && detection.moving();
    }
  },
  /** Stationary placeholder at the origin. */
  CATEGORY_4("Category 4 (x = 0, y = 0, and velocity = 0)", false) {
    @Override
    public boolean matches(RadarDetection detection) {
      return isZero(detection.x()) && isZero(detection.y()) && detection.stationary();
    }
  };

  private final String label;
  private final boolean sortedByY;

  RadarCategory(String label, boolean sortedByY) {
    this.label = label;
    this.sortedByY = sortedByY;
  }

  private static boolean isZero(Integer value) {
    return value != null && value == 0;
  }

  /**
   * Tests whether a radar detection belongs to this category.
   *
   * @param detection radar detection; must not be {@code null}
   * @return {@code true} when the category predicate holds
   */
  public abstract boolean matches(RadarDetection detection);

  /**
   * Returns the human-readable label used in reports.
   *
   * @return category label
   */
  public String label() {
    return label;
  }

  /**
   * Indicates whether members are ordered by ascending {@code y}; otherwise encounter order is kept.
   *
   * @return {@code true} for categories 1 to 3
   */
  public boolean sortedByY() {
    return sortedByY;
  }
}
