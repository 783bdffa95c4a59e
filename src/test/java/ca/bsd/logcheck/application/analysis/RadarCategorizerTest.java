package ca.bsd.logcheck.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.bsd.logcheck.domain.detection.DetectionTimestamp;
import ca.bsd.logcheck.domain.detection.RadarCategories;
import ca.bsd.logcheck.domain.detection.RadarCategory;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import java.util.List;
import org.junit.jupiter.api.Test;

class RadarCategorizerTest {
  private static final DetectionTimestamp T1 = DetectionTimestamp.of("2025-01-02 15:53:39.120");
  private static final DetectionTimestamp T2 = DetectionTimestamp.of("2025-01-02 15:53:39.220");

  private final RadarCategorizer categorizer = new RadarCategorizer();

  private static RadarDetection radar(int x, int y, Integer velocity, DetectionTimestamp ts) {
    return new RadarDetection(x, y, 1, 0, 0, velocity, 0, ts);
  }

  @Test
  void stationaryAndMovingOriginLandInDifferentCategories() {
    RadarDetection stationary = radar(0, 0, 0, T1);
    RadarDetection moving = radar(0, 0, 5, T1);

    RadarCategories categories = categorizer.categorize(List.of(stationary, moving));

    assertEquals(List.of(moving), categories.get(RadarCategory.CATEGORY_1));
    assertEquals(List.of(stationary), categories.get(RadarCategory.CATEGORY_4));
    assertTrue(categories.get(RadarCategory.CATEGORY_2).isEmpty());
    assertTrue(categories.get(RadarCategory.CATEGORY_3).isEmpty());
  }

  @Test
  void movingCategoriesAreSortedByYKeepingTies() {
    RadarDetection a = radar(1, 60, 1, T2);
    RadarDetection b = radar(2, 25, 1, T1);
    RadarDetection c = radar(3, 60, 1, T1);
    RadarDetection d = radar(4, 40, -3, T2);

    List<RadarDetection> sorted = categorizer.categorize(List.of(a, b, c, d)).get(RadarCategory.CATEGORY_2);

    assertEquals(List.of(b, d, a, c), sorted);
  }

  @Test
  void stationaryCategoryKeepsInputOrder() {
    RadarDetection late = radar(0, 0, 0, T2);
    RadarDetection early = radar(0, 0, 0, T1);

    assertEquals(List.of(late, early), categorizer.categorize(List.of(late, early)).get(RadarCategory.CATEGORY_4));
  }

  @Test
  void detectionsWithoutVelocityAreNotCategorized() {
    RadarCategories categories = categorizer.categorize(List.of(radar(0, 0, null, T1), radar(5, 50, null, T1)));

    for (RadarCategory category : RadarCategory.values()) {
      assertEquals(0, categories.count(category), category.name());
    }
  }

  @Test
  void everyCategoryIsPresentForEmptyInput() {
    RadarCategories categories = categorizer.categorize(List.of());

    assertEquals(RadarCategory.values().length, categories.asMap().size());
  }
}
