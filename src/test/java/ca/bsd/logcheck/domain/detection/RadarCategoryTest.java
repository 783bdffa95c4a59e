package ca.bsd.logcheck.domain.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RadarCategoryTest {

  private static RadarDetection radar(Integer x, Integer y, Integer velocity) {
    return new RadarDetection(x, y, 1, null, null, velocity, null, null);
  }

  private static Set<RadarCategory> categoriesOf(RadarDetection detection) {
    Set<RadarCategory> result = EnumSet.noneOf(RadarCategory.class);
    for (RadarCategory category : RadarCategory.values()) {
      if (category.matches(detection)) {
        result.add(category);
      }
    }
    return result;
  }

  @Test
  void stationaryOriginIsCategoryFourOnly() {
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_4), categoriesOf(radar(0, 0, 0)));
  }

  @Test
  void movingOriginIsCategoryOneOnly() {
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_1), categoriesOf(radar(0, 0, 5)));
  }

  @Test
  void yBoundariesSelectExactlyOneMovingCategory() {
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_1), categoriesOf(radar(3, 19, 1)));
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_2), categoriesOf(radar(3, 20, 1)));
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_2), categoriesOf(radar(3, 80, -1)));
    assertEquals(EnumSet.of(RadarCategory.CATEGORY_3), categoriesOf(radar(3, 81, 1)));
  }

  @Test
  void negativeYCountsAsCategoryOne() {
    assertTrue(RadarCategory.CATEGORY_1.matches(radar(4, -7, 2)));
  }

  @Test
  void missingVelocityMatchesNothing() {
    assertTrue(categoriesOf(radar(0, 0, null)).isEmpty());
    assertTrue(categoriesOf(radar(1, 50, null)).isEmpty());
  }

  @Test
  void missingCoordinateMatchesNothing() {
    assertTrue(categoriesOf(radar(1, null, 4)).isEmpty());
    assertTrue(categoriesOf(radar(null, 0, 0)).isEmpty());
    assertTrue(categoriesOf(radar(0, null, 0)).isEmpty());
  }

  @Test
  void stationaryOffOriginMatchesNothing() {
    assertTrue(categoriesOf(radar(1, 0, 0)).isEmpty());
    assertFalse(RadarCategory.CATEGORY_4.matches(radar(0, 1, 0)));
  }

  @Test
  void onlyMovingCategoriesAreSortedByY() {
    assertTrue(RadarCategory.CATEGORY_1.sortedByY());
    assertTrue(RadarCategory.CATEGORY_3.sortedByY());
    assertFalse(RadarCategory.CATEGORY_4.sortedByY());
    assertEquals("Category 1 (y < 20 and velocity ≠ 0)", RadarCategory.CATEGORY_1.label());
  }
}
