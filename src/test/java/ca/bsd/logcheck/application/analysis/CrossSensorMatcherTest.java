package ca.bsd.logcheck.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.bsd.logcheck.domain.detection.DetectionTimestamp;
import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import ca.bsd.logcheck.domain.detection.TimeFrame;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrossSensorMatcherTest {
  private static final DetectionTimestamp T1 = DetectionTimestamp.of("2025-01-02 15:53:39.120");
  private static final DetectionTimestamp T2 = DetectionTimestamp.of("2025-01-02 15:53:39.220");
  private static final DetectionTimestamp T3 = DetectionTimestamp.of("2025-01-02 15:53:39.320");

  private final CrossSensorMatcher matcher = new CrossSensorMatcher();

  private static RadarDetection radar(Integer x, Integer y, Integer confidence, DetectionTimestamp ts) {
    return new RadarDetection(x, y, confidence, 10, 1, 2, 50, ts);
  }

  private static ImageDetection image(Integer x, Integer y, Integer confidence, DetectionTimestamp ts) {
    return new ImageDetection(x, y, confidence, 0, 0, 8, 8, ts);
  }

  @Test
  void identicalPositionsMatchFully() {
    MatchReport report = matcher.match(List.of(radar(1, 1, 5, T1)), List.of(image(1, 1, 5, T1)));

    assertEquals(1, report.matched().size());
    assertEquals(T1, report.matched().get(0).timestamp());
    assertTrue(report.unmatched().isEmpty());
    assertEquals(100.0, report.matchPercentage());
  }

  @Test
  void oneMissingRadarDetectionMovesTheWholeFrame() {
    MatchReport report = matcher.match(
        List.of(radar(0, 5, 9, T1), radar(2, 6, 8, T1)),
        List.of(image(0, 5, 9, T1)));

    assertTrue(report.matched().isEmpty());
    TimeFrame frame = report.unmatched().get(0);
    assertEquals(2, frame.radar().size());
    assertEquals(1, frame.image().size());
    assertEquals(0, report.matchedCount());
    assertEquals(2, report.totalCount());
    assertEquals(0.0, report.matchPercentage());
  }

  @Test
  void everyRadarDetectionIsAccountedForOnce() {
    List<RadarDetection> radar = List.of(
        radar(1, 1, 5, T1), radar(2, 2, 5, T2), radar(3, 3, 5, T2), radar(4, 4, null, T3));
    List<ImageDetection> image = List.of(image(1, 1, 5, T1), image(2, 2, 5, T2), image(4, 4, null, T3));

    MatchReport report = matcher.match(radar, image);

    int accounted = report.matched().stream().mapToInt(f -> f.radar().size()).sum()
        + report.unmatched().stream().mapToInt(f -> f.radar().size()).sum();
    assertEquals(radar.size(), accounted);
    assertEquals(radar.size(), report.totalCount());
    assertEquals(List.of(T1, T3), report.matched().stream().map(TimeFrame::timestamp).toList());
    assertEquals(50.0, report.matchPercentage());
  }

  @Test
  void imageOnlyTimestampsAreIgnored() {
    MatchReport report = matcher.match(List.of(radar(1, 1, 5, T1)), List.of(image(1, 1, 5, T1), image(7, 7, 7, T2)));

    assertEquals(1, report.matched().size());
    assertTrue(report.unmatched().isEmpty());
  }

  @Test
  void confidenceMustAgree() {
    MatchReport report = matcher.match(List.of(radar(1, 1, 5, T1)), List.of(image(1, 1, 6, T1)));

    assertEquals(0.0, report.matchPercentage());
  }

  @Test
  void radarWithoutXStillCountsAndBreaksItsFrame() {
    MatchReport report = matcher.match(
        List.of(radar(1, 1, 5, T1), radar(null, 7, 5, T1)),
        List.of(image(1, 1, 5, T1)));

    assertEquals(2, report.totalCount());
    assertEquals(0, report.matchedCount());
    assertEquals(0.0, report.matchPercentage());
  }

  @Test
  void missingCoordinatesMatchWhenBothSidesOmitThem() {
    MatchReport report = matcher.match(List.of(radar(null, 7, 5, T1)), List.of(image(null, 7, 5, T1)));

    assertEquals(100.0, report.matchPercentage());
  }

  @Test
  void matchingIsIdempotent() {
    List<RadarDetection> radar = List.of(radar(1, 1, 5, T2), radar(1, 1, 5, T1));
    List<ImageDetection> image = List.of(image(1, 1, 5, T1));

    assertEquals(matcher.match(radar, image), matcher.match(radar, image));
  }

  @Test
  void noRadarMeansZeroPercent() {
    MatchReport report = matcher.match(List.of(), List.of(image(1, 1, 1, T1)));

    assertEquals(0, report.totalCount());
    assertEquals(0.0, report.matchPercentage());
  }

  @Test
  void unstampedDetectionsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> matcher.match(List.of(radar(1, 1, 1, null)), List.of()));
  }
}
