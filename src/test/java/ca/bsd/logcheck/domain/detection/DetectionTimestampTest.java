package ca.bsd.logcheck.domain.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class DetectionTimestampTest {

  @Test
  void parsesMillisecondHeader() {
    DetectionTimestamp ts = DetectionTimestamp.of("2025-01-02 15:53:39.120");

    assertEquals(LocalDateTime.of(2025, 1, 2, 15, 53, 39, 120_000_000), ts.value());
    assertEquals("2025-01-02 15:53:39.120", ts.format());
  }

  @Test
  void keepsSubMillisecondDigits() {
    DetectionTimestamp ts = DetectionTimestamp.of("2025-01-02 15:53:39.123456");

    assertEquals(123_456_000, ts.value().getNano());
    assertEquals("2025-01-02 15:53:39.123456000", ts.format());
  }

  @Test
  void headerIgnoresSurroundingWhitespace() {
    assertTrue(DetectionTimestamp.parseHeader("  2025-01-02   15:53:39.1 \t").isPresent());
  }

  @Test
  void rejectsLinesThatOnlyContainATimestamp() {
    assertTrue(DetectionTimestamp.parseHeader("2025-01-02 15:53:39.120 BsdRadarObjInfo {x=1}").isEmpty());
    assertTrue(DetectionTimestamp.parseHeader("at 2025-01-02 15:53:39.120").isEmpty());
    assertTrue(DetectionTimestamp.parseHeader("2025-01-02 15:53:39").isEmpty());
    assertTrue(DetectionTimestamp.parseHeader(null).isEmpty());
  }

  @Test
  void rejectsImpossibleCalendarValues() {
    assertTrue(DetectionTimestamp.parseHeader("2025-13-02 15:53:39.120").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> DetectionTimestamp.of("2025-01-02 25:00:00.000"));
  }

  @Test
  void fractionBeyondNanosecondsIsCutOff() {
    DetectionTimestamp ts = DetectionTimestamp.of("2025-01-02 15:53:40.1234567890");

    assertEquals(LocalDateTime.of(2025, 1, 2, 15, 53, 40, 123_456_789), ts.value());
  }

  @Test
  void invalidDateStillHasHeaderShape() {
    assertTrue(DetectionTimestamp.isHeader("2025-13-02 15:53:39.120"));
    assertTrue(DetectionTimestamp.parseHeader("2025-02-31 15:53:39.120").isEmpty());
    assertFalse(DetectionTimestamp.isHeader("2025-01-02 15:53:39"));
    assertFalse(DetectionTimestamp.isHeader(null));
  }

  @Test
  void equalityFollowsTheInstantNotTheText() {
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:39.12"), DetectionTimestamp.of("2025-01-02 15:53:39.120"));
    assertTrue(DetectionTimestamp.of("2025-01-02 15:53:39.120")
        .compareTo(DetectionTimestamp.of("2025-01-02 15:53:39.121")) < 0);
  }
}
