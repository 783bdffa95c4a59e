package ca.bsd.logcheck.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.bsd.logcheck.domain.detection.DetectionTimestamp;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogIngestorTest {
  private final LogIngestor ingestor = new LogIngestor();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LogIngestor.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void stampsDetectionsWithThePrecedingTimestamp() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("mixed.txt", """
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=2, confidence=3}

        BsdImageObjInfo {x=1, y=2, confidence=3}
        2025-01-02 15:53:39.220
        BsdRadarObjInfo {x=4, y=5, confidence=6}
        """));

    assertEquals(2, result.radar().size());
    assertEquals(1, result.image().size());
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:39.120"), result.radar().get(0).timestamp());
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:39.120"), result.image().get(0).timestamp());
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:39.220"), result.radar().get(1).timestamp());
    assertEquals(1, result.filesRead());
    assertEquals(0, result.droppedDetections());
  }

  @Test
  void detectionBeforeAnyTimestampIsDroppedWithWarning() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("radar.txt", """
        BsdRadarObjInfo {x=9, y=9, confidence=9}
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=2, confidence=3}
        """));

    assertEquals(1, result.radar().size());
    assertEquals(1, result.droppedDetections());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("radar.txt:1")));
  }

  @Test
  void headerWithLongFractionStartsANewTimeFrame() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("radar.txt", """
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=2, confidence=3}
        2025-01-02 15:53:40.1234567890
        BsdRadarObjInfo {x=4, y=5, confidence=6}
        """));

    assertEquals(2, result.radar().size());
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:40.123456789"), result.radar().get(1).timestamp());
  }

  @Test
  void invalidHeaderEndsThePreviousTimeFrame() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("radar.txt", """
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=2, confidence=3}
        2025-13-02 15:53:40.000
        BsdRadarObjInfo {x=4, y=5, confidence=6}
        2025-01-02 15:53:41.000
        BsdRadarObjInfo {x=7, y=8, confidence=9}
        """));

    assertEquals(2, result.radar().size());
    assertEquals(1, result.droppedDetections());
    assertEquals(DetectionTimestamp.of("2025-01-02 15:53:41.000"), result.radar().get(1).timestamp());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("Invalid timestamp header at radar.txt:3")));
  }

  @Test
  void recordWithoutCoordinateIsKept() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("radar.txt", """
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=1, confidence=5}
        BsdRadarObjInfo {y=7, confidence=5}
        """));

    assertEquals(2, result.radar().size());
    assertNull(result.radar().get(1).x());
    assertEquals(0, result.droppedDetections());
  }

  @Test
  void timestampContextResetsForEachFile() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource()
        .file("a.txt", """
            2025-01-02 15:53:39.120
            BsdRadarObjInfo {x=1, y=2}
            """)
        .file("b.txt", """
            BsdImageObjInfo {x=1, y=2}
            """));

    assertEquals(1, result.radar().size());
    assertTrue(result.image().isEmpty());
    assertEquals(1, result.droppedDetections());
  }

  @Test
  void unreadableFileIsCountedAndSkipped() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource()
        .unreadable("locked.txt")
        .file("ok.txt", """
            2025-01-02 15:53:39.120
            BsdImageObjInfo {x=1, y=2}
            """));

    assertEquals(1, result.filesFailed());
    assertEquals(1, result.filesRead());
    assertEquals(1, result.image().size());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
        && e.getFormattedMessage().contains("locked.txt")));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("Processing file 2/2")));
  }

  @Test
  void everyRecordOnAMultiRecordLineIsStamped() throws IngestException {
    IngestResult result = ingestor.ingest(new InMemoryLogSource().file("mixed.txt", """
        2025-01-02 15:53:39.120
        BsdRadarObjInfo {x=1, y=2} BsdRadarObjInfo {x=3, y=4} BsdImageObjInfo {x=5, y=6}
        """));

    assertEquals(2, result.radar().size());
    assertEquals(1, result.image().size());
    assertTrue(result.radar().stream().allMatch(r -> r.timestamp() != null));
  }

  @Test
  void sourceFailurePropagates() {
    assertThrows(IngestException.class, () -> ingestor.ingest(new InMemoryLogSource()));
  }
}
