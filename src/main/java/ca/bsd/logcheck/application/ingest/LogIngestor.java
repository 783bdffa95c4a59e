package ca.bsd.logcheck.application.ingest;

import ca.bsd.logcheck.application.port.LogSource;
import ca.bsd.logcheck.application.port.LogSource.LogFile;
import ca.bsd.logcheck.domain.detection.Detection;
import ca.bsd.logcheck.domain.detection.DetectionTimestamp;
import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads every file of a {@link LogSource} and attributes detections to the timestamp header
 * preceding them.
 * <p><strong>Role:</strong> First stage of the analysis pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fold each file's lines through a {@code NoTimestamp}/{@code Active(ts)} context that resets per file.</li>
 *   <li>Stamp parsed detections and split them into radar and image collections.</li>
 *   <li>Drop detections that precede any timestamp in their file, or follow a header naming no real date-time,
 *   with a warning.</li>
 *   <li>Log and skip files that fail to read; the batch continues.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-run state; each {@link #ingest(LogSource)} call is independent.</p>
 *
 * @since 0.1.0
 */
public final class LogIngestor {
  private static final Logger log = LoggerFactory.getLogger(LogIngestor.class);

  private final RecordParser parser;

  /**
   * Creates an ingestor using a default {@link RecordParser}.
   */
  public LogIngestor() {
    this(new RecordParser());
  }

  /**
   * Creates an ingestor with an explicit parser.
   *
   * @param parser line parser; must not be {@code null}
   */
  public LogIngestor(RecordParser parser) {
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * Ingests all files of the source.
   *
   * @param source log source; must not be {@code null}
   * @return stamped detections and bookkeeping counters
   * @throws IngestException if the source reports a fatal input condition
   */
  public IngestResult ingest(LogSource source) throws IngestException {
    Objects.requireNonNull(source, "source");
    List<LogFile> files = source.files();
    Batch batch = new Batch();
    int failed = 0;
    for (int i = 0; i < files.size(); i++) {
      LogFile file = files.get(i);
      log.info("Processing file {}/{}: '{}'", i + 1, files.size(), file.name());
      try {
        ingestFile(file, batch);
      } catch (IOException | UncheckedIOException ex) {
        failed++;
        log.error("Error processing file '{}'; continuing with remaining files", file.name(), ex);
      }
    }
    return new IngestResult(batch.radar, batch.image, files.size() - failed, failed, batch.dropped);
  }

  private void ingestFile(LogFile file, Batch batch) throws IOException {
    TimestampContext context = new NoTimestamp();
    try (BufferedReader reader = file.open()) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        context = onLine(context, line, file.name() + ':' + lineNumber, batch);
      }
    }
  }

  private TimestampContext onLine(TimestampContext context, String raw, String origin, Batch batch) {
    String line = raw.strip();
    if (line.isEmpty()) {
      return context;
    }
    if (DetectionTimestamp.isHeader(line)) {
      Optional<DetectionTimestamp> header = DetectionTimestamp.parseHeader(line);
      if (header.isPresent()) {
        return new Active(header.get());
      }
      log.warn("Invalid timestamp header at {}: '{}'; detections are dropped until the next header",
          origin, line);
      return new NoTimestamp();
    }
    List<Detection> detections = parser.parseAll(line, origin);
    if (detections.isEmpty()) {
      log.debug("No detection record at {}", origin);
      return context;
    }
    if (context instanceof Active active) {
      for (Detection detection : detections) {
        batch.add(detection.withTimestamp(active.timestamp()));
      }
    } else {
      batch.dropped += detections.size();
      log.warn("Dropping {} detection(s) at {}: no timestamp precedes them in this file",
          detections.size(), origin);
    }
    return context;
  }

  private sealed interface TimestampContext permits NoTimestamp, Active {}

  private record NoTimestamp() implements TimestampContext {}

  private record Active(DetectionTimestamp timestamp) implements TimestampContext {}

  private static final class Batch {
    private final List<RadarDetection> radar = new ArrayList<>();
    private final List<ImageDetection> image = new ArrayList<>();
    private int dropped;

    private void add(Detection detection) {
      if (detection instanceof RadarDetection r) {
        radar.add(r);
      } else if (detection instanceof ImageDetection i) {
        image.add(i);
      }
    }
  }
}
