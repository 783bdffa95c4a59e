package ca.bsd.logcheck.infrastructure.report;

import ca.bsd.logcheck.application.ingest.IngestResult;
import ca.bsd.logcheck.application.port.ReportPort;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarCategories;
import ca.bsd.logcheck.domain.detection.TimeFrame;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ReportPort} writing the analysis reports into one folder.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@value #DETECTIONS_FILE}: every radar and image detection.</li>
 *   <li>{@value #CATEGORIES_FILE}: radar detections grouped by category.</li>
 *   <li>{@value #COMPARISON_FILE}: cross-sensor match percentage and time-frames.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per run.</p>
 * <p><strong>Observability:</strong> Logs each written file at INFO.</p>
 *
 * @implNote The output folder is created on first write. Existing report files are replaced.
 * @since 0.1.0
 */
public final class FileReportAdapter implements ReportPort {
  private static final Logger log = LoggerFactory.getLogger(FileReportAdapter.class);
  static final String DETECTIONS_FILE = "detections.json";
  static final String CATEGORIES_FILE = "categories.txt";
  static final String COMPARISON_FILE = "comparison.json";

  private final Path directory;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates an adapter writing into {@code directory}.
   *
   * @param directory report folder
   */
  public FileReportAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public void writeDetections(IngestResult ingest) throws IOException {
    Objects.requireNonNull(ingest, "ingest");
    Path target = prepare(DETECTIONS_FILE);
    try (JsonGenerator gen = jsonFactory.createGenerator(target.toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      DetectionJsonWriter.writeArray(gen, "radar", ingest.radar());
      DetectionJsonWriter.writeArray(gen, "image", ingest.image());
      gen.writeEndObject();
    }
    log.info("Wrote {} radar and {} image detections to {}", ingest.radar().size(), ingest.image().size(), target);
  }

  @Override
  public void writeCategories(RadarCategories categories) throws IOException {
    Objects.requireNonNull(categories, "categories");
    Path target = prepare(CATEGORIES_FILE);
    try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      CategoryTextRenderer.render(categories, out);
    }
    log.info("Filtering and sorting complete. Results written to {}", target);
  }

  @Override
  public void writeComparison(MatchReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    Path target = prepare(COMPARISON_FILE);
    try (JsonGenerator gen = jsonFactory.createGenerator(target.toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("matchPercentage", report.matchPercentage());
      gen.writeNumberField("matchedCount", report.matchedCount());
      gen.writeNumberField("totalCount", report.totalCount());
      writeFrames(gen, "matched", report.matched());
      writeFrames(gen, "unmatched", report.unmatched());
      gen.writeEndObject();
    }
    log.info("Wrote comparison of {} time-frame(s) to {}",
        report.matched().size() + report.unmatched().size(), target);
  }

  private static void writeFrames(JsonGenerator gen, String field, List<TimeFrame> frames) throws IOException {
    gen.writeArrayFieldStart(field);
    for (TimeFrame frame : frames) {
      gen.writeStartObject();
      gen.writeStringField("timestamp", frame.timestamp().format());
      DetectionJsonWriter.writeArray(gen, "radar", frame.radar());
      DetectionJsonWriter.writeArray(gen, "image", frame.image());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private Path prepare(String fileName) throws IOException {
    Files.createDirectories(directory);
    return directory.resolve(fileName);
  }
}
