package ca.bsd.logcheck.application.ingest;

import ca.bsd.logcheck.domain.detection.Detection;
import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import ca.bsd.logcheck.domain.detection.SensorType;
import ca.bsd.logcheck.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts one raw sensor log line into typed detection records.
 * <p><strong>Role:</strong> Stateless parser used by {@link LogIngestor} for every non-timestamp line.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognize radar ({@code ...RadarObjInfo}) and image ({@code ...ImageObjInfo}) marker tokens.</li>
 *   <li>Extract the {@code x}, {@code y}, and {@code confidence} scalars wherever they appear; a missing scalar
 *   stays {@code null}.</li>
 *   <li>Promote the entries of the nested {@code raw=...Raw{k=v, ...}} block to typed fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Malformed scalars and raw entries are reported as SLF4J warnings quoting the
 * line origin; nothing is thrown.</p>
 *
 * @implNote Returned records are unstamped ({@code timestamp == null}); the ingestor attaches the timestamp.
 * @since 0.1.0
 */
public final class RecordParser {
  private static final Logger log = LoggerFactory.getLogger(RecordParser.class);
  private static final int MAX_LOGGED_BYTES = 256;
  private static final String UNKNOWN_ORIGIN = "<line>";

  private static final Pattern MARKER = Pattern.compile(
      "[A-Za-z0-9_]*(?:" + SensorType.RADAR.infoMarker() + "|" + SensorType.IMAGE.infoMarker() + ")");
  private static final Pattern X = scalar("x");
  private static final Pattern Y = scalar("y");
  private static final Pattern CONFIDENCE = scalar("confidence");
  private static final Pattern RADAR_RAW = rawBlock(SensorType.RADAR);
  private static final Pattern IMAGE_RAW = rawBlock(SensorType.IMAGE);

  /**
   * Creates a parser.
   */
  public RecordParser() {}

  /**
   * Parses a line holding at most one detection record.
   *
   * @param line raw log line; {@code null} yields empty
   * @return detection, or empty when the line carries no marker
   */
  public Optional<Detection> parse(String line) {
    return parse(line, null);
  }

  /**
   * Parses a line holding at most one detection record, quoting {@code origin} in warnings.
   *
   * <p>When both marker kinds appear the line is treated as radar.</p>
   *
   * @param line raw log line; {@code null} yields empty
   * @param origin location such as {@code radar.txt:12}; {@code null} when unknown
   * @return detection, or empty when the line carries no marker
   */
  public Optional<Detection> parse(String line, String origin) {
    if (line == null) {
      return Optional.empty();
    }
    String where = origin == null ? UNKNOWN_ORIGIN : origin;
    if (line.contains(SensorType.RADAR.infoMarker())) {
      return parseSegment(SensorType.RADAR, line, where);
    }
    if (line.contains(SensorType.IMAGE.infoMarker())) {
      return parseSegment(SensorType.IMAGE, line, where);
    }
    return Optional.empty();
  }

  /**
   * Parses every detection record of a line, splitting it at each marker token.
   *
   * <p>A line with zero or one marker yields the same result as {@link #parse(String, String)}.</p>
   *
   * @param line raw log line; {@code null} yields an empty list
   * @param origin location quoted in warnings; {@code null} when unknown
   * @return detections in line order
   */
  public List<Detection> parseAll(String line, String origin) {
    if (line == null) {
      return List.of();
    }
    List<Integer> starts = new ArrayList<>();
    Matcher matcher = MARKER.matcher(line);
    while (matcher.find()) {
      starts.add(matcher.start());
    }
    if (starts.size() <= 1) {
      return parse(line, origin).map(List::of).orElse(List.of());
    }
    List<Detection> detections = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      int from = i == 0 ? 0 : starts.get(i);
      int to = i + 1 < starts.size() ? starts.get(i + 1) : line.length();
      parse(line.substring(from, to), origin).ifPresent(detections::add);
    }
    return List.copyOf(detections);
  }

  private Optional<Detection> parseSegment(SensorType sensor, String text, String where) {
    Integer x = scalarValue(X, "x", text, where);
    Integer y = scalarValue(Y, "y", text, where);
    Integer confidence = scalarValue(CONFIDENCE, "confidence", text, where);
    if (x == null || y == null) {
      log.warn("Keeping {} record without {} at {}: {}",
          sensor, x == null ? "x" : "y", where, Logs.truncate(text, MAX_LOGGED_BYTES));
    }
    Map<String, Integer> raw = rawEntries(sensor, text, where);
    Detection detection = switch (sensor) {
      case RADAR -> new RadarDetection(
          x, y, confidence,
          raw.get("distance"), raw.get("theta"), raw.get("velocity"), raw.get("power"),
          null);
      case IMAGE -> new ImageDetection(
          x, y, confidence,
          raw.get("left"), raw.get("top"), raw.get("width"), raw.get("height"),
          null);
    };
    return Optional.of(detection);
  }

  private static Integer scalarValue(Pattern pattern, String key, String text, String where) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    String value = matcher.group(1);
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException ex) {
      log.warn("Ignoring unparsable {} value '{}' at {}", key, value, where);
      return null;
    }
  }

  private static Map<String, Integer> rawEntries(SensorType sensor, String text, String where) {
    Matcher matcher = (sensor == SensorType.RADAR ? RADAR_RAW : IMAGE_RAW).matcher(text);
    if (!matcher.find()) {
      return Map.of();
    }
    Map<String, Integer> entries = new LinkedHashMap<>();
    for (String item : matcher.group(1).split(",")) {
      String entry = item.trim();
      if (entry.isEmpty()) {
        continue;
      }
      int idx = entry.indexOf('=');
      if (idx <= 0) {
        log.warn("Skipping malformed {} raw entry '{}' at {}", sensor, entry, where);
        continue;
      }
      String key = entry.substring(0, idx).trim();
      String value = entry.substring(idx + 1).trim();
      try {
        entries.put(key, Integer.valueOf(value));
      } catch (NumberFormatException ex) {
        log.warn("Skipping non-integer {} raw field {}='{}' at {}", sensor, key, value, where);
      }
    }
    return entries;
  }

  private static Pattern scalar(String key) {
    return Pattern.compile("(?<![A-Za-z0-9_.])" + key + "\\s*=\\s*([^,}\\s]+)");
  }

  private static Pattern rawBlock(SensorType sensor) {
    return Pattern.compile("raw\\s*=\\s*[A-Za-z0-9_]*" + sensor.rawLabel() + "\\s*\\{([^}]*)}");
  }
}
