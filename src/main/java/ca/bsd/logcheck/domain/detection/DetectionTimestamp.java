package ca.bsd.logcheck.domain.detection;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Timestamp header shared by every detection logged after it.
 * <p><strong>Role:</strong> Domain value used as the grouping key for time-frames.</p>
 * <p>Equality is exact equality of the parsed date-time; there is no tolerance window. Instances order
 * chronologically.</p>
 *
 * @param value parsed local date-time; never {@code null}
 * @since 0.1.0
 */
public record DetectionTimestamp(LocalDateTime value) implements Comparable<DetectionTimestamp> {
  private static final Pattern HEADER =
      Pattern.compile("(\\d{4}-\\d{2}-\\d{2})\\s+(\\d{2}:\\d{2}:\\d{2})\\.(\\d+)");
  private static final int MAX_FRACTION_DIGITS = 9;
  private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd HH:mm:ss")
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, MAX_FRACTION_DIGITS, true)
      .toFormatter()
      .withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
  private static final DateTimeFormatter NANOS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS");

  /**
   * Validates the timestamp value.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public DetectionTimestamp {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Tests whether a whole log line has the shape of a timestamp header.
   *
   * <p>A line can have the shape without naming a real date-time (month 13, hour 25); {@link #parseHeader(String)}
   * returns empty for such lines.</p>
   *
   * @param line raw line; surrounding whitespace is ignored
   * @return {@code true} when the trimmed line is a date, a time, and a fraction of any length
   */
  public static boolean isHeader(String line) {
    return line != null && HEADER.matcher(line.trim()).matches();
  }

  /**
   * Parses a whole log line as a timestamp header.
   *
   * <p>Fraction digits beyond nanoseconds are cut off.</p>
   *
   * @param line raw line; surrounding whitespace is ignored
   * @return parsed timestamp, or empty when the line is not a header or names no real date-time
   */
  public static Optional<DetectionTimestamp> parseHeader(String line) {
    if (line == null) {
      return Optional.empty();
    }
    Matcher matcher = HEADER.matcher(line.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String fraction = matcher.group(3);
    if (fraction.length() > MAX_FRACTION_DIGITS) {
      fraction = fraction.substring(0, MAX_FRACTION_DIGITS);
    }
    try {
      LocalDateTime parsed = LocalDateTime.parse(
          matcher.group(1) + ' ' + matcher.group(2) + '.' + fraction, PARSER);
      return Optional.of(new DetectionTimestamp(parsed));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  /**
   * Parses a timestamp header, failing on invalid input.
   *
   * @param text header text such as {@code 2025-01-02 15:53:39.120}
   * @return parsed timestamp
   * @throws IllegalArgumentException if {@code text} is not a timestamp header
   */
  public static DetectionTimestamp of(String text) {
    return parseHeader(text)
        .orElseThrow(() -> new IllegalArgumentException("not a timestamp header: " + text));
  }

  /**
   * Formats the timestamp the way sensor logs print it: millisecond precision unless finer digits are present.
   *
   * @return formatted timestamp text
   */
  public String format() {
    return value.getNano() % 1_000_000 == 0 ? MILLIS.format(value) : NANOS.format(value);
  }

  @Override
  public int compareTo(DetectionTimestamp other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return format();
  }
}
