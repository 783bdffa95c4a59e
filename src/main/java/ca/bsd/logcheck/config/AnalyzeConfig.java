package ca.bsd.logcheck.config;

import ca.bsd.logcheck.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Configuration for the analyze pipeline.
 * <p><strong>Role:</strong> Adapter configuration aggregate built by the analyze CLI from defaults, YAML, and
 * {@code key=value} arguments.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the input log folder and the report folder.</li>
 *   <li>Select input files by glob and decode them with the configured charset.</li>
 *   <li>Toggle the chronological sort applied before export.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param inputDirectory folder holding sensor log files
 * @param outputDirectory folder receiving reports
 * @param filePattern glob selecting log files inside {@code inputDirectory}; {@code null} defaults to {@code *.txt}
 * @param charset input charset; {@code null} defaults to UTF-8
 * @param sortDetections whether detections are sorted by timestamp then {@code y} before export
 * @since 0.1.0
 * @see ca.bsd.logcheck.application.pipeline.AnalyzeUseCase
 */
public record AnalyzeConfig(
    Path inputDirectory,
    Path outputDirectory,
    String filePattern,
    Charset charset,
    boolean sortDetections) {

  static final String DEFAULT_PATTERN = "*.txt";

  /**
   * Normalizes paths and applies defaults.
   *
   * @throws IllegalArgumentException if a path is missing or the pattern is blank
   */
  public AnalyzeConfig {
    inputDirectory = normalizePath("inputDirectory", inputDirectory);
    outputDirectory = normalizePath("outputDirectory", outputDirectory);
    filePattern = filePattern == null ? DEFAULT_PATTERN : Strings.requireNonBlank("pattern", filePattern);
    charset = Objects.requireNonNullElse(charset, StandardCharsets.UTF_8);
  }

  /**
   * Returns a configuration reading {@code ./input} and writing {@code ./output}.
   *
   * @return default analyze configuration
   */
  public static AnalyzeConfig defaults() {
    return new AnalyzeConfig(
        Path.of("input"),
        Path.of("output"),
        DEFAULT_PATTERN,
        StandardCharsets.UTF_8,
        true);
  }

  /**
   * Creates a configuration from flattened {@code key=value} options.
   *
   * @param options keys {@code in}, {@code out}, {@code pattern}, {@code charset}, {@code sort}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    AnalyzeConfig defaults = defaults();

    String inRaw = firstNonBlank(options, "in", "input");
    Path input = inRaw == null ? defaults.inputDirectory() : parsePath("in", inRaw);
    String outRaw = firstNonBlank(options, "out", "output");
    Path output = outRaw == null ? defaults.outputDirectory() : parsePath("out", outRaw);
    String pattern = firstNonBlank(options, "pattern");
    Charset charset = parseCharset(firstNonBlank(options, "charset"), defaults.charset());
    boolean sort = parseBoolean("sort", options.get("sort"), defaults.sortDetections());

    return new AnalyzeConfig(
        input,
        output,
        pattern == null ? defaults.filePattern() : pattern,
        charset,
        sort);
  }

  private static Path normalizePath(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path parsePath(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Charset parseCharset(String raw, Charset fallback) {
    if (raw == null) {
      return fallback;
    }
    try {
      return Charset.forName(raw.trim());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException("charset is not supported: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String name, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }

  private static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
