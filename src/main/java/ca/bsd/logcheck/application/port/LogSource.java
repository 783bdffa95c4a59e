package ca.bsd.logcheck.application.port;

import ca.bsd.logcheck.application.ingest.IngestException;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Input port enumerating the sensor log files of one batch.
 * <p><strong>Role:</strong> Source side of the hexagon; implemented by {@code DirectoryLogSource} and by in-memory
 * sources in tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate files in a deterministic order.</li>
 *   <li>Signal fatal input conditions (missing folder, no matching files) via {@link IngestException}.</li>
 *   <li>Open each file lazily so a failure on one file does not affect the others.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface LogSource {

  /**
   * Describes the source for logs and reports (typically the folder path).
   *
   * @return human-readable description
   */
  String description();

  /**
   * Lists the files to ingest.
   *
   * @return non-empty list of files in enumeration order
   * @throws IngestException if the source is missing, unreadable, or contains no matching files
   */
  List<LogFile> files() throws IngestException;

  /**
   * One log file of the batch.
   */
  interface LogFile {
    /**
     * Returns the file name used in warnings.
     *
     * @return file name
     */
    String name();

    /**
     * Opens the file for line-oriented reading; the caller closes the reader.
     *
     * @return reader positioned at the first line
     * @throws IOException if the file cannot be opened
     */
    BufferedReader open() throws IOException;
  }
}
