package ca.bsd.logcheck.application.ingest;

/**
 * Raised when a log source cannot supply any input: the input folder is missing or unreadable, or it contains no
 * matching files.
 *
 * @since 0.1.0
 */
public final class IngestException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the fatal input condition
   */
  public IngestException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the fatal input condition
   * @param cause underlying failure
   */
  public IngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
