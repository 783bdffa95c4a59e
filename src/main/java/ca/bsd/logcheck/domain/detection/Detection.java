package ca.bsd.logcheck.domain.detection;

import java.util.Objects;

/**
 * <strong>What:</strong> One parsed sensor observation, either a radar or an image detection.
 * <p><strong>Role:</strong> Domain value produced by the record parser, stamped by the log ingestor, and consumed
 * read-only by categorization, matching, and report adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 * <p>{@link #timestamp()} is {@code null} only on records returned directly by the parser; every record emitted by
 * the ingestor is stamped.</p>
 *
 * @since 0.1.0
 */
public sealed interface Detection permits RadarDetection, ImageDetection {

  /**
   * Returns the sensor that produced this detection.
   *
   * @return sensor type; never {@code null}
   */
  SensorType sensor();

  /**
   * Returns the lateral coordinate.
   *
   * @return x coordinate, or {@code null} when the record omitted it
   */
  Integer x();

  /**
   * Returns the longitudinal coordinate.
   *
   * @return y coordinate, or {@code null} when the record omitted it
   */
  Integer y();

  /**
   * Returns the reported confidence.
   *
   * @return confidence, or {@code null} when the record omitted it
   */
  Integer confidence();

  /**
   * Returns the timestamp header under which the record was logged.
   *
   * @return timestamp, or {@code null} for an unstamped parser result
   */
  DetectionTimestamp timestamp();

  /**
   * Returns a copy attributed to the given timestamp.
   *
   * @param timestamp timestamp to attach; must not be {@code null}
   * @return stamped copy of this detection
   */
  Detection withTimestamp(DetectionTimestamp timestamp);

  /**
   * Compares the fields used for cross-sensor matching.
   *
   * @param other detection from the other sensor
   * @return {@code true} when {@code x}, {@code y} and {@code confidence} are all equal; two missing values are equal
   */
  default boolean samePosition(Detection other) {
    return other != null
        && Objects.equals(x(), other.x())
        && Objects.equals(y(), other.y())
        && Objects.equals(confidence(), other.confidence());
  }
}
