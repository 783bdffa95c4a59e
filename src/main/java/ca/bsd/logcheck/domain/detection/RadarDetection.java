package ca.bsd.logcheck.domain.detection;

import java.util.Objects;

/**
 * Radar detection with the typed fields of the {@code RadarObjRaw} block.
 *
 * @param x lateral coordinate, or {@code null}
 * @param y longitudinal coordinate, or {@code null}
 * @param confidence reported confidence, or {@code null}
 * @param distance raw distance, or {@code null}
 * @param theta raw azimuth, or {@code null}
 * @param velocity raw velocity, or {@code null}; {@code null} is never treated as zero
 * @param power raw power, or {@code null}
 * @param timestamp timestamp header, or {@code null} before the ingestor stamps the record
 * @since 0.1.0
 */
public record RadarDetection(
    Integer x,
    Integer y,
    Integer confidence,
    Integer distance,
    Integer theta,
    Integer velocity,
    Integer power,
    DetectionTimestamp timestamp) implements Detection {

  @Override
  public SensorType sensor() {
    return SensorType.RADAR;
  }

  @Override
  public RadarDetection withTimestamp(DetectionTimestamp timestamp) {
    return new RadarDetection(
        x, y, confidence, distance, theta, velocity, power, Objects.requireNonNull(timestamp, "timestamp"));
  }

  /**
   * Indicates whether the radar reported a non-zero velocity.
   *
   * @return {@code true} only when velocity is present and not zero
   */
  public boolean moving() {
    return velocity != null && velocity != 0;
  }

  /**
   * Indicates whether the radar reported exactly zero velocity.
   *
   * @return {@code true} only when velocity is present and zero
   */
  public boolean stationary() {
    return velocity != null && velocity == 0;
  }
}
