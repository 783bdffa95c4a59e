package ca.bsd.logcheck.domain.detection;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> All radar and image detections sharing one exact timestamp.
 * <p><strong>Role:</strong> Unit of the cross-sensor match decision; produced only by the matcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied on construction.</p>
 *
 * @param timestamp shared timestamp; never {@code null}
 * @param radar radar detections at {@code timestamp} in encounter order
 * @param image image detections at {@code timestamp} in encounter order
 * @since 0.1.0
 */
public record TimeFrame(DetectionTimestamp timestamp, List<RadarDetection> radar, List<ImageDetection> image) {

  /**
   * Copies the detection lists.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public TimeFrame {
    Objects.requireNonNull(timestamp, "timestamp");
    radar = List.copyOf(Objects.requireNonNull(radar, "radar"));
    image = List.copyOf(Objects.requireNonNull(image, "image"));
  }
}
