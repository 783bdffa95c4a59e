package ca.bsd.logcheck.domain.detection;

import java.util.Objects;

/**
 * Image detection with the bounding box fields of the {@code ImageObjRaw} block.
 *
 * @param x lateral coordinate, or {@code null}
 * @param y longitudinal coordinate, or {@code null}
 * @param confidence reported confidence, or {@code null}
 * @param left bounding box left edge, or {@code null}
 * @param top bounding box top edge, or {@code null}
 * @param width bounding box width, or {@code null}
 * @param height bounding box height, or {@code null}
 * @param timestamp timestamp header, or {@code null} before the ingestor stamps the record
 * @since 0.1.0
 */
public record ImageDetection(
    Integer x,
    Integer y,
    Integer confidence,
    Integer left,
    Integer top,
    Integer width,
    Integer height,
    DetectionTimestamp timestamp) implements Detection {

  @Override
  public SensorType sensor() {
    return SensorType.IMAGE;
  }

  @Override
  public ImageDetection withTimestamp(DetectionTimestamp timestamp) {
    return new ImageDetection(
        x, y, confidence, left, top, width, height, Objects.requireNonNull(timestamp, "timestamp"));
  }
}
