package ca.bsd.logcheck.application.ingest;

import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import java.util.List;
import java.util.Objects;

/**
 * Detections gathered from one batch plus ingest bookkeeping.
 *
 * @param radar stamped radar detections in file enumeration order, then line order
 * @param image stamped image detections in file enumeration order, then line order
 * @param filesRead files processed to the end
 * @param filesFailed files abandoned because of an I/O failure
 * @param droppedDetections detections discarded because no timestamp preceded them in their file
 * @since 0.1.0
 */
public record IngestResult(
    List<RadarDetection> radar,
    List<ImageDetection> image,
    int filesRead,
    int filesFailed,
    int droppedDetections) {

  /**
   * Copies the detection lists.
   */
  public IngestResult {
    radar = List.copyOf(Objects.requireNonNull(radar, "radar"));
    image = List.copyOf(Objects.requireNonNull(image, "image"));
  }

  /**
   * Returns a copy carrying reordered detection lists and the same bookkeeping.
   *
   * @param radar replacement radar list
   * @param image replacement image list
   * @return new result
   */
  public IngestResult withDetections(List<RadarDetection> radar, List<ImageDetection> image) {
    return new IngestResult(radar, image, filesRead, filesFailed, droppedDetections);
  }
}
