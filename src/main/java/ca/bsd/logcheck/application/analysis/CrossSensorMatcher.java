package ca.bsd.logcheck.application.analysis;

import ca.bsd.logcheck.domain.detection.DetectionTimestamp;
import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.MatchReport;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import ca.bsd.logcheck.domain.detection.TimeFrame;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Verifies that every radar detection has an image counterpart at the same timestamp.
 * <p><strong>Role:</strong> Consistency check between the radar and imaging subsystems.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Visit the distinct radar timestamps in ascending order; image-only timestamps are never visited.</li>
 *   <li>Match a radar detection when any image detection at the same timestamp has equal {@code x}, {@code y},
 *   and {@code confidence}. One image detection may satisfy several radar detections.</li>
 *   <li>Classify a time-frame as matched only when all its radar detections match; otherwise the whole
 *   time-frame, image detections included, is unmatched.</li>
 *   <li>Report {@code 100 * matched / total} radar detections, or {@code 0.0} when there are none.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; results depend only on the inputs.</p>
 *
 * @since 0.1.0
 */
public final class CrossSensorMatcher {

  /**
   * Creates a matcher.
   */
  public CrossSensorMatcher() {}

  /**
   * Matches radar detections against image detections per timestamp.
   *
   * @param radar stamped radar detections; must not be {@code null}
   * @param image stamped image detections; must not be {@code null}
   * @return matched and unmatched time-frames with the aggregate percentage
   */
  public MatchReport match(List<RadarDetection> radar, List<ImageDetection> image) {
    Objects.requireNonNull(radar, "radar");
    Objects.requireNonNull(image, "image");
    if (radar.isEmpty()) {
      return MatchReport.empty();
    }

    Map<DetectionTimestamp, List<RadarDetection>> radarByTime = new TreeMap<>();
    for (RadarDetection detection : radar) {
      radarByTime.computeIfAbsent(requireStamped(detection.timestamp()), t -> new ArrayList<>()).add(detection);
    }
    Map<DetectionTimestamp, List<ImageDetection>> imageByTime = new HashMap<>();
    for (ImageDetection detection : image) {
      imageByTime.computeIfAbsent(requireStamped(detection.timestamp()), t -> new ArrayList<>()).add(detection);
    }

    List<TimeFrame> matched = new ArrayList<>();
    List<TimeFrame> unmatched = new ArrayList<>();
    int matchedCount = 0;
    int totalCount = 0;
    for (Map.Entry<DetectionTimestamp, List<RadarDetection>> entry : radarByTime.entrySet()) {
      List<RadarDetection> frameRadar = entry.getValue();
      List<ImageDetection> frameImage = imageByTime.getOrDefault(entry.getKey(), List.of());
      TimeFrame frame = new TimeFrame(entry.getKey(), frameRadar, frameImage);
      totalCount += frameRadar.size();
      if (!frameRadar.isEmpty() && allMatched(frameRadar, frameImage)) {
        matched.add(frame);
        matchedCount += frameRadar.size();
      } else {
        unmatched.add(frame);
      }
    }
    double percentage = totalCount > 0 ? 100.0 * matchedCount / totalCount : 0.0;
    return new MatchReport(matched, unmatched, matchedCount, totalCount, percentage);
  }

  private static boolean allMatched(List<RadarDetection> radar, List<ImageDetection> image) {
    for (RadarDetection r : radar) {
      boolean found = false;
      for (ImageDetection i : image) {
        if (r.samePosition(i)) {
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  private static DetectionTimestamp requireStamped(DetectionTimestamp timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("detections must be stamped before matching");
    }
    return timestamp;
  }
}
