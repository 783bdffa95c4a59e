package ca.bsd.logcheck.infrastructure.report;

import ca.bsd.logcheck.domain.detection.RadarCategories;
import ca.bsd.logcheck.domain.detection.RadarCategory;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import java.io.IOException;
import java.io.Writer;
import java.util.StringJoiner;

/**
 * Renders categorized radar detections in the sensor log's own text layout.
 *
 * <p>Each category starts with {@code === label ===} and a blank line. Every entry is its timestamp line, the
 * canonical {@code BsdRadarObjInfo} line, and a blank line. A further blank line closes each category. Fields
 * the record did not carry are left out of the info line.</p>
 */
final class CategoryTextRenderer {
  static final String RADAR_INFO_PREFIX = "Bsd";

  private CategoryTextRenderer() {}

  static void render(RadarCategories categories, Writer out) throws IOException {
    for (RadarCategory category : RadarCategory.values()) {
      out.write("=== " + category.label() + " ===\n\n");
      for (RadarDetection detection : categories.get(category)) {
        out.write(detection.timestamp() == null ? "" : detection.timestamp().format());
        out.write('\n');
        out.write(infoLine(detection));
        out.write("\n\n");
      }
      out.write('\n');
    }
  }

  static String infoLine(RadarDetection detection) {
    StringJoiner raw = new StringJoiner(", ", RADAR_INFO_PREFIX + detection.sensor().rawLabel() + " {", "}");
    raw.setEmptyValue("");
    appendPresent(raw, "distance", detection.distance());
    appendPresent(raw, "theta", detection.theta());
    appendPresent(raw, "velocity", detection.velocity());
    appendPresent(raw, "power", detection.power());

    StringJoiner info = new StringJoiner(", ", RADAR_INFO_PREFIX + detection.sensor().infoMarker() + " {", "}");
    appendPresent(info, "x", detection.x());
    appendPresent(info, "y", detection.y());
    appendPresent(info, "confidence", detection.confidence());
    if (raw.length() > 0) {
      info.add("raw=" + raw);
    }
    return info.toString();
  }

  private static void appendPresent(StringJoiner joiner, String key, Integer value) {
    if (value != null) {
      joiner.add(key + '=' + value);
    }
  }
}
