package ca.bsd.logcheck.infrastructure.report;

import ca.bsd.logcheck.domain.detection.Detection;
import ca.bsd.logcheck.domain.detection.ImageDetection;
import ca.bsd.logcheck.domain.detection.RadarDetection;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.List;

/**
 * Streams detections as JSON objects. Absent optional fields are written as {@code null}.
 */
final class DetectionJsonWriter {

  private DetectionJsonWriter() {}

  static void writeArray(JsonGenerator gen, String field, List<? extends Detection> detections) throws IOException {
    gen.writeArrayFieldStart(field);
    for (Detection detection : detections) {
      write(gen, detection);
    }
    gen.writeEndArray();
  }

  static void write(JsonGenerator gen, Detection detection) throws IOException {
    gen.writeStartObject();
    if (detection.timestamp() == null) {
      gen.writeNullField("timestamp");
    } else {
      gen.writeStringField("timestamp", detection.timestamp().format());
    }
    writeNullable(gen, "x", detection.x());
    writeNullable(gen, "y", detection.y());
    writeNullable(gen, "confidence", detection.confidence());
    if (detection instanceof RadarDetection radar) {
      writeNullable(gen, "distance", radar.distance());
      writeNullable(gen, "theta", radar.theta());
      writeNullable(gen, "velocity", radar.velocity());
      writeNullable(gen, "power", radar.power());
    } else if (detection instanceof ImageDetection image) {
      writeNullable(gen, "left", image.left());
      writeNullable(gen, "top", image.top());
      writeNullable(gen, "width", image.width());
      writeNullable(gen, "height", image.height());
    }
    gen.writeEndObject();
  }

  private static void writeNullable(JsonGenerator gen, String field, Integer value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeNumberField(field, value.intValue());
    }
  }
}
