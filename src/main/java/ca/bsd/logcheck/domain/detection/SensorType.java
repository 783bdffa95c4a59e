package ca.bsd.logcheck.domain.detection;

/**
 * <strong>What:</strong> Sensor subsystems emitting detection records.
 * <p><strong>Role:</strong> Domain enumeration used by the parser to recognize marker tokens and by report
 * adapters to label output sections.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum SensorType {
  /** Radar subsystem; records carry {@code RadarObjInfo} markers and {@code RadarObjRaw} blocks. */
  RADAR("RadarObjInfo", "RadarObjRaw"),
  /** Imaging subsystem; records carry {@code ImageObjInfo} markers and {@code ImageObjRaw} blocks. */
  IMAGE("ImageObjInfo", "ImageObjRaw");

  private final String infoMarker;
  private final String rawLabel;

  SensorType(String infoMarker, String rawLabel) {
    this.infoMarker = infoMarker;
    this.rawLabel = rawLabel;
  }

  /**
   * Returns the token that identifies a detection record of this sensor.
   *
   * @return marker suffix such as {@code RadarObjInfo}; vendor prefixes (e.g. {@code Bsd}) are allowed before it
   */
  public String infoMarker() {
    return infoMarker;
  }

  /**
   * Returns the label of the nested raw key/value block.
   *
   * @return raw block label suffix such as {@code RadarObjRaw}
   */
  public String rawLabel() {
    return rawLabel;
  }
}
