package ca.bsd.logcheck.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for analysis runs.
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * disabled exporters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @implNote Metric keys use dotted names such as {@code logcheck.detections.radar}; callers must not pass
 * {@code null}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  default void increment(String key) {
    add(key, 1);
  }

  /**
   * Adds {@code delta} to the named counter.
   *
   * @param key metric identifier; must not be {@code null}
   * @param delta non-negative amount
   */
  void add(String key, long delta);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void add(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
