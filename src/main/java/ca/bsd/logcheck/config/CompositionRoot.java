package ca.bsd.logcheck.config;

import ca.bsd.logcheck.application.analysis.CrossSensorMatcher;
import ca.bsd.logcheck.application.analysis.RadarCategorizer;
import ca.bsd.logcheck.application.ingest.LogIngestor;
import ca.bsd.logcheck.application.ingest.RecordParser;
import ca.bsd.logcheck.application.pipeline.AnalyzeUseCase;
import ca.bsd.logcheck.application.port.LogSource;
import ca.bsd.logcheck.application.port.MetricsPort;
import ca.bsd.logcheck.application.port.ReportPort;
import ca.bsd.logcheck.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.bsd.logcheck.infrastructure.report.FileReportAdapter;
import ca.bsd.logcheck.infrastructure.source.DirectoryLogSource;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analyze use case to its concrete adapters.
 * <p><strong>Role:</strong> Composition root invoked once by the CLI after configuration is validated.</p>
 * <p><strong>Thread-safety:</strong> Holds only the metrics port; factory methods allocate fresh graphs.</p>
 * <p>Closing the root flushes and releases the metrics exporter when it owns one.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metrics metrics adapter handed to constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the analyze use case reading from {@link AnalyzeConfig#inputDirectory()} and writing reports to
   * {@link AnalyzeConfig#outputDirectory()}.
   *
   * @param config validated analyze configuration
   * @return use case ready to run
   */
  public AnalyzeUseCase analyzeUseCase(AnalyzeConfig config) {
    Objects.requireNonNull(config, "config");
    LogSource source = new DirectoryLogSource(config.inputDirectory(), config.filePattern(), config.charset());
    ReportPort reports = new FileReportAdapter(config.outputDirectory());
    return new AnalyzeUseCase(
        config,
        source,
        new LogIngestor(new RecordParser()),
        new RadarCategorizer(),
        new CrossSensorMatcher(),
        reports,
        metrics);
  }

  /**
   * Returns the metrics port shared by use cases built here.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
