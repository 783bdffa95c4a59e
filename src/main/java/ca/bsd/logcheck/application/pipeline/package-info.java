/**
 * Batch pipeline that ingests sensor logs, categorizes radar detections, matches radar against image detections,
 * and hands the results to report adapters.
 * <p>The use case is stateless between runs and single-threaded; create it once per CLI invocation. Configuration
 * arrives as a validated {@link ca.bsd.logcheck.config.AnalyzeConfig}; counters flow through
 * {@link ca.bsd.logcheck.application.port.MetricsPort}.</p>
 */
package ca.bsd.logcheck.application.pipeline;
