/**
 * OpenTelemetry-backed {@link ca.bsd.logcheck.application.port.MetricsPort} implementation.
 */
package ca.bsd.logcheck.infrastructure.metrics;
