/**
 * Ports connecting the analysis pipeline to log sources, report sinks, and metrics backends.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code ca.bsd.logcheck.infrastructure}.</p>
 */
package ca.bsd.logcheck.application.port;
