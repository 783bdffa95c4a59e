/**
 * Filesystem-backed {@link ca.bsd.logcheck.application.port.LogSource} implementations.
 */
package ca.bsd.logcheck.infrastructure.source;
