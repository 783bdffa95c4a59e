/**
 * Logging helpers: runtime verbosity control for the CLI and truncation of log line excerpts.
 *
 * @since 0.1.0
 */
package ca.bsd.logcheck.logging;
