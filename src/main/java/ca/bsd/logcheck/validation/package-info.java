/**
 * <strong>Purpose:</strong> Input validation for CLI arguments, configuration values, and filesystem targets.
 * <p>Failures surface as {@link java.lang.IllegalArgumentException} for the CLI to map onto exit codes.</p>
 *
 * @since 0.1.0
 */
package ca.bsd.logcheck.validation;
