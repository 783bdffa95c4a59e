/**
 * Command-line entry points: the {@code logcheck} dispatcher, the {@code analyze} command, and shared argument
 * parsing, console output, and exit codes.
 */
package ca.bsd.logcheck.api;
