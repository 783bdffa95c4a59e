/**
 * Line parsing and per-file timestamp attribution for sensor logs.
 * <p>{@link ca.bsd.logcheck.application.ingest.RecordParser} is stateless; {@link
 * ca.bsd.logcheck.application.ingest.LogIngestor} keeps its timestamp context on the stack of each file fold.
 * Anomalies are logged as warnings and never abort a batch, except for the fatal source conditions reported
 * through {@link ca.bsd.logcheck.application.ingest.IngestException}.</p>
 */
package ca.bsd.logcheck.application.ingest;
