/**
 * Application layer of the BSD log consistency checker: ingest, analysis, ports, and the batch pipeline.
 * <p><strong>Role:</strong> Coordinates domain values and ports; contains no filesystem or exporter specifics.</p>
 * <p><strong>Concurrency:</strong> Single-threaded batch execution; analysis components are stateless.</p>
 */
package ca.bsd.logcheck.application;
