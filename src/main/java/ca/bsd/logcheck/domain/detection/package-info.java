/**
 * Typed radar and image detections plus the aggregates produced by categorization and cross-sensor matching.
 * <p><strong>Role:</strong> Domain outputs of the ingest stage flowing into analysis and report adapters.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; list components are copied on construction.</p>
 */
package ca.bsd.logcheck.domain.detection;
