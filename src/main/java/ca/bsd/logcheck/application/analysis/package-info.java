/**
 * Pure analysis functions over ingested detections: radar categorization, cross-sensor matching, and
 * chronological ordering.
 * <p><strong>Concurrency:</strong> Stateless and referentially transparent; safe to share.</p>
 */
package ca.bsd.logcheck.application.analysis;
