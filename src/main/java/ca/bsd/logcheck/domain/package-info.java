/**
 * Core domain model for the BSD log consistency checker.
 * <p><strong>Role:</strong> Domain layer values describing sensor detections, time-frames, radar categories, and
 * match results without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.bsd.logcheck.domain;
