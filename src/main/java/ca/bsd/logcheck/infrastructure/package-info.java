/**
 * Adapters implementing the application ports: filesystem log sources, report writers, and metrics.
 */
package ca.bsd.logcheck.infrastructure;
