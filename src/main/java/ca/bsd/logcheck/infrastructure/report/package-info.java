/**
 * Report writers: JSON exports via Jackson streaming and the plain-text category listing.
 */
package ca.bsd.logcheck.infrastructure.report;
