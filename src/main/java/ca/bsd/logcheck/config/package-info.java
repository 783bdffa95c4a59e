/**
 * Configuration records, defaults, YAML loading, and the composition root for the analyze pipeline.
 * <p>Effective settings are merged with precedence CLI &gt; YAML &gt; defaults, then validated into an immutable
 * {@link ca.bsd.logcheck.config.AnalyzeConfig}.</p>
 */
package ca.bsd.logcheck.config;
