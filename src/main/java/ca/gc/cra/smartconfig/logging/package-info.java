/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Redaction helpers keep decrypted secrets out of logs and diffs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.smartconfig.logging;
