/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize recorded payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Redacts credential headers and truncates bodies in debug output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vcr.logging;
