/**
 * <strong>Purpose:</strong> Ports defining the record and replay contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate HTTP clients,
 * file storage, and telemetry.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose metrics hooks but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vcr.application.port;
