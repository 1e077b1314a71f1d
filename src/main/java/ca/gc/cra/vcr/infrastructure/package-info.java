/**
 * Infrastructure adapters binding the recorder's ports to files, {@code java.net.http}, the JDK HTTP server, and
 * OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer; the application layer never imports these types directly.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees.</p>
 */
package ca.gc.cra.vcr.infrastructure;
