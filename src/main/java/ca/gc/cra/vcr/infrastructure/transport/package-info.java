/**
 * Outbound HTTP adapters built on {@code java.net.http}.
 * <p><strong>Role:</strong> {@link ca.gc.cra.vcr.infrastructure.transport.JdkHttpTransport} performs real exchanges;
 * {@link ca.gc.cra.vcr.infrastructure.transport.RecordingHttpClient} exposes any transport as a drop-in
 * {@link java.net.http.HttpClient}.</p>
 * <p><strong>Concurrency:</strong> Both adapters are thread-safe.</p>
 * <p><strong>Performance:</strong> Bodies are buffered in memory; streaming bodies are not supported.</p>
 */
package ca.gc.cra.vcr.infrastructure.transport;
