/**
 * Server-side capture for handlers hosted by the JDK {@code com.sun.net.httpserver} server.
 * <p><strong>Role:</strong> Inbound adapter turning served exchanges into cassette interactions.</p>
 * <p><strong>Concurrency:</strong> Filters run on the server's executor threads; the recorder serializes writes.</p>
 * <p><strong>Performance:</strong> Request and response bodies are buffered in memory.</p>
 */
package ca.gc.cra.vcr.infrastructure.server;
