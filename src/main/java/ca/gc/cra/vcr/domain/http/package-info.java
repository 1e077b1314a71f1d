/**
 * Transport-neutral HTTP messages exchanged between adapters and the recorder.
 * <p><strong>Role:</strong> Domain inputs produced by client and server adapters and consumed by the recorder.</p>
 * <p><strong>Concurrency:</strong> Requests are mutable and confined to one exchange; header maps are not thread-safe.</p>
 * <p><strong>Performance:</strong> Bodies are buffered once and replayed from memory.</p>
 * <p><strong>Security:</strong> Carries raw headers and bodies; treat as sensitive data.</p>
 */
package ca.gc.cra.vcr.domain.http;
