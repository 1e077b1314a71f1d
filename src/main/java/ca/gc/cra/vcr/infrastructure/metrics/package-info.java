/**
 * Metrics adapter bridging {@link ca.gc.cra.vcr.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are safe from request threads.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code recorder.*} and {@code cassette.*} names emitted by the
 * application layer.</p>
 * <p><strong>Security:</strong> Only metric names and counts are exported, never request or response content.</p>
 */
package ca.gc.cra.vcr.infrastructure.metrics;
