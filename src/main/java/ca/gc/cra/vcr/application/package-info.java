/**
 * Application layer: the cassette store, the recorder, server replay verification, and their ports.
 * <p><strong>Role:</strong> Orchestrates domain types through ports; contains no transport or file-format code.</p>
 * <p><strong>Concurrency:</strong> Services document their own locking; ports must be thread-safe.</p>
 * <p><strong>Metrics:</strong> Emits {@code recorder.*} and {@code cassette.*} through {@link ca.gc.cra.vcr.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.vcr.application;
