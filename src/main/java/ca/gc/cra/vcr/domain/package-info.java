/**
 * Core domain model for recording and replaying HTTP interactions.
 * <p><strong>Role:</strong> Domain layer describing live messages, recorded snapshots, cassettes, and fingerprints without
 * transport dependencies.</p>
 * <p><strong>Concurrency:</strong> Snapshots are immutable; live messages and interactions are confined unless noted.</p>
 * <p><strong>Performance:</strong> Bodies are buffered in memory; cassettes are expected to fit in the heap.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed {@code recorder.*} and {@code cassette.*} metrics.</p>
 * <p><strong>Security:</strong> Recorded payloads may contain credentials; scrub them with hooks before saving.</p>
 */
package ca.gc.cra.vcr.domain;
