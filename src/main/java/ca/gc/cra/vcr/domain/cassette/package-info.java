/**
 * Recorded interactions and the persisted cassette format.
 * <p><strong>Role:</strong> Domain snapshots stored by the cassette store and edited by recorder hooks.</p>
 * <p><strong>Concurrency:</strong> Snapshots are immutable; {@link ca.gc.cra.vcr.domain.cassette.Interaction} uses
 * volatile fields and is mutated under the owning cassette's lock or by one hook at a time.</p>
 * <p><strong>Performance:</strong> Copies are shallow where snapshots are shared.</p>
 * <p><strong>Security:</strong> Recorded bodies and headers are persisted verbatim unless a hook redacts them.</p>
 */
package ca.gc.cra.vcr.domain.cassette;
