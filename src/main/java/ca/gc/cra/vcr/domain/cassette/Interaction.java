package ca.gc.cra.vcr.domain.cassette;

import java.util.Objects;

/**
 * <strong>What:</strong> One recorded request/response pair plus the bookkeeping a cassette needs.
 * <p><strong>Why:</strong> Hooks edit recorded exchanges in place (redaction, discarding) while the cassette keeps
 * positions, fingerprints, and replay state alongside them.</p>
 * <p><strong>Role:</strong> Domain entity owned by a cassette and handed to hooks for the duration of one call.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry the dense position and the persisted fingerprint.</li>
 *   <li>Let hooks swap request/response snapshots and flag the interaction for discard on save.</li>
 *   <li>Report whether a lookup has returned it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Fields are volatile for visibility; the owning cassette serializes structural
 * updates and hooks must not retain references beyond their call.</p>
 *
 * @since 0.1.0
 */
public final class Interaction {
  private volatile int id;
  private volatile String fingerprint;
  private volatile RecordedRequest request;
  private volatile RecordedResponse response;
  private volatile boolean discardOnSave;
  private volatile boolean replayed;

  /**
   * Creates an interaction that has not yet been added to a cassette.
   *
   * @param request recorded request; must not be {@code null}
   * @param response recorded response; must not be {@code null}
   */
  public Interaction(RecordedRequest request, RecordedResponse response) {
    this(-1, "", request, response);
  }

  private Interaction(int id, String fingerprint, RecordedRequest request, RecordedResponse response) {
    this.id = id;
    this.fingerprint = fingerprint == null ? "" : fingerprint;
    this.request = Objects.requireNonNull(request, "request");
    this.response = Objects.requireNonNull(response, "response");
  }

  /**
   * Recreates an interaction read back from storage.
   *
   * @param id persisted position
   * @param fingerprint persisted fingerprint; blank for legacy entries
   * @param request recorded request
   * @param response recorded response
   * @return restored interaction
   */
  public static Interaction restore(
      int id, String fingerprint, RecordedRequest request, RecordedResponse response) {
    return new Interaction(id, fingerprint, request, response);
  }

  /** @return dense position; {@code -1} until added to a cassette */
  public int id() {
    return id;
  }

  /**
   * Assigns the position. Managed by the owning cassette.
   *
   * @param id position within the cassette
   */
  public void assignId(int id) {
    this.id = id;
  }

  /** @return persisted fingerprint; empty when not yet computed */
  public String fingerprint() {
    return fingerprint;
  }

  /**
   * Stores the fingerprint. Managed by the owning cassette.
   *
   * @param fingerprint request digest
   */
  public void assignFingerprint(String fingerprint) {
    this.fingerprint = fingerprint == null ? "" : fingerprint;
  }

  public RecordedRequest request() {
    return request;
  }

  public void setRequest(RecordedRequest request) {
    this.request = Objects.requireNonNull(request, "request");
  }

  public RecordedResponse response() {
    return response;
  }

  public void setResponse(RecordedResponse response) {
    this.response = Objects.requireNonNull(response, "response");
  }

  /** @return {@code true} when the interaction will be dropped on the next save */
  public boolean isDiscardOnSave() {
    return discardOnSave;
  }

  public void setDiscardOnSave(boolean discardOnSave) {
    this.discardOnSave = discardOnSave;
  }

  /** @return {@code true} once a lookup has returned this interaction */
  public boolean wasReplayed() {
    return replayed;
  }

  /** Flags the interaction as replayed. Managed by the owning cassette. */
  public void markReplayed() {
    this.replayed = true;
  }

  /**
   * Returns an independent copy carrying the same snapshots and flags.
   *
   * @return copy of this interaction
   */
  public Interaction copy() {
    Interaction copy = new Interaction(id, fingerprint, request, response);
    copy.discardOnSave = discardOnSave;
    copy.replayed = replayed;
    return copy;
  }

  @Override
  public String toString() {
    return "Interaction{id=" + id + ", " + request.method() + ' ' + request.url()
        + " -> " + response.code() + '}';
  }
}
