package ca.gc.cra.vcr.application.cassette;

import ca.gc.cra.vcr.application.port.CassetteStoragePort;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.InteractionNotFoundException;
import ca.gc.cra.vcr.domain.cassette.ReplayExhaustion;
import ca.gc.cra.vcr.domain.cassette.UnsupportedCassetteFormatException;
import ca.gc.cra.vcr.domain.fingerprint.DefaultRequestFingerprinter;
import ca.gc.cra.vcr.domain.fingerprint.RequestFingerprinter;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.validation.Strings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Interaction store backing one recorder: ordered interactions, a fingerprint index, and
 * versioned persistence.
 * <p><strong>Why:</strong> Replays must find the recorded counterpart of a live request in O(1) and survive process
 * restarts without silently accepting foreign formats.</p>
 * <p><strong>Role:</strong> Application service owned by a recorder; persists through {@link CassetteStoragePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append interactions with dense positions and computed fingerprints.</li>
 *   <li>Serve lookups honouring replay reuse and the exhaustion policy.</li>
 *   <li>Load and validate persisted documents; upgrade legacy documents on request.</li>
 *   <li>Drop discarded interactions and renumber on save.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every operation holds one owned {@link ReentrantLock} for its full duration. The
 * lock is never exposed and is not held by callers across network calls or hooks.</p>
 * <p><strong>Invariant:</strong> {@code index[f]} holds exactly the positions of the interactions whose fingerprint is
 * {@code f}, in ascending order, and an interaction's id equals its position.</p>
 * <p><strong>Observability:</strong> Emits {@code cassette.save} and {@code cassette.save.interactions}; logs loads and
 * saves at INFO and replay exhaustion at WARN.</p>
 *
 * @since 0.1.0
 */
public final class Cassette {
  private static final Logger log = LoggerFactory.getLogger(Cassette.class);

  private final String name;
  private final CassetteStoragePort storage;
  private final RequestFingerprinter fingerprinter;
  private final boolean replayableInteractions;
  private final boolean compressionEnabled;
  private final ReplayExhaustion replayExhaustion;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();

  private final List<Interaction> interactions = new ArrayList<>();
  private final Map<String, List<Integer>> index = new HashMap<>();
  private final Map<String, Integer> lastReplayed = new HashMap<>();
  private int nextId;
  private boolean isNew = true;
  private boolean stale;

  private Cassette(Builder builder) {
    this.name = builder.name;
    this.storage = builder.storage;
    this.fingerprinter = builder.fingerprinter;
    this.replayableInteractions = builder.replayableInteractions;
    this.compressionEnabled = builder.compressionEnabled;
    this.replayExhaustion = builder.replayExhaustion;
    this.metrics = builder.metrics;
  }

  /**
   * Starts a builder for a cassette persisted through {@code storage}.
   *
   * @param name cassette name; becomes {@code name.yaml} for file storage
   * @param storage storage adapter
   * @return new builder
   */
  public static Builder builder(String name, CassetteStoragePort storage) {
    return new Builder(name, storage);
  }

  /**
   * Loads the persisted document, replacing the in-memory state only after it validated.
   *
   * <p>Interactions lacking a persisted fingerprint have it recomputed and mark the cassette as requiring an
   * {@link #upgrade()}. Loading never writes.</p>
   *
   * @throws ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException when the cassette does not exist
   * @throws UnsupportedCassetteFormatException when the persisted version is not supported
   * @throws IOException when reading, decoding, or fingerprinting fails
   */
  public void load() throws IOException {
    lock.lock();
    try {
      String location = file();
      CassetteDocument document = storage.read(name, compressionEnabled);
      if (document.version() != CassetteFormat.VERSION) {
        throw new UnsupportedCassetteFormatException(location, document.version());
      }
      List<Interaction> loaded = new ArrayList<>(document.interactions());
      int recomputed = 0;
      for (int position = 0; position < loaded.size(); position++) {
        Interaction interaction = loaded.get(position);
        interaction.assignId(position);
        if (interaction.fingerprint().isBlank()) {
          interaction.assignFingerprint(fingerprintOf(interaction));
          recomputed++;
        }
      }
      interactions.clear();
      interactions.addAll(loaded);
      rebuildIndex();
      lastReplayed.clear();
      nextId = interactions.size();
      isNew = false;
      stale = recomputed > 0;
      if (stale) {
        log.warn("Cassette {} has {} interactions without persisted fingerprints; upgrade recommended",
            location, recomputed);
      }
      log.info("Loaded cassette {} with {} interactions", location, interactions.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether fingerprints had to be recomputed during {@link #load()}.
   *
   * @return {@code true} when an {@link #upgrade()} would rewrite the cassette
   */
  public boolean requiresUpgrade() {
    lock.lock();
    try {
      return stale;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Persists recomputed fingerprints so later loads use the stored index data.
   *
   * @return {@code true} when the cassette was rewritten
   * @throws IOException when saving fails
   */
  public boolean upgrade() throws IOException {
    lock.lock();
    try {
      if (!stale) {
        return false;
      }
      saveLocked();
      log.info("Upgraded cassette {} with persisted fingerprints", file());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends an interaction, assigning the next position and its fingerprint.
   *
   * @param interaction interaction to store; must not already belong to a cassette
   * @throws IOException when the recorded request cannot be fingerprinted
   */
  public void addInteraction(Interaction interaction) throws IOException {
    Objects.requireNonNull(interaction, "interaction");
    lock.lock();
    try {
      String fingerprint = fingerprintOf(interaction);
      int position = nextId++;
      interaction.assignId(position);
      interaction.assignFingerprint(fingerprint);
      interactions.add(interaction);
      index.computeIfAbsent(fingerprint, k -> new ArrayList<>()).add(position);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Finds the recorded interaction for a live request.
   *
   * <p>With replay reuse disabled the first unreplayed entry of the fingerprint bucket wins; once every entry was
   * replayed the {@link ReplayExhaustion} policy applies. With reuse enabled the first entry is returned every time.
   * The returned value is a copy whose request body and post form carry the live request's current content.</p>
   *
   * @param request live request; its body stays readable
   * @return copy of the matched interaction
   * @throws InteractionNotFoundException when nothing matches
   * @throws IOException when fingerprinting or reading the live body fails
   */
  public Interaction getInteraction(HttpRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    lock.lock();
    try {
      String fingerprint = fingerprinter.fingerprint(request);
      List<Integer> bucket = index.get(fingerprint);
      if (bucket == null || bucket.isEmpty()) {
        throw new InteractionNotFoundException(
            "Requested interaction not found in cassette " + name + ": " + request);
      }
      Interaction match = select(fingerprint, bucket, request);
      match.markReplayed();
      lastReplayed.put(fingerprint, match.id());
      return withLiveBody(match, request);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops discarded interactions, renumbers the rest from zero, and writes the cassette.
   *
   * @throws IOException when fingerprinting or writing fails
   */
  public void save() throws IOException {
    lock.lock();
    try {
      saveLocked();
    } finally {
      lock.unlock();
    }
  }

  private void saveLocked() throws IOException {
    List<Interaction> kept = new ArrayList<>(interactions.size());
    for (Interaction interaction : interactions) {
      if (!interaction.isDiscardOnSave()) {
        kept.add(interaction);
      }
    }
    int discarded = interactions.size() - kept.size();
    for (int position = 0; position < kept.size(); position++) {
      Interaction interaction = kept.get(position);
      interaction.assignId(position);
      interaction.assignFingerprint(fingerprintOf(interaction));
    }
    interactions.clear();
    interactions.addAll(kept);
    rebuildIndex();
    lastReplayed.clear();
    nextId = interactions.size();

    storage.write(name, new CassetteDocument(CassetteFormat.VERSION, compressionEnabled, interactions));
    stale = false;
    metrics.increment("cassette.save");
    metrics.observe("cassette.save.interactions", interactions.size());
    log.info("Saved cassette {} with {} interactions ({} discarded)", file(), interactions.size(), discarded);
  }

  private Interaction select(String fingerprint, List<Integer> bucket, HttpRequest request)
      throws InteractionNotFoundException {
    if (replayableInteractions) {
      return interactions.get(bucket.get(0));
    }
    for (int position : bucket) {
      Interaction candidate = interactions.get(position);
      if (!candidate.wasReplayed()) {
        return candidate;
      }
    }
    if (replayExhaustion == ReplayExhaustion.FAIL) {
      throw new InteractionNotFoundException("All " + bucket.size()
          + " recorded interactions for " + request + " were already replayed in cassette " + name);
    }
    int position = lastReplayed.getOrDefault(fingerprint, bucket.get(bucket.size() - 1));
    log.warn("All {} interactions for {} already replayed in cassette {}; reusing interaction {}",
        bucket.size(), request, name, position);
    return interactions.get(position);
  }

  private static Interaction withLiveBody(Interaction match, HttpRequest request) throws IOException {
    byte[] body = request.bufferBody();
    request.parseForm();
    Interaction copy = match.copy();
    copy.setRequest(match.request()
        .withBody(body)
        .withForm(request.postForm()));
    return copy;
  }

  private String fingerprintOf(Interaction interaction) throws IOException {
    try {
      return fingerprinter.fingerprint(interaction.request().toHttpRequest());
    } catch (IOException ex) {
      throw new IOException("Failed to fingerprint interaction " + interaction.id() + " in cassette " + name, ex);
    }
  }

  private void rebuildIndex() {
    index.clear();
    for (int position = 0; position < interactions.size(); position++) {
      index.computeIfAbsent(interactions.get(position).fingerprint(), k -> new ArrayList<>()).add(position);
    }
  }

  /** @return cassette name */
  public String name() {
    return name;
  }

  /** @return storage location, e.g. {@code fixtures/github.yaml.gz} */
  public String file() {
    return storage.location(name, compressionEnabled);
  }

  /** @return {@code true} until the cassette has been loaded from storage */
  public boolean isNew() {
    lock.lock();
    try {
      return isNew;
    } finally {
      lock.unlock();
    }
  }

  /** @return supported format version */
  public int version() {
    return CassetteFormat.VERSION;
  }

  /** @return whether replayed interactions stay eligible for later matches */
  public boolean isReplayableInteractions() {
    return replayableInteractions;
  }

  /** @return whether the cassette is written gzip-compressed */
  public boolean isCompressionEnabled() {
    return compressionEnabled;
  }

  /** @return policy applied once every matching interaction was replayed */
  public ReplayExhaustion replayExhaustion() {
    return replayExhaustion;
  }

  /** @return fingerprinter used to index recorded and live requests */
  public RequestFingerprinter fingerprinter() {
    return fingerprinter;
  }

  /**
   * Returns a snapshot list of the interactions held in memory. The elements are the live interactions.
   *
   * @return interactions in position order
   */
  public List<Interaction> interactions() {
    lock.lock();
    try {
      return List.copyOf(interactions);
    } finally {
      lock.unlock();
    }
  }

  /** @return number of interactions held in memory */
  public int size() {
    lock.lock();
    try {
      return interactions.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the positions indexed under {@code fingerprint}.
   *
   * @param fingerprint request digest
   * @return ascending positions; empty when none
   */
  public List<Integer> positions(String fingerprint) {
    lock.lock();
    try {
      List<Integer> bucket = index.get(fingerprint);
      return bucket == null ? List.of() : List.copyOf(bucket);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Cassette{" + name + '}';
  }

  /** Builder for {@link Cassette}. */
  public static final class Builder {
    private final String name;
    private final CassetteStoragePort storage;
    private RequestFingerprinter fingerprinter = DefaultRequestFingerprinter.standard();
    private boolean replayableInteractions;
    private boolean compressionEnabled;
    private ReplayExhaustion replayExhaustion = ReplayExhaustion.REUSE_LAST;
    private MetricsPort metrics = MetricsPort.NO_OP;

    private Builder(String name, CassetteStoragePort storage) {
      this.name = Strings.requireNonBlank("cassette name", name);
      this.storage = Objects.requireNonNull(storage, "storage");
    }

    public Builder fingerprinter(RequestFingerprinter fingerprinter) {
      this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
      return this;
    }

    public Builder replayableInteractions(boolean replayableInteractions) {
      this.replayableInteractions = replayableInteractions;
      return this;
    }

    public Builder compressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    public Builder replayExhaustion(ReplayExhaustion replayExhaustion) {
      this.replayExhaustion = Objects.requireNonNull(replayExhaustion, "replayExhaustion");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /** @return new, empty cassette flagged as new */
    public Cassette build() {
      return new Cassette(this);
    }

    /**
     * Builds the cassette and loads it from storage.
     *
     * @return loaded cassette
     * @throws IOException when loading fails
     */
    public Cassette load() throws IOException {
      Cassette cassette = build();
      cassette.load();
      return cassette;
    }
  }
}
