package ca.gc.cra.vcr.application.recorder;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.application.port.CassetteStoragePort;
import ca.gc.cra.vcr.application.port.ClockPort;
import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.InteractionNotFoundException;
import ca.gc.cra.vcr.domain.cassette.RecordedRequest;
import ca.gc.cra.vcr.domain.cassette.RecordedResponse;
import ca.gc.cra.vcr.domain.cassette.ReplayExhaustion;
import ca.gc.cra.vcr.domain.fingerprint.DefaultRequestFingerprinter;
import ca.gc.cra.vcr.domain.fingerprint.RequestFingerprinter;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.logging.Logs;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mode-driven interception engine deciding, per request, between the real transport and the
 * cassette.
 * <p><strong>Why:</strong> Tests replay recorded traffic offline and grow cassettes deliberately, while unsafe verbs
 * never reach a real server by accident.</p>
 * <p><strong>Role:</strong> Application use case; implements {@link HttpTransport} so client adapters can use it as a
 * drop-in transport, and exposes {@link #record(HttpRequest, HttpResponse, Duration)} for server-side capture.</p>
 * <p><strong>Request flow:</strong> interruption check, passthrough predicates, unsafe-method block, passthrough mode,
 * cassette lookup with {@link HookStage#BEFORE_RESPONSE_REPLAY} hooks, then capture through the real transport with
 * {@link HookStage#AFTER_CAPTURE} hooks.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent requests. The cassette serializes its own state; no lock is
 * held while the real transport or hooks run.</p>
 * <p><strong>Observability:</strong> Counters {@code recorder.replay.hit}, {@code recorder.replay.miss},
 * {@code recorder.capture}, {@code recorder.passthrough}, {@code recorder.blocked}; histogram
 * {@code recorder.transport.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class Recorder implements HttpTransport, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Recorder.class);
  private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

  private final Mode mode;
  private final Cassette cassette;
  private final HttpTransport realTransport;
  private final List<Predicate<HttpRequest>> passthroughs;
  private final Map<HookStage, List<InteractionHook>> hooks;
  private final boolean blockUnsafeMethods;
  private final boolean simulateLatency;
  private final boolean recording;
  private final boolean replaying;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicBoolean stopped = new AtomicBoolean();

  private Recorder(Builder builder, Cassette cassette) {
    this.mode = builder.mode;
    this.cassette = cassette;
    this.realTransport = builder.realTransport;
    this.passthroughs = List.copyOf(builder.passthroughs);
    Map<HookStage, List<InteractionHook>> stages = new EnumMap<>(HookStage.class);
    builder.hooks.forEach((stage, list) -> stages.put(stage, List.copyOf(list)));
    this.hooks = stages;
    this.blockUnsafeMethods = builder.blockUnsafeMethods;
    this.simulateLatency = builder.simulateLatency;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.recording = mode == Mode.RECORD_ONLY
        || mode == Mode.REPLAY_WITH_NEW_EPISODES
        || (mode == Mode.RECORD_ONCE && cassette.isNew());
    this.replaying = mode == Mode.REPLAY_ONLY
        || mode == Mode.REPLAY_WITH_NEW_EPISODES
        || mode == Mode.RECORD_ONCE;
  }

  /**
   * Starts a builder for a recorder over the named cassette.
   *
   * @param cassetteName cassette name; file storage maps it to {@code name.yaml}
   * @param storage storage adapter holding the cassette
   * @return new builder
   */
  public static Builder builder(String cassetteName, CassetteStoragePort storage) {
    return new Builder(cassetteName, storage);
  }

  @Override
  public HttpResponse perform(HttpRequest request) throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    if (Thread.interrupted()) {
      throw new InterruptedException("Request cancelled before handling: " + request);
    }
    ensureRunning();
    if (isPassthrough(request)) {
      metrics.increment("recorder.passthrough");
      log.debug("Passthrough predicate matched {}", request);
      return realTransport.perform(request);
    }
    if (blockUnsafeMethods && !SAFE_METHODS.contains(request.method())) {
      metrics.increment("recorder.blocked");
      log.debug("Blocked unsafe method for {}", request);
      throw new UnsafeMethodException(request.method(), request.uri().toString());
    }
    if (mode == Mode.PASSTHROUGH) {
      metrics.increment("recorder.passthrough");
      return realTransport.perform(request);
    }
    if (replaying) {
      try {
        return replay(request);
      } catch (InteractionNotFoundException ex) {
        metrics.increment("recorder.replay.miss");
        if (!recording) {
          throw ex;
        }
        log.debug("No recorded interaction for {}; recording", request);
      }
    }
    return capture(request);
  }

  /**
   * Captures an exchange produced outside the recorder, such as a server handler's response.
   *
   * <p>Does nothing when the recorder is not recording or a passthrough predicate matches the request.</p>
   *
   * @param request request as received; its body stays readable
   * @param response response produced for it
   * @param duration time taken to produce the response
   * @return {@code true} when the exchange was added to the cassette
   * @throws IOException when a hook fails or the interaction cannot be fingerprinted
   */
  public boolean record(HttpRequest request, HttpResponse response, Duration duration) throws IOException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(response, "response");
    ensureRunning();
    if (!recording || isPassthrough(request)) {
      return false;
    }
    byte[] body = request.bufferBody();
    request.parseForm();
    store(new Interaction(RecordedRequest.of(request, body), RecordedResponse.of(response, duration)));
    return true;
  }

  private HttpResponse replay(HttpRequest request) throws IOException, InterruptedException {
    Interaction hit = cassette.getInteraction(request);
    metrics.increment("recorder.replay.hit");
    runHooks(HookStage.BEFORE_RESPONSE_REPLAY, List.of(hit));
    log.debug("Replaying interaction {} for {}", hit.id(), request);
    if (simulateLatency) {
      Duration latency = hit.response().duration();
      if (!latency.isNegative() && !latency.isZero()) {
        Thread.sleep(latency.toMillis(), latency.toNanosPart() % 1_000_000);
      }
    }
    return hit.response().toHttpResponse(request);
  }

  private HttpResponse capture(HttpRequest request) throws IOException, InterruptedException {
    byte[] body = request.bufferBody();
    request.parseForm();
    long start = clock.nanoTime();
    HttpResponse response = realTransport.perform(request);
    Duration elapsed = Duration.ofNanos(Math.max(0L, clock.nanoTime() - start));
    metrics.observe("recorder.transport.latencyMillis", elapsed.toMillis());
    request.setBody(new ByteArrayInputStream(body));

    Interaction interaction = new Interaction(
        RecordedRequest.of(request, body), RecordedResponse.of(response, elapsed));
    store(interaction);
    if (log.isDebugEnabled()) {
      log.debug("Captured interaction {} for {} -> {} headers={} body={}", interaction.id(), request,
          response.code(), Logs.redactHeaders(interaction.request().headers()),
          Logs.truncate(interaction.request().body(), Logs.BODY_PREVIEW_BYTES));
    }
    return response;
  }

  private void store(Interaction interaction) throws IOException {
    runHooks(HookStage.AFTER_CAPTURE, List.of(interaction));
    cassette.addInteraction(interaction);
    metrics.increment("recorder.capture");
  }

  /**
   * Stops the recorder: runs {@link HookStage#BEFORE_SAVE} hooks, saves when recording, then runs
   * {@link HookStage#ON_RECORDER_STOP} hooks. A before-save failure skips the save; stop hooks still run. The first
   * failure is thrown with later ones attached as suppressed exceptions.
   *
   * @throws IOException when a hook or the save fails
   * @throws IllegalStateException when the recorder was already stopped
   */
  public void stop() throws IOException {
    if (!stopped.compareAndSet(false, true)) {
      throw new IllegalStateException("Recorder for cassette " + cassette.name() + " already stopped");
    }
    Throwable failure = null;
    try {
      runHooks(HookStage.BEFORE_SAVE, cassette.interactions());
      if (recording) {
        cassette.save();
      }
    } catch (IOException | RuntimeException ex) {
      failure = ex;
    }
    try {
      runHooks(HookStage.ON_RECORDER_STOP, cassette.interactions());
    } catch (IOException | RuntimeException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    if (failure != null) {
      log.error("Recorder for cassette {} stopped with errors", cassette.file(), failure);
      if (failure instanceof IOException io) {
        throw io;
      }
      throw (RuntimeException) failure;
    }
    log.info("Recorder for cassette {} stopped (mode={}, recording={}, interactions={})",
        cassette.file(), mode, recording, cassette.size());
  }

  /**
   * Stops the recorder unless it was already stopped.
   *
   * @throws IOException when stopping fails
   */
  @Override
  public void close() throws IOException {
    if (!stopped.get()) {
      stop();
    }
  }

  private void runHooks(HookStage stage, List<Interaction> interactions) throws IOException {
    List<InteractionHook> chain = hooks.getOrDefault(stage, List.of());
    if (chain.isEmpty()) {
      return;
    }
    for (Interaction interaction : interactions) {
      for (InteractionHook hook : chain) {
        try {
          hook.apply(interaction);
        } catch (IOException | RuntimeException ex) {
          throw ex;
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new HookException(stage, ex);
        } catch (Exception ex) {
          throw new HookException(stage, ex);
        }
      }
    }
  }

  private boolean isPassthrough(HttpRequest request) {
    for (Predicate<HttpRequest> predicate : passthroughs) {
      if (predicate.test(request)) {
        return true;
      }
    }
    return false;
  }

  private void ensureRunning() {
    if (stopped.get()) {
      throw new IllegalStateException("Recorder for cassette " + cassette.name() + " has been stopped");
    }
  }

  /** @return mode fixed at construction */
  public Mode mode() {
    return mode;
  }

  /** @return {@code true} when misses are captured and the cassette is saved on stop */
  public boolean isRecording() {
    return recording;
  }

  /** @return {@code true} when the cassette did not exist when the recorder opened it */
  public boolean isNewCassette() {
    return cassette.isNew();
  }

  /** @return {@code true} once {@link #stop()} has been called */
  public boolean isStopped() {
    return stopped.get();
  }

  /** @return the cassette backing this recorder */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Callers inspect the live cassette; it guards its own state.")
  public Cassette cassette() {
    return cassette;
  }

  /** @return transport used for real exchanges */
  public HttpTransport realTransport() {
    return realTransport;
  }

  @Override
  public String toString() {
    return "Recorder{cassette=" + cassette.name() + ", mode=" + mode + ", recording=" + recording + '}';
  }

  /**
   * Builder collecting recorder options. {@link #build()} opens the cassette.
   */
  public static final class Builder {
    private final String cassetteName;
    private final CassetteStoragePort storage;
    private Mode mode = Mode.RECORD_ONCE;
    private HttpTransport realTransport;
    private RequestFingerprinter fingerprinter = DefaultRequestFingerprinter.standard();
    private final List<Predicate<HttpRequest>> passthroughs = new ArrayList<>();
    private final Map<HookStage, List<InteractionHook>> hooks = new EnumMap<>(HookStage.class);
    private boolean blockUnsafeMethods;
    private boolean replayableInteractions;
    private ReplayExhaustion replayExhaustion = ReplayExhaustion.REUSE_LAST;
    private boolean compressionEnabled;
    private boolean simulateLatency;
    private boolean upgradeLegacyCassettes = true;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;

    private Builder(String cassetteName, CassetteStoragePort storage) {
      this.cassetteName = Objects.requireNonNull(cassetteName, "cassetteName");
      this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * Sets the mode; {@code null} is rejected at {@link #build()} with {@link InvalidModeException}.
     *
     * @param mode recording policy
     * @return this builder
     */
    public Builder mode(Mode mode) {
      this.mode = mode;
      return this;
    }

    public Builder realTransport(HttpTransport realTransport) {
      this.realTransport = Objects.requireNonNull(realTransport, "realTransport");
      return this;
    }

    public Builder fingerprinter(RequestFingerprinter fingerprinter) {
      this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
      return this;
    }

    /**
     * Adds a predicate selecting requests that bypass the cassette entirely.
     *
     * @param predicate passthrough predicate
     * @return this builder
     */
    public Builder passthrough(Predicate<HttpRequest> predicate) {
      passthroughs.add(Objects.requireNonNull(predicate, "predicate"));
      return this;
    }

    /**
     * Registers a hook; hooks of one stage run in registration order.
     *
     * @param hook hook to run
     * @param stage lifecycle point
     * @return this builder
     */
    public Builder hook(InteractionHook hook, HookStage stage) {
      Objects.requireNonNull(hook, "hook");
      Objects.requireNonNull(stage, "stage");
      hooks.computeIfAbsent(stage, k -> new ArrayList<>()).add(hook);
      return this;
    }

    public Builder blockUnsafeMethods(boolean blockUnsafeMethods) {
      this.blockUnsafeMethods = blockUnsafeMethods;
      return this;
    }

    public Builder replayableInteractions(boolean replayableInteractions) {
      this.replayableInteractions = replayableInteractions;
      return this;
    }

    public Builder replayExhaustion(ReplayExhaustion replayExhaustion) {
      this.replayExhaustion = Objects.requireNonNull(replayExhaustion, "replayExhaustion");
      return this;
    }

    public Builder compressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    /**
     * Replays responses after sleeping for their recorded duration.
     *
     * @param simulateLatency whether to sleep on replay
     * @return this builder
     */
    public Builder simulateLatency(boolean simulateLatency) {
      this.simulateLatency = simulateLatency;
      return this;
    }

    /**
     * Controls whether a loaded cassette lacking persisted fingerprints is rewritten once at open.
     *
     * @param upgradeLegacyCassettes whether to run {@link Cassette#upgrade()} after loading
     * @return this builder
     */
    public Builder upgradeLegacyCassettes(boolean upgradeLegacyCassettes) {
      this.upgradeLegacyCassettes = upgradeLegacyCassettes;
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Opens the cassette and creates the recorder.
     *
     * <p>{@link Mode#REPLAY_ONLY} requires an existing cassette. {@link Mode#RECORD_ONLY} always starts an empty
     * cassette. Other modes load the cassette when it exists and start empty otherwise.</p>
     *
     * @return started recorder
     * @throws InvalidModeException when no mode is set
     * @throws IllegalStateException when a mode that may reach the network has no real transport
     * @throws CassetteNotFoundException when replaying from a missing cassette
     * @throws IOException when the cassette cannot be loaded or upgraded
     */
    public Recorder build() throws IOException {
      if (mode == null) {
        throw new InvalidModeException("Recorder mode must not be null");
      }
      if (realTransport == null && mode != Mode.REPLAY_ONLY) {
        throw new IllegalStateException("A real transport is required in mode " + mode);
      }
      if (realTransport == null) {
        realTransport = request -> {
          throw new IllegalStateException("No real transport configured for " + request);
        };
      }
      Cassette cassette = Cassette.builder(cassetteName, storage)
          .fingerprinter(fingerprinter)
          .replayableInteractions(replayableInteractions)
          .replayExhaustion(replayExhaustion)
          .compressionEnabled(compressionEnabled)
          .metrics(metrics)
          .build();
      if (mode != Mode.RECORD_ONLY) {
        try {
          cassette.load();
        } catch (CassetteNotFoundException ex) {
          if (mode == Mode.REPLAY_ONLY) {
            throw ex;
          }
          log.debug("Cassette {} not found; starting a new cassette", cassette.file());
        }
        if (upgradeLegacyCassettes && cassette.requiresUpgrade()) {
          cassette.upgrade();
        }
      }
      Recorder recorder = new Recorder(this, cassette);
      log.info("Recorder started for cassette {} (mode={}, recording={}, new={})",
          cassette.file(), mode, recorder.recording, cassette.isNew());
      return recorder;
    }
  }
}
