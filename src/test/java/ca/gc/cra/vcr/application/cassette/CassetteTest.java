package ca.gc.cra.vcr.application.cassette;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.InteractionNotFoundException;
import ca.gc.cra.vcr.domain.cassette.RecordedRequest;
import ca.gc.cra.vcr.domain.cassette.RecordedResponse;
import ca.gc.cra.vcr.domain.cassette.ReplayExhaustion;
import ca.gc.cra.vcr.domain.cassette.UnsupportedCassetteFormatException;
import ca.gc.cra.vcr.domain.fingerprint.DefaultRequestFingerprinter;
import ca.gc.cra.vcr.domain.http.FormEncoding;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.support.InMemoryCassetteStorage;
import ca.gc.cra.vcr.support.RecordingMetricsPort;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CassetteTest {
  private InMemoryCassetteStorage storage;

  @BeforeEach
  void setUp() {
    storage = new InMemoryCassetteStorage();
  }

  @Test
  void loadingMissingCassetteFails() {
    Cassette cassette = Cassette.builder("fixtures/missing", storage).build();

    CassetteNotFoundException ex = assertThrows(CassetteNotFoundException.class, cassette::load);
    assertEquals("mem:fixtures/missing.yaml", ex.location());
    assertTrue(cassette.isNew());
  }

  @Test
  void addedInteractionsGetDensePositionsAndFingerprints() throws IOException {
    Cassette cassette = Cassette.builder("dense", storage).build();

    Interaction first = interaction("GET", "/a", "", "A");
    Interaction second = interaction("GET", "/b", "", "B");
    cassette.addInteraction(first);
    cassette.addInteraction(second);

    assertEquals(0, first.id());
    assertEquals(1, second.id());
    assertEquals(64, first.fingerprint().length());
    assertEquals(List.of(0), cassette.positions(first.fingerprint()));
    assertEquals(2, cassette.size());
  }

  @Test
  void lookupReturnsInteractionsWithSameFingerprintInRecordedOrder() throws IOException {
    Cassette cassette = Cassette.builder("ordered", storage).build();
    cassette.addInteraction(interaction("GET", "/poll", "", "first"));
    cassette.addInteraction(interaction("GET", "/poll", "", "second"));

    assertEquals("first", cassette.getInteraction(request("GET", "/poll", "")).response().body());
    assertEquals("second", cassette.getInteraction(request("GET", "/poll", "")).response().body());
    // exhausted: the most recently replayed one is returned again
    assertEquals("second", cassette.getInteraction(request("GET", "/poll", "")).response().body());
  }

  @Test
  void exhaustionCanFail() throws IOException {
    Cassette cassette = Cassette.builder("strict", storage).replayExhaustion(ReplayExhaustion.FAIL).build();
    cassette.addInteraction(interaction("GET", "/once", "", "only"));

    cassette.getInteraction(request("GET", "/once", ""));

    assertThrows(InteractionNotFoundException.class, () -> cassette.getInteraction(request("GET", "/once", "")));
  }

  @Test
  void replayableInteractionsAlwaysReturnFirstMatch() throws IOException {
    Cassette cassette = Cassette.builder("replayable", storage).replayableInteractions(true).build();
    cassette.addInteraction(interaction("GET", "/r", "", "first"));
    cassette.addInteraction(interaction("GET", "/r", "", "second"));

    for (int i = 0; i < 3; i++) {
      assertEquals("first", cassette.getInteraction(request("GET", "/r", "")).response().body());
    }
  }

  @Test
  void unknownRequestIsNotFound() throws IOException {
    Cassette cassette = Cassette.builder("sparse", storage).build();
    cassette.addInteraction(interaction("GET", "/known", "", "k"));

    InteractionNotFoundException ex = assertThrows(InteractionNotFoundException.class,
        () -> cassette.getInteraction(request("GET", "/unknown", "")));
    assertTrue(ex.getMessage().contains("/unknown"));
  }

  @Test
  void lookupReturnsCopyCarryingTheLiveRequestBodyAndForm() throws IOException {
    Cassette cassette = Cassette.builder("forms", storage).build();
    cassette.addInteraction(interaction("POST", "/form", "key=value", "ok"));

    HttpRequest live = HttpRequest.builder("POST", URI.create("http://svc.test/form"))
        .header("Content-Type", FormEncoding.MEDIA_TYPE)
        .body("key=value")
        .build();
    Interaction hit = cassette.getInteraction(live);

    assertEquals("key=value", hit.request().body());
    assertEquals(Map.of("key", List.of("value")), hit.request().form());
    assertNotSame(cassette.interactions().get(0), hit);
    assertTrue(cassette.interactions().get(0).wasReplayed());
  }

  @Test
  void saveDropsDiscardedInteractionsAndRenumbers() throws IOException {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    Cassette cassette = Cassette.builder("renumber", storage).metrics(metrics).build();
    cassette.addInteraction(interaction("GET", "/0", "", "0"));
    Interaction dropped = interaction("GET", "/1", "", "1");
    cassette.addInteraction(dropped);
    cassette.addInteraction(interaction("GET", "/2", "", "2"));
    dropped.setDiscardOnSave(true);

    cassette.save();

    CassetteDocument stored = storage.stored("renumber");
    assertEquals(CassetteFormat.VERSION, stored.version());
    assertEquals(2, stored.interactions().size());
    assertEquals(0, stored.interactions().get(0).id());
    assertEquals(1, stored.interactions().get(1).id());
    assertEquals("http://svc.test/2", stored.interactions().get(1).request().url());
    assertEquals(1, metrics.count("cassette.save"));
    assertEquals(List.of(2L), metrics.observed("cassette.save.interactions"));
  }

  @Test
  void saveRecomputesFingerprintsAfterHookEdits() throws IOException {
    Cassette cassette = Cassette.builder("edited", storage).build();
    Interaction interaction = interaction("GET", "/before", "", "body");
    cassette.addInteraction(interaction);
    String original = interaction.fingerprint();

    interaction.setRequest(interaction.request().withUrl("http://svc.test/after"));
    cassette.save();

    Cassette reloaded = Cassette.builder("edited", storage).load();
    assertFalse(reloaded.isNew());
    assertEquals("body", reloaded.getInteraction(request("GET", "/after", "")).response().body());
    assertTrue(reloaded.positions(original).isEmpty());
  }

  @Test
  void loadRejectsOtherFormatVersions() {
    storage.put("v1", new CassetteDocument(1, false, List.of()));
    Cassette cassette = Cassette.builder("v1", storage).build();

    UnsupportedCassetteFormatException ex = assertThrows(UnsupportedCassetteFormatException.class, cassette::load);
    assertEquals(1, ex.foundVersion());
  }

  @Test
  void legacyCassetteIsMatchedAndCanBeUpgradedOnce() throws IOException {
    Interaction legacy = Interaction.restore(7, "", snapshot("GET", "/legacy", ""), response("old"));
    storage.put("legacy", new CassetteDocument(CassetteFormat.VERSION, false, List.of(legacy)));

    Cassette cassette = Cassette.builder("legacy", storage).load();

    assertTrue(cassette.requiresUpgrade());
    assertEquals(0, cassette.interactions().get(0).id());
    assertEquals("old", cassette.getInteraction(request("GET", "/legacy", "")).response().body());
    assertTrue(cassette.upgrade());
    assertFalse(cassette.requiresUpgrade());
    assertFalse(cassette.upgrade());
    assertEquals(1, storage.writes());
    assertFalse(storage.stored("legacy").interactions().get(0).fingerprint().isBlank());
  }

  @Test
  void customFingerprinterControlsMatching() throws IOException {
    Cassette cassette = Cassette.builder("custom", storage)
        .fingerprinter(request -> request.method() + " " + request.uri().getPath())
        .build();
    cassette.addInteraction(interaction("GET", "/path?one=1", "", "hit"));

    assertEquals("hit", cassette.getInteraction(request("GET", "/path?two=2", "")).response().body());
    assertEquals(DefaultRequestFingerprinter.standard(), Cassette.builder("d", storage).build().fingerprinter());
  }

  static Interaction interaction(String method, String path, String body, String responseBody) throws IOException {
    return new Interaction(snapshot(method, path, body), response(responseBody));
  }

  static RecordedRequest snapshot(String method, String path, String body) throws IOException {
    HttpRequest request = request(method, path, body);
    return RecordedRequest.of(request, request.bufferBody());
  }

  static RecordedResponse response(String body) {
    return RecordedResponse.of(HttpResponse.builder(200).body(body).build(), Duration.ofMillis(1));
  }

  static HttpRequest request(String method, String path, String body) {
    HttpRequest.Builder builder = HttpRequest.builder(method, URI.create("http://svc.test" + path)).body(body);
    if ("POST".equals(method) && !body.isEmpty()) {
      builder.header("Content-Type", FormEncoding.MEDIA_TYPE);
    }
    return builder.build();
  }
}
