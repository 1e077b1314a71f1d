package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.RecordedRequest;
import ca.gc.cra.vcr.domain.cassette.RecordedResponse;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.infrastructure.persistence.yaml.CassetteFileStorageAdapter;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Writes small cassettes to disk for the command tests. */
final class CassetteFixtures {

  private CassetteFixtures() {}

  static Path saved(Path dir, String name, String... getPathsAndBodies) throws IOException {
    Cassette cassette = Cassette.builder(name, new CassetteFileStorageAdapter(dir)).build();
    for (Interaction interaction : interactions(getPathsAndBodies)) {
      cassette.addInteraction(interaction);
    }
    cassette.save();
    return dir.resolve(name + CassetteFormat.EXTENSION);
  }

  static Path legacy(Path dir, String name, String... getPathsAndBodies) throws IOException {
    List<Interaction> legacy = new ArrayList<>();
    int id = 0;
    for (Interaction interaction : interactions(getPathsAndBodies)) {
      legacy.add(Interaction.restore(id++, "", interaction.request(), interaction.response()));
    }
    new CassetteFileStorageAdapter(dir).write(name, new CassetteDocument(CassetteFormat.VERSION, false, legacy));
    return dir.resolve(name + CassetteFormat.EXTENSION);
  }

  private static List<Interaction> interactions(String... getPathsAndBodies) throws IOException {
    List<Interaction> interactions = new ArrayList<>();
    for (int i = 0; i + 1 < getPathsAndBodies.length; i += 2) {
      HttpRequest request = HttpRequest.builder("GET", URI.create(getPathsAndBodies[i])).build();
      RecordedRequest recorded = RecordedRequest.of(request, request.bufferBody());
      RecordedResponse response = RecordedResponse.of(
          HttpResponse.builder(200).body(getPathsAndBodies[i + 1]).build(), Duration.ofMillis(3));
      interactions.add(new Interaction(recorded, response));
    }
    return interactions;
  }
}
