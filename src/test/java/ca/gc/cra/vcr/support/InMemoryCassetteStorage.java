package ca.gc.cra.vcr.support;

import ca.gc.cra.vcr.application.port.CassetteStoragePort;
import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Storage double keeping documents in memory; interactions are copied on both read and write. */
public final class InMemoryCassetteStorage implements CassetteStoragePort {
  private final Map<String, CassetteDocument> documents = new ConcurrentHashMap<>();
  private int writes;
  private IOException failWith;

  @Override
  public CassetteDocument read(String name, boolean compressed) throws IOException {
    CassetteDocument document = documents.get(CassetteFormat.fileName(name, compressed));
    if (document == null) {
      throw new CassetteNotFoundException(location(name, compressed));
    }
    return copyOf(document);
  }

  @Override
  public synchronized void write(String name, CassetteDocument document) throws IOException {
    if (failWith != null) {
      throw failWith;
    }
    writes++;
    documents.put(CassetteFormat.fileName(name, document.compressionEnabled()), copyOf(document));
  }

  @Override
  public String location(String name, boolean compressed) {
    return "mem:" + CassetteFormat.fileName(name, compressed);
  }

  @Override
  public boolean exists(String name, boolean compressed) {
    return documents.containsKey(CassetteFormat.fileName(name, compressed));
  }

  /** Seeds a document as if it had been written earlier. */
  public void put(String name, CassetteDocument document) {
    documents.put(CassetteFormat.fileName(name, document.compressionEnabled()), copyOf(document));
  }

  public CassetteDocument stored(String name) {
    CassetteDocument document = documents.get(CassetteFormat.fileName(name, false));
    return document == null ? documents.get(CassetteFormat.fileName(name, true)) : document;
  }

  public synchronized int writes() {
    return writes;
  }

  public synchronized void failWritesWith(IOException failure) {
    this.failWith = failure;
  }

  private static CassetteDocument copyOf(CassetteDocument document) {
    List<Interaction> copies = new ArrayList<>();
    for (Interaction interaction : document.interactions()) {
      copies.add(Interaction.restore(
          interaction.id(), interaction.fingerprint(), interaction.request(), interaction.response()));
    }
    return new CassetteDocument(document.version(), document.compressionEnabled(), copies);
  }
}
