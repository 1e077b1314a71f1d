package ca.gc.cra.vcr.domain.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpHeadersTest {

  @Test
  void namesAreCanonicalized() {
    assertEquals("Content-Type", HttpHeaders.canonicalName("content-type"));
    assertEquals("X-Api-Key", HttpHeaders.canonicalName("X-API-KEY"));
    assertEquals("Www-Authenticate", HttpHeaders.canonicalName("www-authenticate"));
  }

  @Test
  void namesWithInvalidTokenCharactersAreKeptVerbatim() {
    assertEquals("bad header", HttpHeaders.canonicalName("bad header"));
  }

  @Test
  void lookupIgnoresCase() {
    HttpHeaders headers = new HttpHeaders()
        .add("accept", "text/plain")
        .add("ACCEPT", "application/json");

    assertEquals(List.of("text/plain", "application/json"), headers.all("Accept"));
    assertEquals("text/plain", headers.first("accept"));
    assertTrue(headers.contains("aCcEpT"));
  }

  @Test
  void setReplacesAndRemoveDeletes() {
    HttpHeaders headers = new HttpHeaders().add("Key", "a").add("Key", "b");

    headers.set("key", "c");
    assertEquals(List.of("c"), headers.all("Key"));

    headers.remove("KEY");
    assertFalse(headers.contains("Key"));
    assertNull(headers.first("Key"));
    assertTrue(headers.isEmpty());
  }

  @Test
  void ofKeepsNamesWithEmptyValueLists() {
    HttpHeaders headers = HttpHeaders.of(Map.of("x-empty", List.of()));

    assertTrue(headers.contains("X-Empty"));
    assertEquals(List.of(), headers.all("X-Empty"));
  }

  @Test
  void copyIsIndependent() {
    HttpHeaders original = new HttpHeaders().add("A", "1");
    HttpHeaders copy = original.copy();
    copy.add("A", "2");

    assertEquals(List.of("1"), original.all("A"));
    assertEquals(List.of("1", "2"), copy.all("A"));
    assertEquals(Map.of("A", List.of("1")), original.toMap());
  }
}
