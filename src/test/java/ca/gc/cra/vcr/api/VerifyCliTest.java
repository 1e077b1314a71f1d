package ca.gc.cra.vcr.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VerifyCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private HttpServer server;

  @BeforeEach
  void setUp() throws IOException {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/hello", exchange -> {
      byte[] body = "hi".getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    CliPrinter.clearTestWriter();
  }

  @Test
  void matchingServiceSucceeds() throws Exception {
    Path file = CassetteFixtures.saved(tempDir, "ok", "/hello", "hi");

    ExitCode code = VerifyCli.run(new String[] {"cassette=" + file, "target=" + target()});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("1 interactions replayed, 0 mismatches"), buffer.toString());
  }

  @Test
  void mismatchesAreListedAndFailTheRun() throws Exception {
    Path file = CassetteFixtures.saved(tempDir, "drift", "/hello", "hello", "/gone", "x");

    ExitCode code = VerifyCli.run(new String[] {"cassette=" + file, "target=" + target()});

    assertEquals(ExitCode.VERIFY_FAILED, code);
    String output = buffer.toString();
    assertTrue(output.contains("  #0 GET /hello: body differs"), output);
    assertTrue(output.contains("  #1 GET /gone: expected status 200 but got 404"), output);
    assertTrue(output.contains("2 interactions replayed, 2 mismatches"), output);
  }

  @Test
  void targetMustBeAbsolute() throws Exception {
    Path file = CassetteFixtures.saved(tempDir, "rel", "/hello", "hi");

    assertEquals(ExitCode.INVALID_ARGS, VerifyCli.run(new String[] {"cassette=" + file}));
    assertEquals(ExitCode.INVALID_ARGS, VerifyCli.run(new String[] {"cassette=" + file, "target=/relative"}));
    assertTrue(buffer.toString().contains("usage: verify"));
  }

  private String target() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }
}
