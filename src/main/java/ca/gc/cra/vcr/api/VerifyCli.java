package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.application.replay.ReplayMismatch;
import ca.gc.cra.vcr.application.replay.ReplayReport;
import ca.gc.cra.vcr.application.replay.ServerReplayVerifier;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.UnsupportedCassetteFormatException;
import ca.gc.cra.vcr.infrastructure.transport.JdkHttpTransport;
import ca.gc.cra.vcr.logging.LoggingConfigurator;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a server-side cassette against a running service and reports responses that differ.
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final String SUMMARY_USAGE =
      "usage: verify cassette=PATH target=http://HOST:PORT [compressed=true|false]";
  private static final String HELP_TEXT = """
      Replay a recorded server cassette against a live service

      Usage:
        verify cassette=testdata/middleware target=http://127.0.0.1:8080

      Required:
        cassette=PATH            Cassette recorded by the server filter
        target=URL               Base URL the recorded paths are resolved against

      Optional:
        compressed=true|false    Read NAME.yaml.gz when PATH has no extension (default false)
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit status is 1 when any interaction's status code or body differs.
      """;

  private VerifyCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CassetteCliSupport.CassetteRef ref;
    URI target;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ref = CassetteCliSupport.resolve(kv);
      target = parseTarget(kv.remove("target"));
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown arguments: " + kv.keySet());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Cassette cassette = ref.load(MetricsPort.NO_OP);
      ReplayReport report = new ServerReplayVerifier(new JdkHttpTransport(), target).verify(cassette);
      for (ReplayMismatch mismatch : report.mismatches()) {
        CliPrinter.println(String.format("  #%d %s %s: %s",
            mismatch.interactionId(), mismatch.method(), mismatch.url(), mismatch.detail()));
      }
      CliPrinter.println(String.format("%d interactions replayed, %d mismatches",
          report.replayed(), report.mismatches().size()));
      return report.isSuccess() ? ExitCode.SUCCESS : ExitCode.VERIFY_FAILED;
    } catch (CassetteNotFoundException ex) {
      log.error("Cassette not found: {}", ex.location());
      return ExitCode.IO_ERROR;
    } catch (UnsupportedCassetteFormatException ex) {
      log.error(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read cassette {}", ref.name(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Verification interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure verifying cassette {}", ref.name(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static URI parseTarget(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("target=URL is required");
    }
    try {
      URI uri = new URI(raw.trim());
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new IllegalArgumentException("target must be an absolute http(s) URL: " + raw);
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("target must be a valid URL: " + raw, ex);
    }
  }
}
