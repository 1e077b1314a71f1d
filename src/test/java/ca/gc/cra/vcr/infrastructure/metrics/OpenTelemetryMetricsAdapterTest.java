package ca.gc.cra.vcr.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vcr.application.recorder.Mode;
import ca.gc.cra.vcr.application.recorder.Recorder;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.support.InMemoryCassetteStorage;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.net.URI;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("vcr.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("recorder.replay.hit");
    adapter.increment("recorder.replay.hit");
    adapter.increment("recorder.replay.hit");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "recorder.replay.hit").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("recorder.replay.hit", point.getAttributes().get(KEY_ATTR));
    assertEquals("vcr", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogramInMillis() {
    adapter.observe("recorder.transport.latencyMillis", 10L);
    adapter.observe("recorder.transport.latencyMillis", 30L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "recorder.transport.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("recorder.transport.latencyMillis", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void recorderActivityIsExported() throws Exception {
    InMemoryCassetteStorage storage = new InMemoryCassetteStorage();
    Recorder recorder = Recorder.builder("metered", storage)
        .mode(Mode.RECORD_ONCE)
        .realTransport(request -> HttpResponse.builder(200).body("ok").request(request).build())
        .metrics(adapter)
        .build();

    recorder.perform(HttpRequest.builder("GET", URI.create("http://svc.test/a")).build());
    recorder.stop();
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertTrue(find(metrics, "recorder.capture").isPresent());
    assertTrue(find(metrics, "cassette.save").isPresent());
    assertTrue(find(metrics, "cassette.save.interactions").isPresent());
  }

  @Test
  void metricNamesAreSanitized() {
    assertEquals("recorder.replay.hit", OpenTelemetryMetricsAdapter.sanitizeName("recorder.replay.hit"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b_c", OpenTelemetryMetricsAdapter.sanitizeName("a b/c"));
    assertEquals("vcr.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
