package io.github.themoah.tpeak.metrics;

import io.github.themoah.tpeak.config.Settings;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";

  private MicrometerConfig() {}

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP registry (HTTP, cumulative temporality).
   *
   * <ul>
   *   <li>OTLP_ENDPOINT, else OTEL_EXPORTER_OTLP_ENDPOINT + /v1/metrics (default: localhost:4318)</li>
   *   <li>OTLP_STEP_MS - push interval (default: 60s)</li>
   *   <li>OTLP_HEADERS - key1=value1,key2=value2</li>
   *   <li>OTEL_SERVICE_NAME - service.name resource attribute (default: tpeak)</li>
   * </ul>
   */
  public static MeterRegistry createOtlpRegistry(Settings settings) {
    String url = settings.get("OTLP_ENDPOINT")
      .or(() -> settings.get("OTEL_EXPORTER_OTLP_ENDPOINT")
        .map(base -> base.endsWith("/v1/metrics") ? base : base + "/v1/metrics"))
      .orElse(DEFAULT_OTLP_URL);
    Duration step = Duration.ofMillis(settings.getLong("OTLP_STEP_MS", 60_000L));
    Map<String, String> headers = parsePairs(settings.getString("OTLP_HEADERS", ""));
    Map<String, String> resource = new HashMap<>(parsePairs(settings.getString("OTEL_RESOURCE_ATTRIBUTES", "")));
    resource.put("service.name", settings.getString("OTEL_SERVICE_NAME", resource.getOrDefault("service.name", "tpeak")));

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> headers() {
        return headers;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return resource;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}, step: {}", url, step);
    return registry;
  }

  /**
   * Creates a registry by reporter type. Unknown types fall back to an in-process registry.
   *
   * @param reporterType "prometheus", "otlp" or "simple"
   */
  public static MeterRegistry createRegistry(String reporterType, Settings settings) {
    String type = reporterType == null ? "simple" : reporterType.toLowerCase(Locale.ROOT);
    return switch (type) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry(settings);
      case "simple" -> new SimpleMeterRegistry();
      default -> {
        log.warn("Unknown reporter type: {}, using in-process registry", reporterType);
        yield new SimpleMeterRegistry();
      }
    };
  }

  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static Map<String, String> parsePairs(String value) {
    Map<String, String> pairs = new HashMap<>();
    if (value == null || value.isBlank()) {
      return pairs;
    }
    for (String pair : value.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        pairs.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return pairs;
  }
}
