package ca.gc.cra.roster.api;

import ca.gc.cra.roster.application.port.MetricsPort;
import ca.gc.cra.roster.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.roster.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.roster.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry CLI settings and selects the metrics adapter for a command run.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  static final String DEFAULT_EXPORTER = "none";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code args} and builds the matching adapter.
   *
   * @param args parsed arguments; telemetry keys are removed
   * @return metrics adapter; callers close it when it is {@link AutoCloseable}
   * @throws IllegalArgumentException when a telemetry setting is malformed
   */
  static MetricsPort configureMetrics(Map<String, String> args) {
    String exporter = args.getOrDefault("metricsExporter", DEFAULT_EXPORTER).trim().toLowerCase(Locale.ROOT);
    args.remove("metricsExporter");
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null) {
      validateEndpoint(endpoint.trim());
      System.setProperty("otel.exporter.otlp.endpoint", endpoint.trim());
    }
    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null) {
      System.setProperty("otel.resource.attributes",
          Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH));
    }

    if (exporter.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);
    return new OpenTelemetryMetricsAdapter();
  }

  /**
   * Flushes and releases an exporting adapter.
   *
   * @param metrics adapter returned by {@link #configureMetrics(Map)}
   */
  static void close(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
