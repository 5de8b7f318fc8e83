package ca.gc.cra.roster.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for roster resolution.
 * <p><strong>Why:</strong> Lets the resolver record build counts, latencies, and diagnostic tallies without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent resolutions.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code roster.build.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code roster.build.count}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, sample counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
