package ca.gc.cra.roster.infrastructure.metrics;

import ca.gc.cra.roster.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when the CLI runs with {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
