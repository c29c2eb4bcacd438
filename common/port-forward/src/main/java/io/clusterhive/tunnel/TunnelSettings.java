package io.clusterhive.tunnel;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs for tunnel sessions.
 *
 * @param startTimeout how long {@code start} waits for the tunnel to bind
 * @param maxLifetime upper bound for a session; zero means unbounded
 * @param healthCheckInterval how often the supervising task checks the forward
 */
public record TunnelSettings(Duration startTimeout, Duration maxLifetime, Duration healthCheckInterval) {

  public static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(1);

  public TunnelSettings {
    Objects.requireNonNull(startTimeout, "startTimeout");
    Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
    if (maxLifetime == null) {
      maxLifetime = Duration.ZERO;
    }
    if (startTimeout.isNegative() || startTimeout.isZero()) {
      throw new IllegalArgumentException("startTimeout must be positive");
    }
    if (maxLifetime.isNegative()) {
      throw new IllegalArgumentException("maxLifetime must not be negative");
    }
    if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
      throw new IllegalArgumentException("healthCheckInterval must be positive");
    }
  }

  public static TunnelSettings defaults() {
    return new TunnelSettings(DEFAULT_START_TIMEOUT, Duration.ZERO, DEFAULT_HEALTH_CHECK_INTERVAL);
  }

  public boolean bounded() {
    return !maxLifetime.isZero();
  }
}
