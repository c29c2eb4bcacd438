package io.clusterhive.cluster.spring;

import io.clusterhive.tunnel.TunnelSettings;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "clusterhive.tunnels")
public class TunnelProperties {

    @NotNull
    private Duration startTimeout = TunnelSettings.DEFAULT_START_TIMEOUT;
    @NotNull
    private Duration maxLifetime = Duration.ZERO;
    @NotNull
    private Duration healthCheckInterval = TunnelSettings.DEFAULT_HEALTH_CHECK_INTERVAL;

    public Duration getStartTimeout() {
        return startTimeout;
    }

    public void setStartTimeout(Duration startTimeout) {
        this.startTimeout = startTimeout;
    }

    public Duration getMaxLifetime() {
        return maxLifetime;
    }

    public void setMaxLifetime(Duration maxLifetime) {
        this.maxLifetime = maxLifetime;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    TunnelSettings toSettings() {
        return new TunnelSettings(startTimeout, maxLifetime, healthCheckInterval);
    }
}
