package io.clusterhive.cluster.spring;

import io.clusterhive.cluster.context.ContextManager;
import io.clusterhive.tunnel.TunnelSessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.Objects;

/**
 * Gauges for the number of registered cluster contexts and running tunnels.
 */
public class ClusterConnectionsMetrics implements MeterBinder {

    static final String CONTEXTS = "clusterhive_contexts";
    static final String TUNNELS_ACTIVE = "clusterhive_tunnels_active";

    private final ContextManager contexts;
    private final TunnelSessionManager tunnels;

    public ClusterConnectionsMetrics(ContextManager contexts, TunnelSessionManager tunnels) {
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(CONTEXTS, contexts, manager -> manager.listClusters().size())
            .description("Cluster contexts currently registered")
            .register(registry);
        Gauge.builder(TUNNELS_ACTIVE, tunnels, TunnelSessionManager::activeCount)
            .description("Port-forward sessions currently running")
            .register(registry);
    }
}
