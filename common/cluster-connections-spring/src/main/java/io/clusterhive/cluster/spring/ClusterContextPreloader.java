package io.clusterhive.cluster.spring;

import io.clusterhive.cluster.context.ContextManager;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Loads the configured credentials into the {@link ContextManager} once all singletons exist.
 * Exceptions propagate and fail the application context refresh.
 */
public class ClusterContextPreloader implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(ClusterContextPreloader.class);

    private final ContextManager contexts;
    private final ClusterConnectionsProperties.Preload preload;

    public ClusterContextPreloader(ContextManager contexts, ClusterConnectionsProperties.Preload preload) {
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.preload = Objects.requireNonNull(preload, "preload");
    }

    @Override
    public void afterSingletonsInstantiated() {
        if (preload.isInCluster()) {
            log.info("Preloading in-cluster configuration as {}", preload.getName());
            contexts.loadInClusterConfig(preload.getName());
            return;
        }
        log.info("Preloading kubeconfig {} as {}",
            preload.getPath() == null || preload.getPath().isBlank() ? "(default location)" : preload.getPath(),
            preload.getName());
        contexts.loadKubeConfig(preload.getName(), preload.getPath());
    }
}
