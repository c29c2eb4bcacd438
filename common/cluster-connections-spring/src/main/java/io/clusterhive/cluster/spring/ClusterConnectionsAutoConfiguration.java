package io.clusterhive.cluster.spring;

import io.clusterhive.cluster.connection.ConnectionFactory;
import io.clusterhive.cluster.connection.ConnectionSettings;
import io.clusterhive.cluster.connection.Fabric8ConnectionFactory;
import io.clusterhive.cluster.context.ContextManager;
import io.clusterhive.cluster.credentials.KubeConfigParser;
import io.clusterhive.cluster.credentials.KubeConfigResolver;
import io.clusterhive.tunnel.TunnelSessionManager;
import io.clusterhive.tunnel.WorkloadResolver;
import io.clusterhive.tunnel.transport.Fabric8TunnelTransport;
import io.clusterhive.tunnel.transport.TunnelTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the context manager and tunnel session manager from {@code clusterhive.*} properties.
 */
@AutoConfiguration
@ConditionalOnClass(ContextManager.class)
@ConditionalOnProperty(prefix = "clusterhive.connections", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({ClusterConnectionsProperties.class, TunnelProperties.class})
public class ClusterConnectionsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    KubeConfigResolver kubeConfigResolver() {
        return new KubeConfigResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    KubeConfigParser kubeConfigParser() {
        return new KubeConfigParser();
    }

    @Bean
    @ConditionalOnMissingBean
    ConnectionSettings clusterConnectionSettings(ClusterConnectionsProperties properties) {
        return new ConnectionSettings(properties.getConnectTimeout(), properties.getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    ConnectionFactory clusterConnectionFactory(ConnectionSettings settings) {
        return new Fabric8ConnectionFactory(settings);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    ContextManager contextManager(KubeConfigResolver resolver,
                                  KubeConfigParser parser,
                                  ConnectionFactory connections,
                                  ClusterConnectionsProperties properties) {
        return new ContextManager(resolver, parser, connections,
            properties.getDefaultNamespace(), properties.getInClusterNamespaceFile());
    }

    @Bean
    @ConditionalOnProperty(prefix = "clusterhive.connections.preload", name = "enabled", havingValue = "true")
    ClusterContextPreloader clusterContextPreloader(ContextManager contexts, ClusterConnectionsProperties properties) {
        return new ClusterContextPreloader(contexts, properties.getPreload());
    }

    @Bean
    @ConditionalOnMissingBean
    TunnelTransport tunnelTransport(ConnectionSettings settings) {
        return new Fabric8TunnelTransport(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    WorkloadResolver workloadResolver() {
        return new WorkloadResolver();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    TunnelSessionManager tunnelSessionManager(ContextManager contexts,
                                              TunnelTransport transport,
                                              WorkloadResolver workloads,
                                              TunnelProperties properties) {
        return new TunnelSessionManager(contexts, transport, workloads, properties.toSettings(), Clock.systemUTC());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        ClusterConnectionsMetrics clusterConnectionsMetrics(ContextManager contexts, TunnelSessionManager tunnels) {
            return new ClusterConnectionsMetrics(contexts, tunnels);
        }
    }
}
