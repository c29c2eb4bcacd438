package io.clusterhive.cluster.spring;

import io.clusterhive.cluster.context.ContextManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for cluster credential loading and client connections.
 */
@Validated
@ConfigurationProperties(prefix = "clusterhive.connections")
public class ClusterConnectionsProperties {

    private boolean enabled = true;
    @NotBlank
    private String defaultNamespace = ContextManager.DEFAULT_NAMESPACE;
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);
    @NotNull
    private Path inClusterNamespaceFile = ContextManager.SERVICE_ACCOUNT_NAMESPACE_FILE;
    @Valid
    private final Preload preload = new Preload();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Path getInClusterNamespaceFile() {
        return inClusterNamespaceFile;
    }

    public void setInClusterNamespaceFile(Path inClusterNamespaceFile) {
        this.inClusterNamespaceFile = inClusterNamespaceFile;
    }

    public Preload getPreload() {
        return preload;
    }

    /**
     * Credentials loaded once at startup. A failed preload aborts startup.
     */
    public static final class Preload {
        private boolean enabled = false;
        @NotBlank
        private String name = "local";
        private String path;
        private boolean inCluster = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isInCluster() {
            return inCluster;
        }

        public void setInCluster(boolean inCluster) {
            this.inCluster = inCluster;
        }
    }
}
