package io.clusterhive.cluster.connection;

import io.clusterhive.cluster.ClusterContextException;
import io.clusterhive.cluster.ClusterContextException.Reason;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionFactory} backed by the fabric8 Kubernetes client.
 * <p>
 * The connectivity probe lists at most one namespace, which is cheap on any cluster and fails fast
 * on wrong endpoints or rejected credentials.
 */
public final class Fabric8ConnectionFactory implements ConnectionFactory {

  private static final Logger log = LoggerFactory.getLogger(Fabric8ConnectionFactory.class);

  static final String SERVICE_HOST_ENV = "KUBERNETES_SERVICE_HOST";

  private final ConnectionSettings settings;
  private final Function<String, String> environment;

  public Fabric8ConnectionFactory() {
    this(ConnectionSettings.defaults());
  }

  public Fabric8ConnectionFactory(ConnectionSettings settings) {
    this(settings, System::getenv);
  }

  Fabric8ConnectionFactory(ConnectionSettings settings, Function<String, String> environment) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  @Override
  public ClusterClients connect(Path kubeconfig) {
    Objects.requireNonNull(kubeconfig, "kubeconfig");
    Config config;
    try {
      String content = Files.readString(kubeconfig, StandardCharsets.UTF_8);
      config = Config.fromKubeconfig(null, content, kubeconfig.toString());
    } catch (IOException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_UNREADABLE,
          "error reading kubeconfig file " + kubeconfig, e);
    } catch (RuntimeException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_MALFORMED,
          "error building client config from " + kubeconfig + ": " + e.getMessage(), e);
    }
    return buildAndProbe(config, kubeconfig.toString());
  }

  @Override
  public ClusterClients connectInCluster() {
    String serviceHost = environment.apply(SERVICE_HOST_ENV);
    if (serviceHost == null || serviceHost.isBlank()) {
      throw new ClusterContextException(Reason.NO_CREDENTIAL_SOURCE,
          "failed to load in-cluster config: " + SERVICE_HOST_ENV + " is not set");
    }
    Config config;
    try {
      config = Config.autoConfigure(null);
    } catch (RuntimeException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_MALFORMED,
          "failed to load in-cluster config: " + e.getMessage(), e);
    }
    return buildAndProbe(config, "in-cluster");
  }

  private ClusterClients buildAndProbe(Config config, String source) {
    config.setConnectionTimeout(toMillis(settings.connectTimeout()));
    config.setRequestTimeout(toMillis(settings.requestTimeout()));
    KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build();
    try {
      probe(client);
    } catch (RuntimeException e) {
      client.close();
      throw new ClusterContextException(Reason.CONNECTION_UNREACHABLE,
          "failed to connect to cluster " + config.getMasterUrl() + " (" + source + "): " + e.getMessage(), e);
    }
    log.debug("connectivity probe succeeded for {} ({})", config.getMasterUrl(), source);
    return ClusterClients.of(client);
  }

  static void probe(KubernetesClient client) {
    client.namespaces().list(new ListOptionsBuilder().withLimit(1L).build());
  }

  private static int toMillis(Duration duration) {
    long millis = duration.toMillis();
    return millis > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) millis;
  }
}
