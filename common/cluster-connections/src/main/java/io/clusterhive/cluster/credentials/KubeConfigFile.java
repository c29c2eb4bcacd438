package io.clusterhive.cluster.credentials;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Parsed view of a kubeconfig file: every usable context plus the file's current-context marker.
 */
public record KubeConfigFile(Path path, String currentContext, List<KubeConfigContext> contexts) {

  public KubeConfigFile {
    contexts = contexts == null ? List.of() : List.copyOf(contexts);
  }

  public Optional<KubeConfigContext> context(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return contexts.stream().filter(c -> c.name().equals(name)).findFirst();
  }
}
