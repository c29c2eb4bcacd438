package io.clusterhive.cluster.context;

import io.clusterhive.cluster.connection.ClusterClients;
import java.nio.file.Path;

/**
 * Registry value holding the context metadata together with its client handles, so that entry,
 * typed client and dynamic client are always added, moved and removed as one unit.
 */
final class RegisteredContext {

  private String name;
  private final String loadName;
  private final String fileContext;
  private final String cluster;
  private final String user;
  private final String namespace;
  private final String serverUrl;
  private final Path configPath;
  private final ClusterClients clients;

  RegisteredContext(String name,
                    String loadName,
                    String fileContext,
                    String cluster,
                    String user,
                    String namespace,
                    String serverUrl,
                    Path configPath,
                    ClusterClients clients) {
    this.name = name;
    this.loadName = loadName;
    this.fileContext = fileContext;
    this.cluster = cluster;
    this.user = user;
    this.namespace = namespace;
    this.serverUrl = serverUrl;
    this.configPath = configPath;
    this.clients = clients;
  }

  String name() {
    return name;
  }

  void rename(String newName) {
    this.name = newName;
  }

  String loadName() {
    return loadName;
  }

  String fileContext() {
    return fileContext;
  }

  Path configPath() {
    return configPath;
  }

  ClusterClients clients() {
    return clients;
  }

  ContextInfo snapshot(boolean active) {
    return new ContextInfo(
        name,
        cluster,
        user,
        namespace,
        serverUrl,
        configPath == null ? null : configPath.toString(),
        active);
  }
}
