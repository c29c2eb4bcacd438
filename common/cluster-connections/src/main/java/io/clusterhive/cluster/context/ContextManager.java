package io.clusterhive.cluster.context;

import io.clusterhive.cluster.ClusterContextException;
import io.clusterhive.cluster.ClusterContextException.Reason;
import io.clusterhive.cluster.connection.ClusterClients;
import io.clusterhive.cluster.connection.ConnectionFactory;
import io.clusterhive.cluster.connection.DynamicClusterClient;
import io.clusterhive.cluster.credentials.KubeConfigContext;
import io.clusterhive.cluster.credentials.KubeConfigFile;
import io.clusterhive.cluster.credentials.KubeConfigParser;
import io.clusterhive.cluster.credentials.KubeConfigResolver;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of loaded cluster contexts and their client handles, with a single active context.
 * <p>
 * Contexts are keyed by name in sorted order. When the active context is deleted, the remaining
 * context with the lexicographically smallest name becomes active, and the client fallback in
 * {@link #getCurrentClient()} uses the same order.
 * <p>
 * Mutating operations are serialized on the manager. Credential parsing and the connectivity probe
 * run before the registry is touched, so a slow or dead endpoint never blocks readers and never
 * leaves partial state behind. Callers only ever receive {@link ContextInfo} copies.
 */
public final class ContextManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ContextManager.class);

  public static final String DEFAULT_NAMESPACE = "default";
  public static final String IN_CLUSTER_CONTEXT = "in-cluster";
  public static final Path SERVICE_ACCOUNT_NAMESPACE_FILE =
      Path.of("/var/run/secrets/kubernetes.io/serviceaccount/namespace");

  private final KubeConfigResolver resolver;
  private final KubeConfigParser parser;
  private final ConnectionFactory connections;
  private final String defaultNamespace;
  private final Path namespaceFile;

  private final NavigableMap<String, RegisteredContext> contexts = new TreeMap<>();
  private String currentContext;
  private String currentNamespace;

  public ContextManager(KubeConfigResolver resolver, KubeConfigParser parser, ConnectionFactory connections) {
    this(resolver, parser, connections, DEFAULT_NAMESPACE, SERVICE_ACCOUNT_NAMESPACE_FILE);
  }

  public ContextManager(KubeConfigResolver resolver,
                        KubeConfigParser parser,
                        ConnectionFactory connections,
                        String defaultNamespace,
                        Path namespaceFile) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.defaultNamespace = hasText(defaultNamespace) ? defaultNamespace : DEFAULT_NAMESPACE;
    this.namespaceFile = Objects.requireNonNull(namespaceFile, "namespaceFile");
    this.currentNamespace = this.defaultNamespace;
  }

  /**
   * Loads every context of a kubeconfig file under {@code <name>-<context>} keys.
   *
   * @param name caller-chosen name for this load, must not be blank
   * @param path kubeconfig location; blank selects the platform default
   */
  public void loadKubeConfig(String name, String path) {
    requireIdentifier(name, "cluster name cannot be empty");
    Path resolved = resolver.resolve(path);
    synchronized (this) {
      ensureNameAvailable(name);
    }

    KubeConfigFile file = parser.parse(resolved);
    ClusterClients clients = connections.connect(resolved);

    List<String> added = new ArrayList<>();
    String activated = null;
    synchronized (this) {
      try {
        ensureNameAvailable(name);
      } catch (ClusterContextException e) {
        clients.close();
        throw e;
      }
      for (KubeConfigContext context : file.contexts()) {
        String key = registryKey(name, context.name());
        if (contexts.containsKey(key)) {
          log.debug("context {} already registered, keeping existing entry", key);
          continue;
        }
        contexts.put(key, new RegisteredContext(
            key,
            name,
            context.name(),
            context.cluster(),
            context.user(),
            context.namespace(),
            context.serverUrl(),
            resolved,
            clients));
        added.add(key);
      }
      if (added.isEmpty()) {
        clients.close();
      }
      if (currentContext == null && hasText(file.currentContext())) {
        String key = registryKey(name, file.currentContext());
        if (added.contains(key)) {
          currentContext = key;
          activated = key;
        }
      }
    }

    log.info("kubeconfig {} loaded as {} with contexts {} (active={})",
        resolved, name, added, activated == null ? "unchanged" : activated);
  }

  /**
   * Registers the service-account configuration of the pod this process runs in and makes it the
   * active context.
   *
   * @param name registry key; blank selects {@value #IN_CLUSTER_CONTEXT}
   */
  public void loadInClusterConfig(String name) {
    String key = hasText(name) ? name : IN_CLUSTER_CONTEXT;
    synchronized (this) {
      ensureNameAvailable(key);
    }

    ClusterClients clients = connections.connectInCluster();
    String namespace = detectInClusterNamespace();

    String previous;
    synchronized (this) {
      try {
        ensureNameAvailable(key);
      } catch (ClusterContextException e) {
        clients.close();
        throw e;
      }
      contexts.put(key, new RegisteredContext(
          key,
          key,
          key,
          IN_CLUSTER_CONTEXT,
          "service-account",
          namespace,
          clients.serverUrl(),
          null,
          clients));
      previous = currentContext;
      currentContext = key;
    }

    log.info("in-cluster config loaded as {} (server={}, namespace={}, previous active={})",
        key, clients.serverUrl(), namespace, previous);
  }

  public synchronized void deleteContext(String name) {
    RegisteredContext removed = name == null ? null : contexts.remove(name);
    if (removed == null) {
      log.debug("context not found for deletion: {}", name);
      throw notFound(name);
    }
    closeIfUnused(removed.clients());

    if (name.equals(currentContext)) {
      currentContext = contexts.isEmpty() ? null : contexts.firstKey();
      log.info("context {} deleted, new active context {}", name, currentContext);
      return;
    }
    log.info("context {} deleted", name);
  }

  public synchronized void renameContext(String oldName, String newName) {
    requireIdentifier(oldName, "old context name cannot be empty");
    requireIdentifier(newName, "new context name cannot be empty");
    if (oldName.equals(newName)) {
      throw new ClusterContextException(Reason.SAME_NAME,
          "old and new context names cannot be the same");
    }
    if (!contexts.containsKey(oldName)) {
      throw notFound(oldName);
    }
    if (contexts.containsKey(newName)) {
      throw duplicate(newName);
    }

    RegisteredContext context = contexts.remove(oldName);
    context.rename(newName);
    contexts.put(newName, context);
    if (oldName.equals(currentContext)) {
      currentContext = newName;
    }
    log.info("context {} renamed to {}", oldName, newName);
  }

  /**
   * Makes {@code name} the active context and records it as {@code current-context} in the
   * credential file it was loaded from.
   * <p>
   * The in-memory switch is kept even when the file cannot be updated; that case is reported as
   * {@link Reason#PERSIST_FAILED} or {@link Reason#CONTEXT_NOT_FOUND_IN_CREDENTIAL}.
   */
  public synchronized void setCurrentContext(String name) {
    RegisteredContext context = name == null ? null : contexts.get(name);
    if (context == null) {
      log.debug("context not found: {}", name);
      throw notFound(name);
    }

    String previous = currentContext;
    currentContext = name;
    log.info("context switched from {} to {}", previous, name);

    persistCurrentContext(context);
  }

  public synchronized Optional<String> getCurrentContext() {
    return Optional.ofNullable(currentContext);
  }

  public synchronized ContextInfo getContextInfo(String name) {
    RegisteredContext context = name == null ? null : contexts.get(name);
    if (context == null) {
      throw notFound(name);
    }
    return context.snapshot(name.equals(currentContext));
  }

  public synchronized List<ContextInfo> listContexts() {
    List<ContextInfo> result = new ArrayList<>(contexts.size());
    for (Map.Entry<String, RegisteredContext> entry : contexts.entrySet()) {
      result.add(entry.getValue().snapshot(entry.getKey().equals(currentContext)));
    }
    return Collections.unmodifiableList(result);
  }

  public synchronized List<String> listClusters() {
    return List.copyOf(contexts.keySet());
  }

  public synchronized KubernetesClient getClient(String name) {
    return registered(name).clients().typed();
  }

  public synchronized DynamicClusterClient getDynamicClient(String name) {
    return registered(name).clients().dynamic();
  }

  /**
   * Client of the active context. When no context is active, the client of the first registered
   * context is returned so a manager with connections stays usable.
   */
  public synchronized KubernetesClient getCurrentClient() {
    return currentOrFallback().clients().typed();
  }

  public synchronized DynamicClusterClient getCurrentDynamicClient() {
    return currentOrFallback().clients().dynamic();
  }

  public synchronized String getCurrentNamespace() {
    return currentNamespace;
  }

  public synchronized void setCurrentNamespace(String namespace) {
    currentNamespace = hasText(namespace) ? namespace : defaultNamespace;
  }

  /**
   * Raw parameters of the active context for transports that open their own connection.
   */
  public synchronized ConnectionParameters currentConnectionParameters() {
    if (contexts.isEmpty()) {
      throw noConnections();
    }
    RegisteredContext context = currentContext == null ? null : contexts.get(currentContext);
    if (context == null || context.configPath() == null) {
      throw new ClusterContextException(Reason.KUBECONFIG_PATH_MISSING,
          "kubeconfig path not found for context " + currentContext);
    }
    return new ConnectionParameters(context.name(), context.fileContext(), context.configPath());
  }

  @Override
  public synchronized void close() {
    Set<ClusterClients> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
    for (RegisteredContext context : contexts.values()) {
      distinct.add(context.clients());
    }
    contexts.clear();
    currentContext = null;
    for (ClusterClients clients : distinct) {
      try {
        clients.close();
      } catch (RuntimeException e) {
        log.warn("failed to close cluster client {}", clients.serverUrl(), e);
      }
    }
    log.info("context manager closed ({} clients released)", distinct.size());
  }

  private void persistCurrentContext(RegisteredContext context) {
    Path configPath = context.configPath();
    if (configPath == null) {
      log.debug("context {} has no credential file, skipping current-context update", context.name());
      return;
    }
    KubeConfigFile file;
    try {
      file = parser.parse(configPath);
    } catch (ClusterContextException e) {
      throw persistFailed(configPath, e);
    }
    String fileContext = matchFileContext(context, file);
    if (fileContext == null) {
      throw new ClusterContextException(Reason.CONTEXT_NOT_FOUND_IN_CREDENTIAL,
          "context " + context.name() + " not found in kubeconfig " + configPath);
    }
    try {
      parser.writeCurrentContext(configPath, fileContext);
    } catch (IOException e) {
      throw persistFailed(configPath, e);
    }
    String written;
    try {
      written = parser.parse(configPath).currentContext();
    } catch (ClusterContextException e) {
      throw persistFailed(configPath, e);
    }
    if (!fileContext.equals(written)) {
      throw persistFailed(configPath,
          new IOException("current-context reads back as " + written + " instead of " + fileContext));
    }
    log.debug("kubeconfig {} current-context set to {}", configPath, fileContext);
  }

  private static String matchFileContext(RegisteredContext context, KubeConfigFile file) {
    if (file.context(context.fileContext()).isPresent()) {
      return context.fileContext();
    }
    String key = context.name();
    String best = null;
    for (KubeConfigContext candidate : file.contexts()) {
      String name = candidate.name();
      boolean matches = key.equals(name) || key.endsWith("-" + name);
      if (matches && (best == null || name.length() > best.length())) {
        best = name;
      }
    }
    return best;
  }

  private ClusterContextException persistFailed(Path configPath, Exception cause) {
    log.warn("active context switched but kubeconfig {} could not be updated: {}",
        configPath, cause.getMessage());
    return new ClusterContextException(Reason.PERSIST_FAILED,
        "failed to update kubeconfig file " + configPath + ": " + cause.getMessage(), cause);
  }

  private RegisteredContext currentOrFallback() {
    if (contexts.isEmpty()) {
      throw noConnections();
    }
    RegisteredContext current = currentContext == null ? null : contexts.get(currentContext);
    if (current != null) {
      return current;
    }
    Map.Entry<String, RegisteredContext> first = contexts.firstEntry();
    if (first == null) {
      throw new ClusterContextException(Reason.NO_CLIENTS_AVAILABLE, "no clients available");
    }
    return first.getValue();
  }

  private RegisteredContext registered(String name) {
    RegisteredContext context = name == null ? null : contexts.get(name);
    if (context == null) {
      throw notFound(name);
    }
    return context;
  }

  private void ensureNameAvailable(String name) {
    if (contexts.containsKey(name)) {
      throw duplicate(name);
    }
    for (RegisteredContext context : contexts.values()) {
      if (name.equals(context.loadName())) {
        throw duplicate(name);
      }
    }
  }

  private void closeIfUnused(ClusterClients clients) {
    for (RegisteredContext context : contexts.values()) {
      if (context.clients() == clients) {
        return;
      }
    }
    try {
      clients.close();
    } catch (RuntimeException e) {
      log.warn("failed to close cluster client {}", clients.serverUrl(), e);
    }
  }

  private String detectInClusterNamespace() {
    try {
      String namespace = Files.readString(namespaceFile, StandardCharsets.UTF_8).trim();
      if (namespace.isEmpty()) {
        log.debug("namespace file {} is empty, using {}", namespaceFile, defaultNamespace);
        return defaultNamespace;
      }
      return namespace;
    } catch (IOException e) {
      log.debug("failed to read namespace from {}, using {}: {}", namespaceFile, defaultNamespace, e.getMessage());
      return defaultNamespace;
    }
  }

  private static String registryKey(String name, String fileContext) {
    return name + "-" + fileContext;
  }

  private static void requireIdentifier(String value, String message) {
    if (!hasText(value)) {
      throw new ClusterContextException(Reason.EMPTY_IDENTIFIER, message);
    }
  }

  private static ClusterContextException notFound(String name) {
    return new ClusterContextException(Reason.CONTEXT_NOT_FOUND, "context " + name + " not found");
  }

  private static ClusterContextException duplicate(String name) {
    return new ClusterContextException(Reason.DUPLICATE_CONTEXT, "context " + name + " already exists");
  }

  private static ClusterContextException noConnections() {
    return new ClusterContextException(Reason.NO_CONNECTIONS_CONFIGURED,
        "no clusters configured - load a kubeconfig first");
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
