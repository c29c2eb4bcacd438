package io.clusterhive.cluster.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterhive.cluster.ClusterContextException;
import io.clusterhive.cluster.ClusterContextException.Reason;
import io.clusterhive.cluster.connection.ClusterClients;
import io.clusterhive.cluster.connection.ConnectionFactory;
import io.clusterhive.cluster.credentials.KubeConfigParser;
import io.clusterhive.cluster.credentials.KubeConfigResolver;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContextManagerTest {

  @TempDir
  Path tempDir;

  @Mock
  ConnectionFactory connections;

  private ContextManager manager;

  @BeforeEach
  void setUp() {
    manager = new ContextManager(
        new KubeConfigResolver(name -> null, () -> tempDir.toString()),
        new KubeConfigParser(),
        connections,
        "default",
        tempDir.resolve("namespace"));
  }

  @Test
  void loadRegistersEveryContextUnderTheLoadName() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);

    manager.loadKubeConfig("primary", file.toString());

    assertThat(manager.listClusters()).containsExactly("primary-c1", "primary-c2");
    assertThat(manager.getContextInfo("primary-c1"))
        .isEqualTo(new ContextInfo("primary-c1", "cluster-c1", "user-c1", "ns-c1",
            "https://c1.example:6443", file.toString(), true));
    assertThat(manager.getContextInfo("primary-c2").active()).isFalse();
    assertThat(manager.getCurrentContext()).contains("primary-c1");
    assertThat(manager.getCurrentClient()).isSameAs(clients.typed());
    assertThat(manager.getClient("primary-c2")).isSameAs(clients.typed());
    assertThat(manager.getCurrentDynamicClient()).isSameAs(clients.dynamic());
  }

  @Test
  void loadingTheSameNameTwiceLeavesRegistryUntouched() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());
    List<ContextInfo> before = manager.listContexts();

    assertThatThrownBy(() -> manager.loadKubeConfig("primary", file.toString()))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.DUPLICATE_CONTEXT));

    assertThat(manager.listContexts()).isEqualTo(before);
    verify(connections).connect(file);
  }

  @Test
  void rejectsBlankName() {
    assertThatThrownBy(() -> manager.loadKubeConfig(" ", "ignored"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.EMPTY_IDENTIFIER));
  }

  @Test
  void failedProbeRegistersNothing() throws Exception {
    Path file = kubeconfig("config", "c1", "c1");
    when(connections.connect(file)).thenThrow(
        new ClusterContextException(Reason.CONNECTION_UNREACHABLE, "failed to connect"));

    assertThatThrownBy(() -> manager.loadKubeConfig("primary", file.toString()))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONNECTION_UNREACHABLE));

    assertThat(manager.listContexts()).isEmpty();
    assertThat(manager.getCurrentContext()).isEmpty();
  }

  @Test
  void malformedCredentialIsRejectedBeforeConnecting() throws Exception {
    Path file = Files.writeString(tempDir.resolve("broken"), "contexts: [oops\n");

    assertThatThrownBy(() -> manager.loadKubeConfig("primary", file.toString()))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CREDENTIAL_MALFORMED));

    verify(connections, never()).connect(any());
  }

  @Test
  void secondLoadDoesNotStealTheActiveContext() throws Exception {
    Path first = kubeconfig("first", "a", "a");
    Path second = kubeconfig("second", "b", "b");
    when(connections.connect(first)).thenReturn(clients());
    when(connections.connect(second)).thenReturn(clients());

    manager.loadKubeConfig("one", first.toString());
    manager.loadKubeConfig("two", second.toString());

    assertThat(manager.getCurrentContext()).contains("one-a");
    assertThat(activeNames()).containsExactly("one-a");
  }

  @Test
  void loadWithoutMatchingCurrentContextLeavesNothingActive() throws Exception {
    Path file = kubeconfig("config", "elsewhere", "c1");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);

    manager.loadKubeConfig("primary", file.toString());

    assertThat(manager.getCurrentContext()).isEmpty();
    assertThat(activeNames()).isEmpty();
    assertThat(manager.getCurrentClient()).isSameAs(clients.typed());
  }

  @Test
  void loadThatAddsNoContextReleasesItsClients() throws Exception {
    Path file = kubeconfig("config", null);
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);

    manager.loadKubeConfig("empty", file.toString());

    assertThat(manager.listContexts()).isEmpty();
    verify(clients.typed()).close();
  }

  @Test
  void deletingActiveContextPromotesSmallestRemainingName() throws Exception {
    Path file = kubeconfig("config", "c2", "c1", "c2", "c3");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());

    manager.deleteContext("primary-c2");

    assertThat(manager.getCurrentContext()).contains("primary-c1");
    assertThat(activeNames()).containsExactly("primary-c1");
    assertThatThrownBy(() -> manager.getContextInfo("primary-c2"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
  }

  @Test
  void deletingLastContextClearsActiveSelectionAndClosesClients() throws Exception {
    Path file = kubeconfig("config", "c1", "c1");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);
    manager.loadKubeConfig("primary", file.toString());

    manager.deleteContext("primary-c1");

    assertThat(manager.getCurrentContext()).isEmpty();
    assertThat(manager.listContexts()).isEmpty();
    verify(clients.typed()).close();
    assertThatThrownBy(() -> manager.getCurrentClient())
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.NO_CONNECTIONS_CONFIGURED));
  }

  @Test
  void sharedClientsStayOpenWhileAnotherContextUsesThem() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);
    manager.loadKubeConfig("primary", file.toString());

    manager.deleteContext("primary-c1");

    verify(clients.typed(), never()).close();
  }

  @Test
  void deletingUnknownContextFails() {
    assertThatThrownBy(() -> manager.deleteContext("missing"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
  }

  @Test
  void activeCountIsAlwaysZeroOrOneAcrossLoadsAndDeletes() throws Exception {
    Path first = kubeconfig("first", "a", "a", "b");
    Path second = kubeconfig("second", "c", "c", "d");
    when(connections.connect(first)).thenReturn(clients());
    when(connections.connect(second)).thenReturn(clients());

    manager.loadKubeConfig("one", first.toString());
    assertThat(activeNames()).hasSize(1);
    manager.loadKubeConfig("two", second.toString());
    assertThat(activeNames()).hasSize(1);
    for (String name : List.of("one-a", "two-c", "one-b")) {
      manager.deleteContext(name);
      assertThat(activeNames()).hasSize(1);
    }
    manager.deleteContext("two-d");
    assertThat(activeNames()).isEmpty();
  }

  @Test
  void renameMovesEntryAndActiveMarker() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);
    manager.loadKubeConfig("primary", file.toString());

    manager.renameContext("primary-c1", "prod");

    assertThat(manager.getContextInfo("prod").name()).isEqualTo("prod");
    assertThat(manager.getContextInfo("prod").active()).isTrue();
    assertThat(manager.getCurrentContext()).contains("prod");
    assertThat(manager.getClient("prod")).isSameAs(clients.typed());
    assertThatThrownBy(() -> manager.getContextInfo("primary-c1"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
    assertThatThrownBy(() -> manager.getClient("primary-c1"))
        .isInstanceOf(ClusterContextException.class);
  }

  @Test
  void renameValidatesNames() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());

    assertThatThrownBy(() -> manager.renameContext("primary-c1", "primary-c1"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.SAME_NAME));
    assertThatThrownBy(() -> manager.renameContext("missing", "other"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
    assertThatThrownBy(() -> manager.renameContext("primary-c1", "primary-c2"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.DUPLICATE_CONTEXT));
    assertThat(manager.listClusters()).containsExactly("primary-c1", "primary-c2");
  }

  @Test
  void switchingContextFlipsFlagsAndPersistsMarker() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());

    manager.setCurrentContext("primary-c2");

    assertThat(manager.getContextInfo("primary-c1").active()).isFalse();
    assertThat(manager.getContextInfo("primary-c2").active()).isTrue();
    assertThat(new KubeConfigParser().parse(file).currentContext()).isEqualTo("c2");
    assertThat(Files.readString(file)).contains("current-context: c2");
  }

  @Test
  void switchingRenamedContextStillFindsItsFileContext() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());
    manager.renameContext("primary-c2", "staging");

    manager.setCurrentContext("staging");

    assertThat(new KubeConfigParser().parse(file).currentContext()).isEqualTo("c2");
  }

  @Test
  void switchingToUnknownContextFails() {
    assertThatThrownBy(() -> manager.setCurrentContext("nope"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
  }

  @Test
  void persistFailureKeepsInMemorySwitch() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());
    Files.delete(file);

    assertThatThrownBy(() -> manager.setCurrentContext("primary-c2"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.PERSIST_FAILED));

    assertThat(manager.getCurrentContext()).contains("primary-c2");
    assertThat(activeNames()).containsExactly("primary-c2");
  }

  @Test
  void contextRemovedFromFileIsReportedAfterSwitch() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());
    Files.writeString(file, kubeconfigContent("c1", "c1"));

    assertThatThrownBy(() -> manager.setCurrentContext("primary-c2"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND_IN_CREDENTIAL));

    assertThat(manager.getCurrentContext()).contains("primary-c2");
  }

  @Test
  void returnedInfoIsACopy() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());
    List<ContextInfo> snapshot = manager.listContexts();

    manager.setCurrentContext("primary-c2");
    manager.renameContext("primary-c1", "renamed");

    assertThat(snapshot).extracting(ContextInfo::name).containsExactly("primary-c1", "primary-c2");
    assertThat(snapshot.get(0).active()).isTrue();
    assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void currentNamespaceDefaultsAndResets() {
    assertThat(manager.getCurrentNamespace()).isEqualTo("default");

    manager.setCurrentNamespace("payments");
    assertThat(manager.getCurrentNamespace()).isEqualTo("payments");

    manager.setCurrentNamespace("");
    assertThat(manager.getCurrentNamespace()).isEqualTo("default");
  }

  @Test
  void connectionParametersReferToActiveFileContext() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("primary", file.toString());

    assertThat(manager.currentConnectionParameters())
        .isEqualTo(new ConnectionParameters("primary-c1", "c1", file));
  }

  @Test
  void connectionParametersRequireAConfiguredCredentialFile() throws Exception {
    assertThatThrownBy(() -> manager.currentConnectionParameters())
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.NO_CONNECTIONS_CONFIGURED));

    Files.writeString(tempDir.resolve("namespace"), "ops\n");
    when(connections.connectInCluster()).thenReturn(clients());
    manager.loadInClusterConfig(null);

    assertThatThrownBy(() -> manager.currentConnectionParameters())
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.KUBECONFIG_PATH_MISSING));
  }

  @Test
  void inClusterLoadBecomesActiveWithDetectedNamespace() throws Exception {
    Path file = kubeconfig("config", "c1", "c1");
    when(connections.connect(file)).thenReturn(clients());
    when(connections.connectInCluster()).thenReturn(clients());
    Files.writeString(tempDir.resolve("namespace"), "ops\n");
    manager.loadKubeConfig("primary", file.toString());

    manager.loadInClusterConfig("");

    ContextInfo info = manager.getContextInfo("in-cluster");
    assertThat(info.active()).isTrue();
    assertThat(info.namespace()).isEqualTo("ops");
    assertThat(info.cluster()).isEqualTo("in-cluster");
    assertThat(info.user()).isEqualTo("service-account");
    assertThat(info.configPath()).isNull();
    assertThat(activeNames()).containsExactly("in-cluster");

    manager.setCurrentContext("in-cluster");
    assertThat(new KubeConfigParser().parse(file).currentContext()).isEqualTo("c1");
  }

  @Test
  void inClusterNamespaceFallsBackToDefault() {
    when(connections.connectInCluster()).thenReturn(clients());

    manager.loadInClusterConfig("pod");

    assertThat(manager.getContextInfo("pod").namespace()).isEqualTo("default");
  }

  @Test
  void closeReleasesEveryClientOnce() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    ClusterClients clients = clients();
    when(connections.connect(file)).thenReturn(clients);
    manager.loadKubeConfig("primary", file.toString());

    manager.close();

    verify(clients.typed()).close();
    assertThat(manager.listContexts()).isEmpty();
  }

  @Test
  void switchingPersistsIntoJsonKubeconfig() throws Exception {
    Path file = Files.writeString(tempDir.resolve("config.json"), """
        {
          "apiVersion": "v1",
          "kind": "Config",
          "clusters": [
            {"name": "alpha", "cluster": {"server": "https://alpha.example:6443"}}
          ],
          "contexts": [
            {"name": "c1", "context": {"cluster": "alpha", "user": "admin"}},
            {"name": "c2", "context": {"cluster": "alpha", "user": "admin"}}
          ],
          "current-context": "c1",
          "users": []
        }
        """);
    when(connections.connect(file)).thenReturn(clients());
    manager.loadKubeConfig("p", file.toString());

    manager.setCurrentContext("p-c2");

    assertThat(new ObjectMapper().readTree(file.toFile()).get("current-context").asText()).isEqualTo("c2");
    assertThat(new KubeConfigParser().parse(file).currentContext()).isEqualTo("c2");
  }

  @Test
  void unverifiedWriteIsReportedAsPersistFailure() throws Exception {
    Path file = kubeconfig("config", "c1", "c1", "c2");
    KubeConfigParser parser = spy(new KubeConfigParser());
    doNothing().when(parser).writeCurrentContext(any(), any());
    when(connections.connect(file)).thenReturn(clients());
    ContextManager silent = new ContextManager(
        new KubeConfigResolver(name -> null, () -> tempDir.toString()),
        parser,
        connections,
        "default",
        tempDir.resolve("namespace"));
    silent.loadKubeConfig("primary", file.toString());

    assertThatThrownBy(() -> silent.setCurrentContext("primary-c2"))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.PERSIST_FAILED));

    assertThat(silent.getCurrentContext()).contains("primary-c2");
  }

  @Test
  void deletingNullNameIsNotFound() {
    assertThatThrownBy(() -> manager.deleteContext(null))
        .isInstanceOfSatisfying(ClusterContextException.class,
            e -> assertThat(e.reason()).isEqualTo(Reason.CONTEXT_NOT_FOUND));
  }

  private Set<String> activeNames() {
    return Set.copyOf(manager.listContexts().stream()
        .filter(ContextInfo::active)
        .map(ContextInfo::name)
        .toList());
  }

  private static ClusterClients clients() {
    return ClusterClients.of(mock(KubernetesClient.class));
  }

  private Path kubeconfig(String fileName, String current, String... contexts) throws Exception {
    return Files.writeString(tempDir.resolve(fileName), kubeconfigContent(current, contexts));
  }

  private static String kubeconfigContent(String current, String... contexts) {
    StringBuilder yaml = new StringBuilder("apiVersion: v1\nkind: Config\nclusters:\n");
    for (String context : contexts) {
      yaml.append("- name: cluster-").append(context).append('\n')
          .append("  cluster:\n")
          .append("    server: https://").append(context).append(".example:6443\n");
    }
    yaml.append("contexts:\n");
    for (String context : contexts) {
      yaml.append("- name: ").append(context).append('\n')
          .append("  context:\n")
          .append("    cluster: cluster-").append(context).append('\n')
          .append("    user: user-").append(context).append('\n')
          .append("    namespace: ns-").append(context).append('\n');
    }
    if (contexts.length == 0) {
      yaml.setLength(yaml.length() - "clusters:\ncontexts:\n".length());
    }
    if (current != null) {
      yaml.append("current-context: ").append(current).append('\n');
    }
    yaml.append("users: []\n");
    return yaml.toString();
  }
}
