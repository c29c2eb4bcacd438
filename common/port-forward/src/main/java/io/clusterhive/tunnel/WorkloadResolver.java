package io.clusterhive.tunnel;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a tunnel target to the pod that will receive the forwarded traffic.
 * <p>
 * A service resolves to the first pod in phase {@code Running} among the pods its selector matches,
 * in the order the API server lists them.
 */
public class WorkloadResolver {

  private static final Logger log = LoggerFactory.getLogger(WorkloadResolver.class);

  static final String RUNNING_PHASE = "Running";

  public String resolvePod(KubernetesClient client, String namespace, TargetKind kind, String name) {
    String podName = kind == TargetKind.SERVICE ? podForService(client, namespace, name) : name;
    Pod pod = get(() -> client.pods().inNamespace(namespace).withName(podName).get(),
        "pod " + podName + " in namespace " + namespace);
    if (pod == null) {
      log.debug("pod {} not found in namespace {}", podName, namespace);
      throw new TunnelException(TunnelException.Reason.TARGET_NOT_FOUND,
          "pod " + podName + " not found in namespace " + namespace);
    }
    return podName;
  }

  private String podForService(KubernetesClient client, String namespace, String serviceName) {
    Service service = get(() -> client.services().inNamespace(namespace).withName(serviceName).get(),
        "service " + serviceName + " in namespace " + namespace);
    if (service == null) {
      log.debug("service {} not found in namespace {}", serviceName, namespace);
      throw new TunnelException(TunnelException.Reason.TARGET_NOT_FOUND,
          "service " + serviceName + " not found in namespace " + namespace);
    }
    Map<String, String> selector = service.getSpec() == null ? null : service.getSpec().getSelector();
    if (selector == null || selector.isEmpty()) {
      throw new TunnelException(TunnelException.Reason.NO_SELECTOR,
          "service " + serviceName + " has no selector");
    }

    List<Pod> pods = get(() -> client.pods().inNamespace(namespace).withLabels(selector).list().getItems(),
        "pods for service " + serviceName);
    if (pods == null || pods.isEmpty()) {
      throw new TunnelException(TunnelException.Reason.NO_INSTANCES,
          "no pods found for service " + serviceName);
    }
    for (Pod pod : pods) {
      if (pod.getStatus() != null && RUNNING_PHASE.equals(pod.getStatus().getPhase())) {
        String podName = pod.getMetadata().getName();
        log.debug("service {} resolved to pod {}", serviceName, podName);
        return podName;
      }
    }
    throw new TunnelException(TunnelException.Reason.NO_RUNNING_INSTANCES,
        "no running pods found for service " + serviceName);
  }

  private static <T> T get(Supplier<T> call, String what) {
    try {
      return call.get();
    } catch (KubernetesClientException e) {
      if (e.getCode() == 404) {
        return null;
      }
      throw new TunnelException(TunnelException.Reason.TRANSPORT_FAILURE,
          "failed to look up " + what + ": " + e.getMessage(), e);
    }
  }
}
