package io.clusterhive.tunnel;

import io.clusterhive.cluster.context.ConnectionParameters;
import io.clusterhive.cluster.context.ContextManager;
import io.clusterhive.tunnel.TunnelException.Reason;
import io.clusterhive.tunnel.transport.PortForwardHandle;
import io.clusterhive.tunnel.transport.TunnelEndpoint;
import io.clusterhive.tunnel.transport.TunnelTransport;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts, tracks and stops port-forward tunnels to pods of the active cluster context.
 * <p>
 * Each tunnel runs on its own daemon thread which opens the transport, reports the bound port and
 * then supervises the forward until it is stopped, fails or outlives {@link TunnelSettings#maxLifetime()}.
 * A tunnel moves {@code RUNNING -> STOPPING -> STOPPED}. Only the party that removes a session from
 * the registry performs the {@code RUNNING -> STOPPING} transition, so teardown is signalled once.
 * <p>
 * The registry lock is never held across network calls; {@link #stop(String)} and {@link #list()}
 * return without waiting for the transport.
 */
public final class TunnelSessionManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TunnelSessionManager.class);

  static final String ID_PREFIX = "pf-";
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private enum State { STARTING, RUNNING, STOPPING, STOPPED }

  private final ContextManager contexts;
  private final TunnelTransport transport;
  private final WorkloadResolver workloads;
  private final TunnelSettings settings;
  private final Clock clock;
  private final ExecutorService executor;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Tunnel> sessions = new LinkedHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  public TunnelSessionManager(ContextManager contexts, TunnelTransport transport) {
    this(contexts, transport, new WorkloadResolver(), TunnelSettings.defaults(), Clock.systemUTC());
  }

  public TunnelSessionManager(ContextManager contexts,
                              TunnelTransport transport,
                              WorkloadResolver workloads,
                              TunnelSettings settings,
                              Clock clock) {
    this.contexts = Objects.requireNonNull(contexts, "contexts");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.workloads = Objects.requireNonNull(workloads, "workloads");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    AtomicInteger threads = new AtomicInteger();
    this.executor = Executors.newCachedThreadPool(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "port-forward-" + threads.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  public TunnelSession start(String namespace, TunnelTarget target, PortMapping ports) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(ports, "ports");
    return start(namespace, target.kind(), target.name(), ports.localPort(), ports.remotePort());
  }

  public TunnelSession start(String namespace, TargetKind kind, String targetName, int localPort, int remotePort) {
    return start(namespace, kind, targetName, localPort, remotePort, settings.startTimeout());
  }

  /**
   * Opens a tunnel and waits until it is bound.
   *
   * @param namespace namespace of the target; blank uses the context manager's current namespace
   * @param localPort local port to bind, 0 for an ephemeral port
   * @param timeout how long to wait for the tunnel to become ready
   * @return the registered session, carrying the port actually bound
   */
  public TunnelSession start(String namespace,
                             TargetKind kind,
                             String targetName,
                             int localPort,
                             int remotePort,
                             Duration timeout) {
    Objects.requireNonNull(kind, "kind");
    if (targetName == null || targetName.isBlank()) {
      throw new TunnelException(Reason.EMPTY_IDENTIFIER, "target name cannot be empty");
    }
    PortMapping.validateLocal(localPort);
    PortMapping.validateRemote(remotePort);
    Duration wait = timeout == null ? settings.startTimeout() : timeout;
    String ns = namespace == null || namespace.isBlank() ? contexts.getCurrentNamespace() : namespace;

    ConnectionParameters connection = contexts.currentConnectionParameters();
    KubernetesClient client = contexts.getClient(connection.contextName());
    String podName = workloads.resolvePod(client, ns, kind, targetName);

    Tunnel tunnel = new Tunnel(new TunnelEndpoint(connection, ns, podName, localPort, remotePort));
    Future<?> task;
    try {
      task = executor.submit(tunnel::run);
    } catch (RejectedExecutionException e) {
      throw new TunnelException(Reason.TRANSPORT_FAILURE, "tunnel session manager is closed", e);
    }

    PortForwardHandle handle = awaitReady(tunnel, task, wait);

    TunnelSession session;
    lock.writeLock().lock();
    try {
      if (tunnel.state.get() != State.RUNNING) {
        throw new TunnelException(Reason.TRANSPORT_FAILURE,
            "port forward to pod " + podName + " closed before it was registered");
      }
      session = new TunnelSession(
          ID_PREFIX + sequence.incrementAndGet(),
          ns,
          targetName,
          kind,
          podName,
          handle.localPort(),
          remotePort,
          clock.instant());
      tunnel.session = session;
      sessions.put(session.id(), tunnel);
    } finally {
      lock.writeLock().unlock();
    }

    log.info("port forward {} started: localhost:{} -> {}/{}:{} ({} {})",
        session.id(), session.localPort(), ns, podName, remotePort,
        kind.name().toLowerCase(Locale.ROOT), targetName);
    return session;
  }

  public void stop(String id) {
    if (id == null || id.isBlank()) {
      throw new TunnelException(Reason.EMPTY_IDENTIFIER, "session id cannot be empty");
    }
    Tunnel tunnel;
    lock.writeLock().lock();
    try {
      tunnel = sessions.remove(id);
      if (tunnel == null) {
        log.debug("port forward session not found: {}", id);
        throw new TunnelException(Reason.SESSION_NOT_FOUND, "port forward session " + id + " not found");
      }
      tunnel.state.compareAndSet(State.RUNNING, State.STOPPING);
    } finally {
      lock.writeLock().unlock();
    }
    tunnel.cancelled.countDown();
    log.info("port forward {} stopped", id);
  }

  public List<TunnelSession> list() {
    lock.readLock().lock();
    try {
      List<TunnelSession> result = new ArrayList<>(sessions.size());
      for (Tunnel tunnel : sessions.values()) {
        result.add(tunnel.session);
      }
      return List.copyOf(result);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<TunnelSession> get(String id) {
    lock.readLock().lock();
    try {
      Tunnel tunnel = id == null ? null : sessions.get(id);
      return tunnel == null ? Optional.empty() : Optional.of(tunnel.session);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int activeCount() {
    lock.readLock().lock();
    try {
      return sessions.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Stops every session and shuts the worker threads down.
   */
  @Override
  public void close() {
    List<Tunnel> stopping = new ArrayList<>();
    lock.writeLock().lock();
    try {
      for (Tunnel tunnel : sessions.values()) {
        if (tunnel.state.compareAndSet(State.RUNNING, State.STOPPING)) {
          stopping.add(tunnel);
        }
      }
      sessions.clear();
    } finally {
      lock.writeLock().unlock();
    }
    for (Tunnel tunnel : stopping) {
      tunnel.cancelled.countDown();
    }

    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("port forward workers did not finish within {}, interrupting", SHUTDOWN_GRACE);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("tunnel session manager closed ({} sessions stopped)", stopping.size());
  }

  private PortForwardHandle awaitReady(Tunnel tunnel, Future<?> task, Duration wait) {
    String pod = tunnel.endpoint.podName();
    try {
      return tunnel.ready.get(wait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      tunnel.abandon();
      task.cancel(true);
      throw new TunnelException(Reason.START_CANCELLED,
          "port forward to pod " + pod + " not ready within " + wait, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      tunnel.abandon();
      task.cancel(true);
      throw new TunnelException(Reason.START_CANCELLED, "port forward to pod " + pod + " interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof TunnelException tunnelException
          && tunnelException.reason() == Reason.TRANSPORT_FAILURE) {
        throw tunnelException;
      }
      throw new TunnelException(Reason.TRANSPORT_FAILURE,
          "port forward to pod " + pod + " failed: " + cause.getMessage(), cause);
    }
  }

  /**
   * Moves a running tunnel to {@code STOPPING} and drops it from the registry. Returns false when
   * someone else already did.
   */
  private boolean release(Tunnel tunnel) {
    lock.writeLock().lock();
    try {
      if (!tunnel.state.compareAndSet(State.RUNNING, State.STOPPING)) {
        return false;
      }
      TunnelSession session = tunnel.session;
      if (session != null) {
        sessions.remove(session.id(), tunnel);
      }
    } finally {
      lock.writeLock().unlock();
    }
    tunnel.cancelled.countDown();
    return true;
  }

  private final class Tunnel {

    private final TunnelEndpoint endpoint;
    private final CompletableFuture<PortForwardHandle> ready = new CompletableFuture<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
    private volatile TunnelSession session;

    Tunnel(TunnelEndpoint endpoint) {
      this.endpoint = endpoint;
    }

    void run() {
      PortForwardHandle handle;
      try {
        handle = transport.open(endpoint);
      } catch (RuntimeException e) {
        state.set(State.STOPPED);
        ready.completeExceptionally(e);
        return;
      }
      if (!state.compareAndSet(State.STARTING, State.RUNNING) || !ready.complete(handle)) {
        log.debug("port forward to pod {} abandoned before it was ready", endpoint.podName());
        closeQuietly(handle);
        return;
      }
      supervise(handle);
    }

    void abandon() {
      ready.completeExceptionally(new CancellationException("start abandoned"));
      if (state.compareAndSet(State.RUNNING, State.STOPPING)) {
        cancelled.countDown();
      } else {
        state.compareAndSet(State.STARTING, State.STOPPING);
      }
    }

    private void supervise(PortForwardHandle handle) {
      long interval = settings.healthCheckInterval().toMillis();
      long deadline = settings.bounded() ? System.nanoTime() + settings.maxLifetime().toNanos() : 0L;
      if (!settings.bounded()) {
        log.debug("port forward to pod {} has no maximum lifetime and runs until stopped", endpoint.podName());
      }
      try {
        while (true) {
          long waitMillis = interval;
          if (settings.bounded()) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            waitMillis = Math.max(0L, Math.min(interval, remaining));
          }
          if (cancelled.await(waitMillis, TimeUnit.MILLISECONDS)) {
            return;
          }
          Optional<Throwable> failure = handle.failure();
          if (failure.isPresent() || !handle.isAlive()) {
            if (release(this)) {
              log.warn("port forward {} to pod {} failed: {}", id(), endpoint.podName(),
                  failure.map(Throwable::getMessage).orElse("forward no longer alive"));
            }
            return;
          }
          if (settings.bounded() && System.nanoTime() - deadline >= 0) {
            if (release(this)) {
              log.info("port forward {} reached maximum lifetime {}, closing", id(), settings.maxLifetime());
            }
            return;
          }
        }
      } catch (InterruptedException e) {
        release(this);
        Thread.currentThread().interrupt();
      } finally {
        closeQuietly(handle);
      }
    }

    private void closeQuietly(PortForwardHandle handle) {
      try {
        handle.close();
      } catch (RuntimeException e) {
        log.warn("failed to close port forward to pod {}", endpoint.podName(), e);
      } finally {
        state.set(State.STOPPED);
      }
    }

    private String id() {
      TunnelSession current = session;
      return current == null ? "(unregistered)" : current.id();
    }
  }
}
