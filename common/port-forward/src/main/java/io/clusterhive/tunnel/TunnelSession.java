package io.clusterhive.tunnel;

import java.time.Instant;

/**
 * Snapshot of a registered tunnel. {@code localPort} is the port actually bound, never 0.
 */
public record TunnelSession(
    String id,
    String namespace,
    String target,
    TargetKind kind,
    String podName,
    int localPort,
    int remotePort,
    Instant startedAt) {
}
