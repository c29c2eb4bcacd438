package io.clusterhive.tunnel;

import java.util.Objects;

/**
 * Failure raised by tunnel session operations. The {@link Reason} lets callers tell invalid input
 * apart from missing workloads and transport problems.
 */
public class TunnelException extends RuntimeException {

  public enum Reason {
    EMPTY_IDENTIFIER,
    INVALID_PORT,
    INVALID_TARGET,
    NO_SELECTOR,
    NO_INSTANCES,
    NO_RUNNING_INSTANCES,
    TARGET_NOT_FOUND,
    START_CANCELLED,
    TRANSPORT_FAILURE,
    SESSION_NOT_FOUND
  }

  private final Reason reason;

  public TunnelException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public TunnelException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}
