package io.clusterhive.tunnel;

import java.util.Locale;
import java.util.Objects;

/**
 * Workload a tunnel forwards to, written as {@code pod/<name>}, {@code service/<name>} or
 * {@code svc/<name>}.
 */
public record TunnelTarget(TargetKind kind, String name) {

  public TunnelTarget {
    Objects.requireNonNull(kind, "kind");
    if (name == null || name.isBlank()) {
      throw new TunnelException(TunnelException.Reason.EMPTY_IDENTIFIER, "target name cannot be empty");
    }
  }

  public static TunnelTarget parse(String value) {
    if (value == null || value.isBlank()) {
      throw new TunnelException(TunnelException.Reason.EMPTY_IDENTIFIER, "target cannot be empty");
    }
    int slash = value.indexOf('/');
    if (slash <= 0 || slash == value.length() - 1 || value.indexOf('/', slash + 1) >= 0) {
      throw new TunnelException(TunnelException.Reason.INVALID_TARGET,
          "invalid target format: " + value + " (expected pod/<name> or service/<name>)");
    }
    return new TunnelTarget(TargetKind.fromString(value.substring(0, slash)), value.substring(slash + 1));
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + "/" + name;
  }
}
