package io.clusterhive.tunnel;

import java.util.Locale;

public enum TargetKind {
  POD,
  SERVICE;

  /**
   * Accepts {@code pod}, {@code service} and the short form {@code svc}, case-insensitively.
   */
  public static TargetKind fromString(String value) {
    if (value == null) {
      throw new TunnelException(TunnelException.Reason.INVALID_TARGET, "target kind must not be null");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "pod" -> POD;
      case "service", "svc" -> SERVICE;
      default -> throw new TunnelException(TunnelException.Reason.INVALID_TARGET,
          "invalid resource type: " + value + " (must be pod or service)");
    };
  }
}
