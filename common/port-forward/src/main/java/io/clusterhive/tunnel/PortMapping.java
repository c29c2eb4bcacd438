package io.clusterhive.tunnel;

/**
 * Local and remote port pair. {@code "8080:80"} forwards local 8080 to remote 80; a single port
 * uses the same number on both sides. Local port 0 asks for an ephemeral port.
 */
public record PortMapping(int localPort, int remotePort) {

  public PortMapping {
    validateLocal(localPort);
    validateRemote(remotePort);
  }

  public static PortMapping parse(String value) {
    if (value == null || value.isBlank()) {
      throw new TunnelException(TunnelException.Reason.INVALID_PORT, "port mapping cannot be empty");
    }
    String[] parts = value.trim().split(":", -1);
    if (parts.length == 1) {
      int port = toPort(parts[0], value);
      return new PortMapping(port, port);
    }
    if (parts.length == 2) {
      return new PortMapping(toPort(parts[0], value), toPort(parts[1], value));
    }
    throw new TunnelException(TunnelException.Reason.INVALID_PORT,
        "invalid port mapping: " + value + " (expected <local>:<remote> or <port>)");
  }

  static void validateLocal(int port) {
    if (port < 0 || port > 65535) {
      throw new TunnelException(TunnelException.Reason.INVALID_PORT,
          "local port " + port + " out of range 0-65535");
    }
  }

  static void validateRemote(int port) {
    if (port < 1 || port > 65535) {
      throw new TunnelException(TunnelException.Reason.INVALID_PORT,
          "remote port " + port + " out of range 1-65535");
    }
  }

  private static int toPort(String text, String original) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      throw new TunnelException(TunnelException.Reason.INVALID_PORT,
          "invalid port in mapping " + original + ": " + text, e);
    }
  }

  @Override
  public String toString() {
    return localPort + ":" + remotePort;
  }
}
