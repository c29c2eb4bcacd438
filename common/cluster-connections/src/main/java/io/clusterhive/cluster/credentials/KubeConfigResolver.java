package io.clusterhive.cluster.credentials;

import io.clusterhive.cluster.ClusterContextException;
import io.clusterhive.cluster.ClusterContextException.Reason;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Turns a raw kubeconfig location into a validated, absolute file path.
 * <p>
 * A blank location falls back to the first entry of {@code KUBECONFIG} and then to
 * {@code ~/.kube/config}. Format parsing is left to {@link KubeConfigParser}.
 */
public class KubeConfigResolver {

  static final String KUBECONFIG_ENV = "KUBECONFIG";

  private final Function<String, String> environment;
  private final Supplier<String> homeDirectory;

  public KubeConfigResolver() {
    this(System::getenv, () -> System.getProperty("user.home"));
  }

  public KubeConfigResolver(Function<String, String> environment, Supplier<String> homeDirectory) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory");
  }

  public Path resolve(String rawPath) {
    String location = hasText(rawPath) ? rawPath.trim() : defaultLocation();
    Path path = toAbsolute(expandHome(location));
    validate(path);
    return path;
  }

  private String defaultLocation() {
    String fromEnv = environment.apply(KUBECONFIG_ENV);
    if (hasText(fromEnv)) {
      for (String candidate : fromEnv.split(File.pathSeparator)) {
        if (hasText(candidate)) {
          return candidate.trim();
        }
      }
    }
    String home = homeDirectory.get();
    if (!hasText(home)) {
      throw new ClusterContextException(Reason.NO_CREDENTIAL_SOURCE,
          "kubeconfig path not provided and home directory not found");
    }
    return Path.of(home, ".kube", "config").toString();
  }

  private String expandHome(String location) {
    if (location.equals("~") || location.startsWith("~/")) {
      String home = homeDirectory.get();
      if (!hasText(home)) {
        throw new ClusterContextException(Reason.NO_CREDENTIAL_SOURCE,
            "Cannot expand " + location + " because the home directory is unknown");
      }
      return home + location.substring(1);
    }
    return location;
  }

  private static Path toAbsolute(String location) {
    try {
      return Path.of(location).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_NOT_FOUND,
          "Invalid kubeconfig path: " + location, e);
    }
  }

  private static void validate(Path path) {
    if (!Files.exists(path)) {
      throw new ClusterContextException(Reason.CREDENTIAL_NOT_FOUND,
          "kubeconfig file not found: " + path);
    }
    if (Files.isDirectory(path)) {
      throw new ClusterContextException(Reason.CREDENTIAL_IS_DIRECTORY,
          "the provided path is a directory, not a file: " + path);
    }
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new ClusterContextException(Reason.CREDENTIAL_UNREADABLE,
          "kubeconfig file is not readable: " + path);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
