package io.clusterhive.cluster.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.clusterhive.cluster.ClusterContextException;
import io.clusterhive.cluster.ClusterContextException.Reason;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the multi-context kubeconfig layout and rewrites its {@code current-context} marker.
 */
public class KubeConfigParser {

  private static final Logger log = LoggerFactory.getLogger(KubeConfigParser.class);

  static final String DEFAULT_NAMESPACE = "default";

  private static final Pattern CURRENT_CONTEXT_LINE =
      Pattern.compile("^current-context:[^\\r\\n]*", Pattern.MULTILINE);
  private static final Pattern JSON_CURRENT_CONTEXT =
      Pattern.compile("\"current-context\"\\s*:\\s*(?:\"(?:[^\"\\\\]|\\\\.)*\"|null)");
  private static final Pattern PLAIN_SCALAR = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._@/+:-]*");

  private final ObjectMapper yamlMapper;
  private final ObjectMapper jsonMapper;

  public KubeConfigParser() {
    this.yamlMapper = new ObjectMapper(new YAMLFactory());
    this.jsonMapper = new ObjectMapper();
  }

  public KubeConfigFile parse(Path path) {
    String content = read(path);
    if (content.isBlank()) {
      return new KubeConfigFile(path, null, List.of());
    }
    KubeConfigDocument document;
    try {
      document = yamlMapper.readValue(content, KubeConfigDocument.class);
    } catch (JsonProcessingException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_MALFORMED,
          "error parsing kubeconfig " + path + ": " + e.getOriginalMessage(), e);
    }
    if (document == null) {
      return new KubeConfigFile(path, null, List.of());
    }

    Map<String, String> servers = new HashMap<>();
    if (document.clusters() != null) {
      for (KubeConfigDocument.NamedCluster cluster : document.clusters()) {
        if (cluster != null && cluster.name() != null) {
          servers.put(cluster.name(), cluster.cluster() == null ? null : cluster.cluster().server());
        }
      }
    }

    List<KubeConfigContext> contexts = new ArrayList<>();
    if (document.contexts() != null) {
      for (KubeConfigDocument.NamedContext named : document.contexts()) {
        if (named == null || named.name() == null || named.context() == null) {
          continue;
        }
        KubeConfigDocument.Context context = named.context();
        if (!servers.containsKey(context.cluster())) {
          log.debug("skipping context {} in {}: cluster {} is not defined",
              named.name(), path, context.cluster());
          continue;
        }
        contexts.add(new KubeConfigContext(
            named.name(),
            context.cluster(),
            context.user(),
            hasText(context.namespace()) ? context.namespace() : DEFAULT_NAMESPACE,
            servers.get(context.cluster())));
      }
    }
    return new KubeConfigFile(path, document.currentContext(), contexts);
  }

  /**
   * Replaces the top-level {@code current-context} value in place. Every other byte of the file is
   * kept as it was; a missing marker is added. Block-style YAML and JSON documents are supported.
   *
   * @throws IOException when the file cannot be read, written, or has a layout the marker cannot be
   *     placed into
   */
  public void writeCurrentContext(Path path, String contextName) throws IOException {
    String content = Files.readString(path, StandardCharsets.UTF_8);
    String updated = isJsonObject(content)
        ? withJsonCurrentContext(path, content, contextName)
        : withYamlCurrentContext(content, contextName);
    replace(path, updated);
  }

  private static String withYamlCurrentContext(String content, String contextName) {
    String line = "current-context: " + scalar(contextName);
    Matcher matcher = CURRENT_CONTEXT_LINE.matcher(content);
    if (matcher.find()) {
      return content.substring(0, matcher.start()) + line + content.substring(matcher.end());
    }
    String newline = content.contains("\r\n") ? "\r\n" : "\n";
    String separator = content.isEmpty() || content.endsWith("\n") ? "" : newline;
    return content + separator + line + newline;
  }

  private String withJsonCurrentContext(Path path, String content, String contextName) throws IOException {
    String member = "\"current-context\": " + jsonMapper.writeValueAsString(contextName);
    Matcher matcher = JSON_CURRENT_CONTEXT.matcher(content);
    if (matcher.find()) {
      return content.substring(0, matcher.start()) + member + content.substring(matcher.end());
    }
    int open = content.indexOf('{');
    int next = open + 1;
    while (next < content.length() && Character.isWhitespace(content.charAt(next))) {
      next++;
    }
    if (next >= content.length()) {
      throw new IOException("kubeconfig " + path + " is not a complete JSON object");
    }
    String separator = content.charAt(next) == '}' ? "" : ", ";
    return content.substring(0, open + 1) + member + separator + content.substring(open + 1);
  }

  private static boolean isJsonObject(String content) {
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      if (c == '\uFEFF' || Character.isWhitespace(c)) {
        continue;
      }
      return c == '{';
    }
    return false;
  }

  private static void replace(Path path, String content) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    Path temp = Files.createTempFile(parent, ".kubeconfig-", ".tmp");
    try {
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      copyPermissions(path, temp);
      try {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static void copyPermissions(Path source, Path target) throws IOException {
    try {
      Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(source);
      Files.setPosixFilePermissions(target, permissions);
    } catch (UnsupportedOperationException e) {
      log.debug("POSIX permissions not supported for {}", source);
    }
  }

  private static String scalar(String value) {
    if (PLAIN_SCALAR.matcher(value).matches() && !value.endsWith(":")) {
      return value;
    }
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private static String read(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ClusterContextException(Reason.CREDENTIAL_UNREADABLE,
          "error reading kubeconfig file " + path, e);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
