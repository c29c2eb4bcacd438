package io.clusterhive.cluster;

import java.util.Objects;

/**
 * Raised when a context or connection operation is rejected.
 * <p>
 * Every failure leaves the registry in its previous state, except {@link Reason#PERSIST_FAILED},
 * which is reported after the in-memory switch has already happened.
 */
public class ClusterContextException extends RuntimeException {

  public enum Category {
    INPUT_VALIDATION,
    RESOURCE_ACCESS,
    CONNECTIVITY,
    NOT_FOUND,
    CONFLICT,
    PARTIAL_FAILURE
  }

  public enum Reason {
    EMPTY_IDENTIFIER(Category.INPUT_VALIDATION),
    SAME_NAME(Category.INPUT_VALIDATION),
    NO_CREDENTIAL_SOURCE(Category.RESOURCE_ACCESS),
    CREDENTIAL_NOT_FOUND(Category.RESOURCE_ACCESS),
    CREDENTIAL_IS_DIRECTORY(Category.RESOURCE_ACCESS),
    CREDENTIAL_UNREADABLE(Category.RESOURCE_ACCESS),
    CREDENTIAL_MALFORMED(Category.RESOURCE_ACCESS),
    CONNECTION_UNREACHABLE(Category.CONNECTIVITY),
    CONTEXT_NOT_FOUND(Category.NOT_FOUND),
    CONTEXT_NOT_FOUND_IN_CREDENTIAL(Category.NOT_FOUND),
    NO_CONNECTIONS_CONFIGURED(Category.NOT_FOUND),
    NO_CLIENTS_AVAILABLE(Category.NOT_FOUND),
    KUBECONFIG_PATH_MISSING(Category.NOT_FOUND),
    DUPLICATE_CONTEXT(Category.CONFLICT),
    PERSIST_FAILED(Category.PARTIAL_FAILURE);

    private final Category category;

    Reason(Category category) {
      this.category = category;
    }

    public Category category() {
      return category;
    }
  }

  private final Reason reason;

  public ClusterContextException(Reason reason, String message) {
    this(reason, message, null);
  }

  public ClusterContextException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }

  public Category category() {
    return reason.category();
  }
}
