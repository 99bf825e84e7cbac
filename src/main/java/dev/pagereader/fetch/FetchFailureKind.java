package dev.pagereader.fetch;

/** Classification of transport-level fetch failures. */
public enum FetchFailureKind {
  TIMEOUT("timeout"),
  CONNECTION_ERROR("connection-error"),
  INVALID_URL("invalid-url"),
  TOO_MANY_REDIRECTS("too-many-redirects"),
  OTHER_TRANSPORT_ERROR("other-transport-error");

  private final String label;

  FetchFailureKind(String label) {
    this.label = label;
  }

  /** Stable lower-case label used as the prefix of outcome error strings. */
  public String label() {
    return label;
  }
}
