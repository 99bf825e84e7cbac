package dev.pagereader.fetch;

/**
 * Raised by a {@link PageFetcher} when no HTTP response could be obtained for a URL. Non-2xx
 * responses are not failures of the fetcher and never surface as this exception.
 */
public class FetchException extends Exception {

  private final FetchFailureKind kind;

  public FetchException(FetchFailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FetchException(FetchFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public FetchFailureKind kind() {
    return kind;
  }

  /** Human-readable description prefixed with the failure kind, e.g. {@code timeout: ...}. */
  public String describe() {
    return kind.label() + ": " + getMessage();
  }
}
