package dev.pagereader.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Successful transport result for one URL: whatever status the server answered with, plus the raw
 * body. The body may be truncated to the configured limit; {@code bytesDownloaded} always reports
 * the full size received.
 *
 * @param requestedUrl the URL the caller asked for
 * @param finalUrl the URL that produced this response after redirects
 * @param statusCode HTTP status code of the final response
 * @param contentType raw {@code Content-Type} header, if any
 * @param declaredCharset supported charset named by the {@code Content-Type} header, if any
 * @param body response body, possibly truncated
 * @param bytesDownloaded number of body bytes received before truncation
 */
public record FetchedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    @Nullable String contentType,
    @Nullable String declaredCharset,
    byte[] body,
    long bytesDownloaded) {

  public FetchedPage {
    body = body == null ? new byte[0] : body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
