package dev.pagereader.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Result for one URL of a batch. Exactly one outcome is produced per requested URL.
 *
 * @param url the requested URL, echoed unchanged
 * @param ok true only when content was produced
 * @param statusCode HTTP status, null when the server was never reached
 * @param charset charset the body was (or would have been) decoded with
 * @param content plain text or Markdown, null unless {@code ok}
 * @param error failure description prefixed with its kind, null when {@code ok}
 * @param bytesDownloaded body size received, null when the server was never reached
 * @param elapsedMs wall time spent on this URL
 * @param state terminal task state, not serialized
 */
public record FetchOutcome(
    String url,
    boolean ok,
    @JsonProperty("status_code") @Nullable Integer statusCode,
    @Nullable String charset,
    @Nullable String content,
    @Nullable String error,
    @JsonProperty("bytes_downloaded") @Nullable Long bytesDownloaded,
    @JsonProperty("elapsed_ms") long elapsedMs,
    @JsonIgnore TaskState state) {

  static FetchOutcome done(
      String url, int statusCode, String charset, String content, long bytes, long elapsedMs) {
    return new FetchOutcome(
        url, true, statusCode, charset, content, null, bytes, elapsedMs, TaskState.DONE);
  }

  static FetchOutcome fetchFailed(String url, String error, long elapsedMs) {
    return new FetchOutcome(
        url, false, null, null, null, error, null, elapsedMs, TaskState.FETCH_FAILED);
  }

  static FetchOutcome non2xx(
      String url, int statusCode, @Nullable String charset, long bytes, long elapsedMs) {
    return new FetchOutcome(
        url,
        false,
        statusCode,
        charset,
        null,
        "http-status: " + HttpStatusText.describe(statusCode),
        bytes,
        elapsedMs,
        TaskState.FETCHED_NON_2XX);
  }

  static FetchOutcome extractFailed(
      String url,
      int statusCode,
      @Nullable String charset,
      String error,
      long bytes,
      long elapsedMs) {
    return new FetchOutcome(
        url, false, statusCode, charset, null, error, bytes, elapsedMs, TaskState.EXTRACT_FAILED);
  }
}
