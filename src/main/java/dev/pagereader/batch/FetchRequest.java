package dev.pagereader.batch;

import java.time.Duration;
import java.util.List;

/**
 * A validated, immutable batch request. Instances come from {@link FetchRequestFactory}, which
 * applies defaults and rejects out-of-range values.
 *
 * @param urls URLs to fetch, in the order results must be returned
 * @param timeoutSeconds per-URL fetch timeout
 * @param concurrency requested number of simultaneously active URLs
 * @param toMarkdown whether content is rendered as Markdown instead of plain text
 */
public record FetchRequest(
    List<String> urls, double timeoutSeconds, int concurrency, boolean toMarkdown) {

  public FetchRequest {
    if (urls == null || urls.isEmpty()) {
      throw new IllegalArgumentException("urls must contain at least one URL");
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1");
    }
    if (!(timeoutSeconds > 0)) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    urls = List.copyOf(urls);
  }

  public Duration timeout() {
    return Duration.ofMillis(Math.round(timeoutSeconds * 1000));
  }

  /** Number of worker slots actually needed: never more than there are URLs. */
  public int effectiveConcurrency() {
    return Math.min(concurrency, urls.size());
  }
}
