package dev.pagereader.batch;

import dev.pagereader.fetch.FetchProperties;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Builds {@link FetchRequest}s from raw caller input, filling defaults from {@link
 * FetchProperties} and rejecting anything out of range before a single URL is dispatched.
 * Out-of-range values are rejected, never clamped.
 */
@Component
public class FetchRequestFactory {

  private final FetchProperties props;

  public FetchRequestFactory(FetchProperties props) {
    this.props = props;
  }

  /**
   * Validate caller input and build a request.
   *
   * @param urls URLs to fetch (1..max-urls absolute URLs)
   * @param timeout per-URL timeout in seconds, or null for the configured default
   * @param concurrency requested concurrency, or null for the configured default
   * @param toMarkdown Markdown flag, or null for true
   * @return the validated request
   * @throws IllegalArgumentException describing the first violated constraint
   */
  public FetchRequest create(
      @Nullable List<String> urls,
      @Nullable Double timeout,
      @Nullable Integer concurrency,
      @Nullable Boolean toMarkdown) {
    if (urls == null || urls.isEmpty()) {
      throw new IllegalArgumentException("urls must contain at least one URL");
    }
    if (urls.size() > props.maxUrls()) {
      throw new IllegalArgumentException(
          "urls cannot contain more than " + props.maxUrls() + " items, got " + urls.size());
    }
    List<String> checked = new ArrayList<>(urls.size());
    for (String url : urls) {
      checked.add(requireAbsolute(url));
    }

    double timeoutSeconds = timeout == null ? props.defaultTimeoutSeconds() : timeout;
    if (Double.isNaN(timeoutSeconds)
        || timeoutSeconds < FetchProperties.MIN_TIMEOUT_SECONDS
        || timeoutSeconds > FetchProperties.MAX_TIMEOUT_SECONDS) {
      throw new IllegalArgumentException("timeout must be between 1 and 60 seconds");
    }

    int requested = concurrency == null ? props.defaultConcurrency() : concurrency;
    if (requested < 1 || requested > props.maxConcurrency()) {
      throw new IllegalArgumentException(
          "concurrency must be between 1 and " + props.maxConcurrency());
    }

    return new FetchRequest(
        checked, timeoutSeconds, requested, toMarkdown == null || toMarkdown);
  }

  private static String requireAbsolute(@Nullable String url) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Invalid URL provided: " + url);
    }
    try {
      URI uri = new URI(url.trim());
      if (uri.getScheme() == null || uri.getRawAuthority() == null) {
        throw new IllegalArgumentException("Invalid URL provided: " + url);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URL provided: " + url, e);
    }
    return url;
  }
}
