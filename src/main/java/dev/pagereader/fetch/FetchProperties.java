package dev.pagereader.fetch;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised fetch configuration, bound once at startup from {@code pagereader.fetch.*}.
 *
 * <p>Every property can be overridden from the environment through relaxed binding, e.g. {@code
 * PAGEREADER_FETCH_MAX_CONCURRENCY=32}. The bounds defined here are the ones enforced when a batch
 * request is accepted.
 *
 * @param defaultConcurrency concurrency used when a request does not specify one
 * @param maxConcurrency highest concurrency a request may ask for
 * @param maxUrls highest number of URLs per batch
 * @param defaultTimeoutSeconds per-URL timeout used when a request does not specify one
 * @param connectTimeoutMs cap on the TCP connect phase
 * @param maxRedirects redirect hops followed within one timeout budget
 * @param maxBodyBytes bytes handed to extraction; longer bodies are truncated
 * @param userAgent {@code User-Agent} header sent with every request
 * @param acceptLanguage {@code Accept-Language} header sent with every request
 * @param allowedContentTypes content-type keywords accepted for extraction
 */
@ConfigurationProperties(prefix = "pagereader.fetch")
public record FetchProperties(
    @DefaultValue("10") int defaultConcurrency,
    @DefaultValue("64") int maxConcurrency,
    @DefaultValue("64") int maxUrls,
    @DefaultValue("15") double defaultTimeoutSeconds,
    @DefaultValue("10000") int connectTimeoutMs,
    @DefaultValue("10") int maxRedirects,
    @DefaultValue("5242880") int maxBodyBytes,
    @DefaultValue("Mozilla/5.0 (compatible; PageReader/1.0)") String userAgent,
    @DefaultValue("en-US,en;q=0.5") String acceptLanguage,
    @DefaultValue({"text", "html", "xml"}) List<String> allowedContentTypes) {

  /** Smallest timeout a request may ask for, in seconds. */
  public static final double MIN_TIMEOUT_SECONDS = 1.0;

  /** Largest timeout a request may ask for, in seconds. */
  public static final double MAX_TIMEOUT_SECONDS = 60.0;

  public FetchProperties {
    if (defaultConcurrency < 1) {
      throw new IllegalStateException(
          "pagereader.fetch.default-concurrency must be at least 1, got: " + defaultConcurrency);
    }
    if (maxConcurrency < defaultConcurrency) {
      throw new IllegalStateException(
          "pagereader.fetch.max-concurrency must be >= default-concurrency ("
              + defaultConcurrency
              + "), got: "
              + maxConcurrency);
    }
    if (maxUrls < 1) {
      throw new IllegalStateException("pagereader.fetch.max-urls must be at least 1, got: " + maxUrls);
    }
    if (defaultTimeoutSeconds < MIN_TIMEOUT_SECONDS || defaultTimeoutSeconds > MAX_TIMEOUT_SECONDS) {
      throw new IllegalStateException(
          "pagereader.fetch.default-timeout-seconds must be in [1, 60], got: "
              + defaultTimeoutSeconds);
    }
    if (connectTimeoutMs < 1) {
      throw new IllegalStateException(
          "pagereader.fetch.connect-timeout-ms must be positive, got: " + connectTimeoutMs);
    }
    if (maxRedirects < 0) {
      throw new IllegalStateException(
          "pagereader.fetch.max-redirects must not be negative, got: " + maxRedirects);
    }
    if (maxBodyBytes < 1) {
      throw new IllegalStateException(
          "pagereader.fetch.max-body-bytes must be positive, got: " + maxBodyBytes);
    }
    allowedContentTypes =
        allowedContentTypes == null
            ? List.of()
            : allowedContentTypes.stream()
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
  }

  /** Defaults identical to an empty {@code application.yml}; handy for tests and tools. */
  public static FetchProperties defaults() {
    return new FetchProperties(
        10,
        64,
        64,
        15,
        10_000,
        10,
        5 * 1024 * 1024,
        "Mozilla/5.0 (compatible; PageReader/1.0)",
        "en-US,en;q=0.5",
        List.of("text", "html", "xml"));
  }

  public Duration connectTimeout() {
    return Duration.ofMillis(connectTimeoutMs);
  }

  /**
   * Whether a response {@code Content-Type} may be handed to extraction. A missing header is
   * accepted and sniffed as HTML.
   */
  public boolean isAllowedContentType(@Nullable String contentType) {
    if (contentType == null || contentType.isBlank() || allowedContentTypes.isEmpty()) {
      return true;
    }
    String lower = contentType.toLowerCase(Locale.ROOT);
    return allowedContentTypes.stream().anyMatch(lower::contains);
  }
}
