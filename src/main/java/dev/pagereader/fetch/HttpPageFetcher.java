package dev.pagereader.fetch;

import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * {@link PageFetcher} backed by the JDK {@link HttpClient}.
 *
 * <p>Redirects are followed by hand so that every hop draws from the same deadline and the hop
 * count can be classified. The underlying client must be configured with {@link
 * HttpClient.Redirect#NEVER}.
 */
@Component
public class HttpPageFetcher implements PageFetcher {

  private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

  private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);

  private static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  private final HttpClient httpClient;
  private final FetchProperties props;

  public HttpPageFetcher(HttpClient httpClient, FetchProperties props) {
    this.httpClient = httpClient;
    this.props = props;
  }

  @Override
  public FetchedPage fetch(String url, Duration timeout) throws FetchException {
    long deadline = System.nanoTime() + timeout.toNanos();
    URI current = parseHttpUri(url);

    for (int hop = 0; ; hop++) {
      HttpResponse<BoundedBodySubscriber.Body> response = send(current, deadline, timeout);
      int status = response.statusCode();
      Optional<String> location = response.headers().firstValue(HttpHeaders.LOCATION);

      if (!REDIRECT_CODES.contains(status) || location.isEmpty()) {
        return toFetchedPage(url, current, response);
      }
      if (hop >= props.maxRedirects()) {
        throw new FetchException(
            FetchFailureKind.TOO_MANY_REDIRECTS,
            "exceeded " + props.maxRedirects() + " redirects starting at " + url);
      }
      URI next = resolveRedirect(current, location.get());
      log.debug("Redirect {} -> {} ({} from {})", current, next, status, url);
      current = next;
    }
  }

  private HttpResponse<BoundedBodySubscriber.Body> send(
      URI uri, long deadline, Duration budget)
      throws FetchException {
    long remainingNanos = deadline - System.nanoTime();
    if (remainingNanos <= 0) {
      throw timeout(budget);
    }
    Duration remaining = Duration.ofNanos(remainingNanos);

    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder(uri)
              .GET()
              .timeout(remaining)
              .header(HttpHeaders.USER_AGENT, props.userAgent())
              .header(HttpHeaders.ACCEPT, ACCEPT)
              .header(HttpHeaders.ACCEPT_LANGUAGE, props.acceptLanguage())
              .build();
    } catch (IllegalArgumentException e) {
      throw new FetchException(FetchFailureKind.INVALID_URL, e.getMessage(), e);
    }

    CompletableFuture<HttpResponse<BoundedBodySubscriber.Body>> future =
        httpClient.sendAsync(request, BoundedBodySubscriber.handler(props.maxBodyBytes()));
    try {
      return future.get(remainingNanos, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw timeout(budget);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new FetchException(FetchFailureKind.OTHER_TRANSPORT_ERROR, "interrupted", e);
    } catch (ExecutionException e) {
      throw classify(e.getCause() != null ? e.getCause() : e, budget);
    }
  }

  private FetchedPage toFetchedPage(
      String requestedUrl, URI finalUri, HttpResponse<BoundedBodySubscriber.Body> response) {
    BoundedBodySubscriber.Body body = response.body();
    if (body.received() > body.bytes().length) {
      log.debug(
          "Truncated body of {} to {} of {} bytes",
          finalUri,
          body.bytes().length,
          body.received());
    }
    String contentType = response.headers().firstValue(HttpHeaders.CONTENT_TYPE).orElse(null);
    Charset declared = CharsetNames.fromContentType(contentType);
    return new FetchedPage(
        requestedUrl,
        finalUri.toString(),
        response.statusCode(),
        contentType,
        declared == null ? null : declared.name(),
        body.bytes(),
        body.received());
  }

  static URI parseHttpUri(String url) throws FetchException {
    if (url == null || url.isBlank()) {
      throw new FetchException(FetchFailureKind.INVALID_URL, "URL is empty");
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw new FetchException(FetchFailureKind.INVALID_URL, e.getMessage(), e);
    }
    return requireHttp(uri, url);
  }

  private static URI resolveRedirect(URI current, String location) throws FetchException {
    URI target;
    try {
      target = current.resolve(new URI(location.trim()));
    } catch (URISyntaxException | IllegalArgumentException e) {
      throw new FetchException(
          FetchFailureKind.INVALID_URL, "malformed redirect location: " + location, e);
    }
    return requireHttp(target, location);
  }

  private static URI requireHttp(URI uri, String original) throws FetchException {
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new FetchException(FetchFailureKind.INVALID_URL, "not an http(s) URL: " + original);
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new FetchException(FetchFailureKind.INVALID_URL, "URL has no host: " + original);
    }
    return uri;
  }

  private static FetchException timeout(Duration budget) {
    return new FetchException(
        FetchFailureKind.TIMEOUT, "no complete response within " + budget.toMillis() + " ms");
  }

  private static FetchException classify(Throwable cause, Duration budget) {
    if (cause instanceof HttpConnectTimeoutException) {
      return new FetchException(
          FetchFailureKind.TIMEOUT, "connect timed out: " + cause.getMessage(), cause);
    }
    if (cause instanceof HttpTimeoutException) {
      return new FetchException(
          FetchFailureKind.TIMEOUT,
          "no complete response within " + budget.toMillis() + " ms",
          cause);
    }
    if (cause instanceof ConnectException
        || cause instanceof UnknownHostException
        || cause instanceof UnresolvedAddressException
        || cause.getCause() instanceof UnresolvedAddressException) {
      return new FetchException(FetchFailureKind.CONNECTION_ERROR, describe(cause), cause);
    }
    if (cause instanceof IllegalArgumentException) {
      return new FetchException(FetchFailureKind.INVALID_URL, describe(cause), cause);
    }
    return new FetchException(FetchFailureKind.OTHER_TRANSPORT_ERROR, describe(cause), cause);
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
