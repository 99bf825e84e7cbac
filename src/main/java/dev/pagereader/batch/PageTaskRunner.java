package dev.pagereader.batch;

import dev.pagereader.extract.ExtractionException;
import dev.pagereader.extract.ExtractorSelector;
import dev.pagereader.extract.HtmlDecoder;
import dev.pagereader.extract.ParsedPage;
import dev.pagereader.fetch.FetchException;
import dev.pagereader.fetch.FetchFailureKind;
import dev.pagereader.fetch.FetchProperties;
import dev.pagereader.fetch.FetchedPage;
import dev.pagereader.fetch.PageFetcher;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one URL from fetch to a terminal {@link FetchOutcome}.
 *
 * <p>Every failure is caught here and recorded on the outcome; {@link #run} never throws. A
 * transport failure leaves {@code status_code} null, while a non-2xx answer or an extraction
 * failure keeps the status code of the response that was received.
 */
@Component
public class PageTaskRunner {

  private static final Logger log = LoggerFactory.getLogger(PageTaskRunner.class);

  private final PageFetcher fetcher;
  private final HtmlDecoder decoder;
  private final ExtractorSelector extractors;
  private final FetchProperties props;

  public PageTaskRunner(
      PageFetcher fetcher,
      HtmlDecoder decoder,
      ExtractorSelector extractors,
      FetchProperties props) {
    this.fetcher = fetcher;
    this.decoder = decoder;
    this.extractors = extractors;
    this.props = props;
  }

  /**
   * Fetch and extract one URL.
   *
   * @param url the requested URL
   * @param timeout fetch budget for this URL alone
   * @param toMarkdown whether to render Markdown instead of plain text
   * @return the terminal outcome, never null
   */
  public FetchOutcome run(String url, Duration timeout, boolean toMarkdown) {
    long started = System.nanoTime();
    log.debug("{} -> {}", TaskState.FETCHING, url);

    FetchedPage page;
    try {
      page = fetcher.fetch(url, timeout);
    } catch (FetchException e) {
      log.warn("Fetch failed for {}: {}", url, e.describe());
      return FetchOutcome.fetchFailed(url, e.describe(), elapsedMs(started));
    } catch (RuntimeException e) {
      log.warn("Unexpected error while fetching {}", url, e);
      return FetchOutcome.fetchFailed(
          url,
          FetchFailureKind.OTHER_TRANSPORT_ERROR.label() + ": " + e.getMessage(),
          elapsedMs(started));
    }

    if (!page.isSuccessful()) {
      log.warn("HTTP {} for {}", page.statusCode(), url);
      return FetchOutcome.non2xx(
          url,
          page.statusCode(),
          page.declaredCharset(),
          page.bytesDownloaded(),
          elapsedMs(started));
    }

    log.debug("{} -> {}", TaskState.EXTRACTING, url);
    if (!props.isAllowedContentType(page.contentType())) {
      log.warn("Unsupported content type {} for {}", page.contentType(), url);
      return FetchOutcome.extractFailed(
          url,
          page.statusCode(),
          page.declaredCharset(),
          "extract-failed: unsupported content type: " + page.contentType(),
          page.bytesDownloaded(),
          elapsedMs(started));
    }

    String charset = page.declaredCharset();
    try {
      ParsedPage parsed = decoder.decode(page);
      charset = parsed.charset();
      String content = extractors.select(toMarkdown, url).extract(parsed.document(), url);
      FetchOutcome outcome =
          FetchOutcome.done(
              url, page.statusCode(), charset, content, page.bytesDownloaded(), elapsedMs(started));
      log.debug("{} -> {} in {} ms", TaskState.DONE, url, outcome.elapsedMs());
      return outcome;
    } catch (ExtractionException e) {
      log.warn("Extraction failed for {}: {}", url, e.getMessage());
      return FetchOutcome.extractFailed(
          url,
          page.statusCode(),
          charset,
          "extract-failed: " + e.getMessage(),
          page.bytesDownloaded(),
          elapsedMs(started));
    } catch (RuntimeException e) {
      log.warn("Unexpected error while extracting {}", url, e);
      return FetchOutcome.extractFailed(
          url,
          page.statusCode(),
          charset,
          "extract-failed: " + e.getMessage(),
          page.bytesDownloaded(),
          elapsedMs(started));
    } catch (StackOverflowError e) {
      // Markdown conversion recurses per element; pathological nesting exhausts the stack.
      log.warn("Document for {} is nested too deeply to convert", url);
      return FetchOutcome.extractFailed(
          url,
          page.statusCode(),
          charset,
          "extract-failed: document is nested too deeply to convert",
          page.bytesDownloaded(),
          elapsedMs(started));
    }
  }

  private static long elapsedMs(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
