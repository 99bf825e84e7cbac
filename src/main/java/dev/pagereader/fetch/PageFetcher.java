package dev.pagereader.fetch;

import java.time.Duration;

/** Retrieves one URL with a single HTTP GET under a deadline. */
public interface PageFetcher {

  /**
   * Fetch a URL. One timeout budget covers connecting, redirects and reading the body.
   *
   * @param url absolute http(s) URL
   * @param timeout total time allowed for this fetch
   * @return the final response, whatever its status code
   * @throws FetchException if no response could be obtained
   */
  FetchedPage fetch(String url, Duration timeout) throws FetchException;
}
