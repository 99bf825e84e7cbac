package dev.pagereader.config;

import dev.pagereader.fetch.FetchProperties;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the shared JDK {@link HttpClient} used for page fetches.
 *
 * <p>The connect timeout comes from {@code pagereader.fetch.connect-timeout-ms}; the per-request
 * deadline is applied by the fetcher. Redirects are disabled here because the fetcher follows them
 * itself within the request's timeout budget.
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public HttpClient pageHttpClient(FetchProperties props) {
    return HttpClient.newBuilder()
        .connectTimeout(props.connectTimeout())
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }
}
