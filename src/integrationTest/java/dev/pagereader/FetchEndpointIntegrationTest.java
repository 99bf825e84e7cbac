package dev.pagereader;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Boots the whole application on a random port and drives {@code POST /fetch} against pages
 * served by an in-process HTTP server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class FetchEndpointIntegrationTest {

  private static final String ARTICLE =
      "<html><head><title>Integration Page</title><script>var x = 1;</script></head>"
          + "<body><nav>Menu</nav><main><h1>Integration Page</h1>"
          + "<p>Body with <a href=\"/next\">a link</a>.</p></main></body></html>";

  private static HttpServer server;
  private static String base;

  @Autowired private TestRestTemplate rest;

  @BeforeAll
  static void startTarget() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/article",
        exchange -> {
          byte[] body = ARTICLE.getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.createContext(
        "/gone",
        exchange -> {
          exchange.sendResponseHeaders(410, -1);
          exchange.close();
        });
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(4_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.sendResponseHeaders(200, -1);
          exchange.close();
        });
    server.setExecutor(Executors.newCachedThreadPool());
    server.start();
    base = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterAll
  static void stopTarget() {
    server.stop(0);
  }

  @Test
  void healthReportsOk() {
    ResponseEntity<JsonNode> response = rest.getForEntity("/health", JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().path("status").asText()).isEqualTo("ok");
  }

  @Test
  void mixedBatchReturnsOneOrderedResultPerUrl() {
    Map<String, Object> request =
        Map.of(
            "urls", List.of(base + "/slow", base + "/article", base + "/gone"),
            "timeout", 1,
            "concurrency", 3);

    ResponseEntity<JsonNode> response = rest.postForEntity("/fetch", request, JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode body = response.getBody();
    assertThat(body.path("total").asInt()).isEqualTo(3);
    assertThat(body.path("concurrency").asInt()).isEqualTo(3);
    assertThat(body.has("elapsed_ms")).isTrue();

    JsonNode slow = body.path("results").get(0);
    assertThat(slow.path("url").asText()).isEqualTo(base + "/slow");
    assertThat(slow.path("ok").asBoolean()).isFalse();
    assertThat(slow.path("status_code").isNull()).isTrue();
    assertThat(slow.path("error").asText()).startsWith("timeout");

    JsonNode article = body.path("results").get(1);
    assertThat(article.path("ok").asBoolean()).isTrue();
    assertThat(article.path("status_code").asInt()).isEqualTo(200);
    assertThat(article.path("charset").asText()).isEqualToIgnoringCase("utf-8");
    assertThat(article.path("content").asText())
        .startsWith("# Integration Page")
        .contains("[a link](" + base + "/next)")
        .doesNotContain("var x")
        .doesNotContain("Menu");

    JsonNode gone = body.path("results").get(2);
    assertThat(gone.path("ok").asBoolean()).isFalse();
    assertThat(gone.path("status_code").asInt()).isEqualTo(410);
    assertThat(gone.path("content").isNull()).isTrue();
    assertThat(gone.path("error").asText()).contains("410");
  }

  @Test
  void plainTextModeReturnsText() {
    Map<String, Object> request =
        Map.of("urls", List.of(base + "/article"), "to_markdown", false);

    JsonNode body = rest.postForObject("/fetch", request, JsonNode.class);

    String content = body.path("results").get(0).path("content").asText();
    assertThat(content).contains("Integration Page").contains("a link").doesNotContain("#");
  }

  @Test
  void oversizedBatchIsRejected() {
    List<String> urls =
        IntStream.range(0, 65).mapToObj(i -> base + "/article?" + i).toList();

    ResponseEntity<JsonNode> response =
        rest.postForEntity("/fetch", Map.of("urls", urls), JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
