package dev.pagereader.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class FetchPropertiesTest {

  private static FetchProperties with(int defaultConcurrency, int maxConcurrency, double timeout) {
    return new FetchProperties(
        defaultConcurrency, maxConcurrency, 64, timeout, 10_000, 10, 1024, "ua", "en", null);
  }

  @Test
  void defaultsMatchDocumentedValues() {
    FetchProperties props = FetchProperties.defaults();

    assertThat(props.defaultConcurrency()).isEqualTo(10);
    assertThat(props.maxConcurrency()).isEqualTo(64);
    assertThat(props.maxUrls()).isEqualTo(64);
    assertThat(props.defaultTimeoutSeconds()).isEqualTo(15);
    assertThat(props.allowedContentTypes()).containsExactly("text", "html", "xml");
  }

  @Test
  void maxConcurrencyBelowDefaultFailsStartup() {
    assertThatThrownBy(() -> with(10, 5, 15))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("max-concurrency");
  }

  @Test
  void defaultTimeoutOutsideAllowedRangeFailsStartup() {
    assertThatThrownBy(() -> with(10, 64, 90))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("default-timeout-seconds");
  }

  @Test
  void contentTypeKeywordsAreNormalized() {
    FetchProperties props =
        new FetchProperties(
            10, 64, 64, 15, 10_000, 10, 1024, "ua", "en", List.of(" HTML ", "", "xml"));

    assertThat(props.allowedContentTypes()).containsExactly("html", "xml");
  }

  @Test
  void contentTypeGate() {
    FetchProperties props = FetchProperties.defaults();

    assertThat(props.isAllowedContentType("text/html; charset=utf-8")).isTrue();
    assertThat(props.isAllowedContentType("application/xhtml+xml")).isTrue();
    assertThat(props.isAllowedContentType(null)).isTrue();
    assertThat(props.isAllowedContentType("image/png")).isFalse();
    assertThat(props.isAllowedContentType("application/pdf")).isFalse();
  }

  @Test
  void contentTypeGateIgnoresDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      FetchProperties props =
          new FetchProperties(10, 64, 64, 15, 10_000, 10, 1024, "ua", "en", List.of("PLAIN"));

      assertThat(props.allowedContentTypes()).containsExactly("plain");
      assertThat(props.isAllowedContentType("TEXT/PLAIN")).isTrue();
    } finally {
      Locale.setDefault(previous);
    }
  }
}
