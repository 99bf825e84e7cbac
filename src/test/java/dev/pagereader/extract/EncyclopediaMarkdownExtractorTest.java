package dev.pagereader.extract;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pagereader.fixture.HtmlFixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EncyclopediaMarkdownExtractorTest {

  private static final String ARTICLE_URL = "https://en.wikipedia.org/wiki/Alan_Turing";

  private final MarkdownRenderer renderer = new MarkdownRenderer();
  private final GenericMarkdownExtractor generic = new GenericMarkdownExtractor(renderer);
  private final EncyclopediaMarkdownExtractor extractor =
      new EncyclopediaMarkdownExtractor(renderer, generic);

  @Nested
  class Matches {

    @Test
    void wikipedia_language_subdomain() {
      assertThat(EncyclopediaMarkdownExtractor.matches(ARTICLE_URL)).isTrue();
    }

    @Test
    void wikipedia_mobile_site() {
      assertThat(EncyclopediaMarkdownExtractor.matches("https://de.m.wikipedia.org/wiki/Berlin"))
          .isTrue();
    }

    @Test
    void bare_wikipedia_host() {
      assertThat(EncyclopediaMarkdownExtractor.matches("https://WIKIPEDIA.org/")).isTrue();
    }

    @Test
    void lookalike_host() {
      assertThat(EncyclopediaMarkdownExtractor.matches("https://notwikipedia.org/wiki/X")).isFalse();
    }

    @Test
    void wikipedia_only_in_path() {
      assertThat(EncyclopediaMarkdownExtractor.matches("https://example.com/wikipedia.org"))
          .isFalse();
    }

    @Test
    void malformed_url() {
      assertThat(EncyclopediaMarkdownExtractor.matches("https://exa mple.com/")).isFalse();
    }
  }

  @Nested
  class Extract {

    private String convertArticle() throws ExtractionException {
      Document document = Jsoup.parse(HtmlFixtures.load("wikipedia-article.html"), ARTICLE_URL);
      return extractor.extract(document, ARTICLE_URL);
    }

    @Test
    void titlesWithArticleNameNotBrowserTitle() throws Exception {
      String markdown = convertArticle();

      assertThat(markdown).startsWith("# Alan Turing\n\n");
      assertThat(markdown).doesNotContain("- Wikipedia");
    }

    @Test
    void keepsArticleBodyHeadingsAndLinks() throws Exception {
      String markdown = convertArticle();

      assertThat(markdown).contains("**Alan Mathison Turing**");
      assertThat(markdown).contains("## Early life");
      assertThat(markdown).contains("](https://en.wikipedia.org/wiki/Maida_Vale");
      assertThat(markdown).contains("](https://en.wikipedia.org/wiki/Computer_scientist");
    }

    @Test
    void stripsEditLinksCitationsAndReferenceLists() throws Exception {
      String markdown = convertArticle();

      assertThat(markdown)
          .doesNotContain("[1]")
          .doesNotContain("action=edit")
          .doesNotContain("Hodges")
          .doesNotContain("Contents");
    }

    @Test
    void stripsNavigationAndCategoryChrome() throws Exception {
      String markdown = convertArticle();

      assertThat(markdown)
          .doesNotContain("Jump to content")
          .doesNotContain("Main page")
          .doesNotContain("Part of a series")
          .doesNotContain("navbox")
          .doesNotContain("1912 births")
          .doesNotContain("last edited")
          .doesNotContain("wgPageName");
    }

    @Test
    void stripsFiguresInsideArticleBody() throws Exception {
      String markdown = convertArticle();

      assertThat(markdown).doesNotContain("Turing aged 16").doesNotContain("Turing_16.jpg");
      assertThat(markdown).contains("Maida Vale");
    }

    @Test
    void fallsBackToGenericConversionWithoutArticleBody() throws Exception {
      Document document =
          Jsoup.parse(
              "<html><head><title>Portal</title></head><body><h2>Welcome</h2><p>Hi</p></body></html>",
              ARTICLE_URL);

      String markdown = extractor.extract(document, ARTICLE_URL);

      assertThat(markdown).isEqualTo(generic.extract(document, ARTICLE_URL));
      assertThat(markdown).startsWith("# Portal\n\n## Welcome");
    }
  }
}
