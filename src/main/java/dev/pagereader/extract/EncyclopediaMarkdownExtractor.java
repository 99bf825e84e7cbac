package dev.pagereader.extract;

import java.net.URI;
import java.util.Locale;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Markdown extraction for Wikipedia articles.
 *
 * <p>Only the article body ({@code #mw-content-text}) is converted, after removing edit links,
 * citation markers, reference lists, navigation boxes, the table of contents and category links.
 * The heading comes from the article title rather than the browser title. Pages without an article
 * body fall back to {@link GenericMarkdownExtractor}.
 */
@Component
public class EncyclopediaMarkdownExtractor implements ContentExtractor {

  private static final Logger log = LoggerFactory.getLogger(EncyclopediaMarkdownExtractor.class);

  static final String ARTICLE_BODY = "div#mw-content-text";

  static final String ARTICLE_SCAFFOLDING =
      String.join(
          ", ",
          ".mw-editsection",
          "sup.reference",
          "ol.references",
          ".reflist",
          ".mw-references-wrap",
          ".mw-cite-backlink",
          ".navbox",
          ".vertical-navbox",
          ".sidebar",
          ".navigation-not-searchable",
          "#toc",
          ".toc",
          ".mw-jump-link",
          "#catlinks",
          ".catlinks",
          ".noprint",
          ".mw-empty-elt");

  private final MarkdownRenderer renderer;
  private final GenericMarkdownExtractor fallback;

  public EncyclopediaMarkdownExtractor(
      MarkdownRenderer renderer, GenericMarkdownExtractor fallback) {
    this.renderer = renderer;
    this.fallback = fallback;
  }

  /**
   * Whether the URL points at a Wikipedia host, in any language or on the mobile site.
   *
   * @param url the requested URL
   * @return true for {@code wikipedia.org} and its subdomains
   */
  public static boolean matches(String url) {
    try {
      String host = URI.create(url.trim()).getHost();
      if (host == null) {
        return false;
      }
      host = host.toLowerCase(Locale.ROOT);
      return host.equals("wikipedia.org") || host.endsWith(".wikipedia.org");
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  @Override
  public String extract(Document document, String url) throws ExtractionException {
    Element original = document.selectFirst(ARTICLE_BODY);
    if (original == null) {
      log.debug("No article body in {}, using generic conversion", url);
      return fallback.extract(document, url);
    }
    try {
      Document copy = document.clone();
      Element body = copy.selectFirst(ARTICLE_BODY);
      body.select(DomCleaner.NON_CONTENT).remove();
      body.select(DomCleaner.PAGE_CHROME).remove();
      body.select(ARTICLE_SCAFFOLDING).remove();
      DomCleaner.removeComments(body);
      DomCleaner.absolutizeLinks(body);
      String title = articleTitle(document);
      return renderer.render(body, title);
    } catch (RuntimeException e) {
      throw new ExtractionException("could not convert article to Markdown: " + e.getMessage(), e);
    }
  }

  private static String articleTitle(Document document) {
    Element titleElement = document.selectFirst("span.mw-page-title-main");
    if (titleElement == null) {
      titleElement = document.selectFirst("h1#firstHeading");
    }
    if (titleElement != null && !titleElement.text().isBlank()) {
      return titleElement.text().strip();
    }
    return MarkdownRenderer.titleOf(document);
  }
}
