package dev.pagereader.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Converts a whole page to Markdown after dropping scripts, styles and page chrome. */
@Component
public class GenericMarkdownExtractor implements ContentExtractor {

  private final MarkdownRenderer renderer;

  public GenericMarkdownExtractor(MarkdownRenderer renderer) {
    this.renderer = renderer;
  }

  @Override
  public String extract(Document document, String url) throws ExtractionException {
    try {
      Document copy = document.clone();
      copy.select(DomCleaner.NON_CONTENT).remove();
      copy.select(DomCleaner.PAGE_CHROME).remove();
      DomCleaner.removeComments(copy);
      DomCleaner.absolutizeLinks(copy);
      Element content = copy.body() != null ? copy.body() : copy;
      return renderer.render(content, MarkdownRenderer.titleOf(document));
    } catch (RuntimeException e) {
      throw new ExtractionException("could not convert page to Markdown: " + e.getMessage(), e);
    }
  }
}
