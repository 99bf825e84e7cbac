package dev.pagereader.extract;

import org.springframework.stereotype.Component;

/** Picks the extraction strategy for one URL from the request's Markdown flag and the URL. */
@Component
public class ExtractorSelector {

  private final PlainTextExtractor plainText;
  private final GenericMarkdownExtractor genericMarkdown;
  private final EncyclopediaMarkdownExtractor encyclopediaMarkdown;

  public ExtractorSelector(
      PlainTextExtractor plainText,
      GenericMarkdownExtractor genericMarkdown,
      EncyclopediaMarkdownExtractor encyclopediaMarkdown) {
    this.plainText = plainText;
    this.genericMarkdown = genericMarkdown;
    this.encyclopediaMarkdown = encyclopediaMarkdown;
  }

  public ContentExtractor select(boolean toMarkdown, String url) {
    if (!toMarkdown) {
      return plainText;
    }
    return EncyclopediaMarkdownExtractor.matches(url) ? encyclopediaMarkdown : genericMarkdown;
  }
}
