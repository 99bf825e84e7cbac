package dev.pagereader.extract;

import org.jsoup.nodes.Document;

/**
 * Turns a parsed page into the content returned to the caller. Implementations must not mutate the
 * document they are given.
 */
public interface ContentExtractor {

  /**
   * @param document parsed page
   * @param url the URL the caller asked for
   * @return extracted plain text or Markdown
   * @throws ExtractionException if no content can be produced
   */
  String extract(Document document, String url) throws ExtractionException;
}
