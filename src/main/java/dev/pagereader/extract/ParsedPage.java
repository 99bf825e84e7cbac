package dev.pagereader.extract;

import org.jsoup.nodes.Document;

/**
 * A fetched page decoded and parsed into a DOM.
 *
 * @param document parsed HTML, base URI set to the final fetched URL
 * @param charset name of the charset the body was decoded with
 */
public record ParsedPage(Document document, String charset) {}
