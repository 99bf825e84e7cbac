package dev.pagereader.extract;

import dev.pagereader.fetch.CharsetNames;
import dev.pagereader.fetch.FetchedPage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes raw response bytes and parses them as HTML.
 *
 * <p>Charset priority: the charset declared by the {@code Content-Type} header, then a byte-order
 * mark or {@code <meta charset>} found by jsoup, then UTF-8. Malformed byte sequences are replaced,
 * never fatal.
 */
@Component
public class HtmlDecoder {

  private static final Logger log = LoggerFactory.getLogger(HtmlDecoder.class);

  /**
   * Decode and parse a fetched page.
   *
   * @param page successful fetch result
   * @return the parsed DOM and the charset used
   * @throws ExtractionException if the body cannot be decoded under any charset
   */
  public ParsedPage decode(FetchedPage page) throws ExtractionException {
    Charset declared = CharsetNames.lookup(page.declaredCharset());
    try {
      if (declared != null) {
        String html = new String(page.body(), declared);
        return new ParsedPage(Jsoup.parse(html, page.finalUrl()), declared.name());
      }
      Document document =
          Jsoup.parse(new ByteArrayInputStream(page.body()), null, page.finalUrl());
      String detected = document.charset().name();
      log.debug("No usable charset declared for {}, detected {}", page.finalUrl(), detected);
      return new ParsedPage(document, detected);
    } catch (IOException | UncheckedIOException e) {
      throw new ExtractionException("could not decode response body: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new ExtractionException("could not parse response as HTML: " + e.getMessage(), e);
    }
  }
}
