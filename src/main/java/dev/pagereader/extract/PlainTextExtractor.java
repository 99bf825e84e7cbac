package dev.pagereader.extract;

import java.util.Arrays;
import java.util.stream.Collectors;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

/**
 * Extracts readable plain text: non-content elements and comments are dropped, block boundaries
 * become line breaks, whitespace inside a line collapses to single spaces and blank lines are
 * removed.
 */
@Component
public class PlainTextExtractor implements ContentExtractor {

  @Override
  public String extract(Document document, String url) throws ExtractionException {
    try {
      Document copy = document.clone();
      copy.select(DomCleaner.NON_CONTENT).remove();
      DomCleaner.removeComments(copy);
      return normalize(collectText(copy));
    } catch (RuntimeException e) {
      throw new ExtractionException("could not extract text: " + e.getMessage(), e);
    }
  }

  private static String collectText(Node root) {
    StringBuilder out = new StringBuilder();
    NodeTraversor.traverse(
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof TextNode text) {
              out.append(text.getWholeText());
            } else if (node instanceof Element element
                && (element.isBlock() || "br".equals(element.normalName()))) {
              out.append('\n');
            }
          }

          @Override
          public void tail(Node node, int depth) {
            if (node instanceof Element element && element.isBlock()) {
              out.append('\n');
            }
          }
        },
        root);
    return out.toString();
  }

  static String normalize(String raw) {
    return Arrays.stream(raw.replace('\u00A0', ' ').split("\\R"))
        .map(line -> line.replaceAll("[ \\t\\x0B\\f]+", " ").strip())
        .filter(line -> !line.isEmpty())
        .collect(Collectors.joining("\n"));
  }
}
