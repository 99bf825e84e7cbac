package dev.pagereader.extract;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/** Static DOM clean-up helpers shared by the extractors. All methods mutate their argument. */
final class DomCleaner {

  /** Elements that never carry readable content. */
  static final String NON_CONTENT = "script, style, noscript, template, meta, link, iframe, svg";

  /** Page chrome dropped before Markdown conversion. */
  static final String PAGE_CHROME = "nav, footer, aside, form, figure, header";

  private DomCleaner() {
    // utility class
  }

  static void removeComments(Node root) {
    List<Node> comments = new ArrayList<>();
    NodeTraversor.traverse(
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof Comment) {
              comments.add(node);
            }
          }

          @Override
          public void tail(Node node, int depth) {}
        },
        root);
    comments.forEach(Node::remove);
  }

  /** Rewrite {@code a[href]} and {@code img[src]} to absolute URLs against the base URI. */
  static void absolutizeLinks(Element root) {
    for (Element anchor : root.select("a[href]")) {
      String absolute = anchor.absUrl("href");
      if (!absolute.isEmpty()) {
        anchor.attr("href", absolute);
      }
    }
    for (Element image : root.select("img[src]")) {
      String absolute = image.absUrl("src");
      if (!absolute.isEmpty()) {
        image.attr("src", absolute);
      }
    }
  }
}
