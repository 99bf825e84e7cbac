package dev.pagereader.extract;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Wraps the flexmark HTML-to-Markdown converter and applies the output clean-up shared by all
 * Markdown extractors: ATX headings, no heading id attributes, at most one blank line in a row, and
 * a leading {@code # title} heading when the body does not start with one.
 */
@Component
public class MarkdownRenderer {

  static final String UNTITLED = "No Title";

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");

  private final FlexmarkHtmlConverter converter;

  public MarkdownRenderer() {
    MutableDataSet options =
        new MutableDataSet()
            .set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false)
            .set(FlexmarkHtmlConverter.OUTPUT_ATTRIBUTES_ID, false);
    this.converter = FlexmarkHtmlConverter.builder(options).build();
  }

  /**
   * Convert an element subtree to Markdown and title it.
   *
   * @param content root of the content to convert
   * @param title heading used when the converted text has no top-level heading
   * @return normalized Markdown
   */
  public String render(Element content, String title) {
    String markdown = converter.convert(content.outerHtml());
    return finish(markdown, title);
  }

  static String finish(String markdown, String title) {
    String text = markdown == null ? "" : markdown.replace("\r\n", "\n");
    text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n").strip();
    if (text.startsWith("# ")) {
      return text;
    }
    String heading = "# " + title;
    return text.isEmpty() ? heading : heading + "\n\n" + text;
  }

  static String titleOf(Document document) {
    String title = document.title();
    return title == null || title.isBlank() ? UNTITLED : title.strip();
  }
}
