package dev.pagereader.fetch;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Static helpers for reading the charset parameter of a {@code Content-Type} header. Names the JVM
 * cannot decode are treated as absent so callers fall back to sniffing.
 */
public final class CharsetNames {

  private static final Pattern CHARSET_PARAM =
      Pattern.compile("charset\\s*=\\s*[\"']?([^\"';,\\s]+)", Pattern.CASE_INSENSITIVE);

  private CharsetNames() {
    // utility class
  }

  /**
   * Extract a supported charset from a {@code Content-Type} value.
   *
   * @param contentType header value, e.g. {@code text/html; charset=ISO-8859-1}
   * @return the charset, or {@code null} if absent or not supported by this JVM
   */
  public static @Nullable Charset fromContentType(@Nullable String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return null;
    }
    Matcher matcher = CHARSET_PARAM.matcher(contentType);
    if (!matcher.find()) {
      return null;
    }
    return lookup(matcher.group(1));
  }

  /**
   * Resolve a charset name without throwing.
   *
   * @param name charset name, possibly malformed
   * @return the charset, or {@code null} if the name is malformed or unsupported
   */
  public static @Nullable Charset lookup(@Nullable String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    String trimmed = name.trim().toUpperCase(Locale.ROOT);
    try {
      return Charset.isSupported(trimmed) ? Charset.forName(trimmed) : null;
    } catch (IllegalCharsetNameException e) {
      return null;
    }
  }
}
