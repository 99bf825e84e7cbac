package dev.pagereader.batch;

import org.springframework.http.HttpStatus;

/** Renders a status code with its reason phrase when Spring knows one, e.g. {@code 403 Forbidden}. */
final class HttpStatusText {

  private HttpStatusText() {
    // utility class
  }

  static String describe(int statusCode) {
    HttpStatus status = HttpStatus.resolve(statusCode);
    return status == null ? String.valueOf(statusCode) : statusCode + " " + status.getReasonPhrase();
  }
}
