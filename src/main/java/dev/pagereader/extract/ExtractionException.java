package dev.pagereader.extract;

/** Raised when a fetched page cannot be turned into text or Markdown. */
public class ExtractionException extends Exception {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
