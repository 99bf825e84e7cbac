package dev.pagereader.batch;

/**
 * A batch was accepted but could not be run, e.g. worker slots could not be allocated or the
 * orchestrating thread was interrupted. Never raised for individual URL failures.
 */
public class BatchExecutionException extends RuntimeException {

  public BatchExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
