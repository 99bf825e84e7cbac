package dev.pagereader.batch;

/**
 * Lifecycle of one URL inside a batch.
 *
 * <pre>
 * PENDING -> FETCHING -> FETCH_FAILED
 *                     -> FETCHED_NON_2XX
 *                     -> EXTRACTING -> DONE
 *                                   -> EXTRACT_FAILED
 * </pre>
 */
public enum TaskState {
  PENDING,
  FETCHING,
  FETCH_FAILED,
  FETCHED_NON_2XX,
  EXTRACTING,
  DONE,
  EXTRACT_FAILED;

  public boolean isTerminal() {
    return this == FETCH_FAILED
        || this == FETCHED_NON_2XX
        || this == DONE
        || this == EXTRACT_FAILED;
  }
}
