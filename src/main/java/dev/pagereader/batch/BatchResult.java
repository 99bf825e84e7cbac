package dev.pagereader.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of one batch: one outcome per requested URL, in request order.
 *
 * @param total number of requested URLs
 * @param concurrency number of worker slots used
 * @param elapsedMs wall time from first dispatch to the last terminal outcome
 * @param results outcomes, positionally aligned with the requested URLs
 */
public record BatchResult(
    int total,
    int concurrency,
    @JsonProperty("elapsed_ms") long elapsedMs,
    List<FetchOutcome> results) {

  public BatchResult {
    results = List.copyOf(results);
  }
}
