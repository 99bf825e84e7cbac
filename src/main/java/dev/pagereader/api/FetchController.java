package dev.pagereader.api;

import dev.pagereader.batch.BatchOrchestrator;
import dev.pagereader.batch.BatchResult;
import dev.pagereader.batch.FetchRequest;
import dev.pagereader.batch.FetchRequestFactory;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Batch fetch endpoint. Answers 200 for every accepted batch, even when some or all URLs failed;
 * malformed requests are rejected with 400 before any URL is fetched.
 */
@RestController
public class FetchController {

  private final BatchOrchestrator orchestrator;
  private final FetchRequestFactory requestFactory;

  public FetchController(BatchOrchestrator orchestrator, FetchRequestFactory requestFactory) {
    this.orchestrator = orchestrator;
    this.requestFactory = requestFactory;
  }

  @PostMapping("/fetch")
  public BatchResult fetch(@Valid @RequestBody FetchRequestBody body) {
    FetchRequest request =
        requestFactory.create(body.urls(), body.timeout(), body.concurrency(), body.toMarkdown());
    return orchestrator.process(request);
  }
}
