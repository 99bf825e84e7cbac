package dev.pagereader.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a batch of URLs through {@link PageTaskRunner} with bounded parallelism.
 *
 * <p>Each batch gets its own fixed pool of {@code min(concurrency, urls)} worker threads, so at
 * most that many URLs are fetching or extracting at any instant. URLs are submitted in request
 * order and queue until a worker frees up. Each task writes its outcome into its own index of a
 * pre-sized array, so results stay positionally aligned with the request whatever the completion
 * order. A latch counts terminal outcomes; the batch returns once every URL has one.
 *
 * <p>No URL failure escapes its task. The batch itself fails only when the worker pool cannot be
 * used, which surfaces as {@link BatchExecutionException}.
 */
@Service
public class BatchOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final PageTaskRunner taskRunner;
  private final IntFunction<ExecutorService> poolFactory;

  @Autowired
  public BatchOrchestrator(PageTaskRunner taskRunner) {
    this(
        taskRunner,
        size -> Executors.newFixedThreadPool(size, new CustomizableThreadFactory("fetch-worker-")));
  }

  BatchOrchestrator(PageTaskRunner taskRunner, IntFunction<ExecutorService> poolFactory) {
    this.taskRunner = taskRunner;
    this.poolFactory = poolFactory;
  }

  /**
   * Fetch and extract every URL of a validated request.
   *
   * @param request validated batch request
   * @return one outcome per URL, in request order
   * @throws BatchExecutionException if the batch could not be executed at all
   */
  public BatchResult process(FetchRequest request) {
    List<String> urls = request.urls();
    int total = urls.size();
    int concurrency = request.effectiveConcurrency();
    Duration timeout = request.timeout();

    log.info(
        "Incoming fetch: {} urls, concurrency={}, timeout={}s, markdown={}",
        total,
        concurrency,
        request.timeoutSeconds(),
        request.toMarkdown());

    AtomicReferenceArray<FetchOutcome> slots = new AtomicReferenceArray<>(total);
    CountDownLatch remaining = new CountDownLatch(total);
    ExecutorService pool = createPool(concurrency);
    long started = System.nanoTime();

    try {
      for (int i = 0; i < total; i++) {
        int index = i;
        String url = urls.get(index);
        log.debug("{} -> {}", TaskState.PENDING, url);
        pool.execute(
            () -> {
              try {
                slots.set(index, runGuarded(url, timeout, request.toMarkdown()));
              } finally {
                remaining.countDown();
              }
            });
      }
      remaining.await();
    } catch (RejectedExecutionException e) {
      throw new BatchExecutionException("Worker pool rejected a fetch task", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BatchExecutionException("Interrupted while waiting for fetch tasks", e);
    } finally {
      pool.shutdownNow();
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    List<FetchOutcome> results = new ArrayList<>(total);
    int failed = 0;
    for (int i = 0; i < total; i++) {
      FetchOutcome outcome = slots.get(i);
      if (outcome == null) {
        log.error("No outcome recorded for {}; its worker terminated abnormally", urls.get(i));
        outcome =
            FetchOutcome.fetchFailed(
                urls.get(i), "other-transport-error: task terminated abnormally", 0);
      }
      results.add(outcome);
      if (!outcome.ok()) {
        failed++;
      }
    }
    log.info(
        "Fetch complete: {} urls ({} failed) in {} ms with concurrency={}",
        total,
        failed,
        elapsedMs,
        concurrency);
    return new BatchResult(total, concurrency, elapsedMs, results);
  }

  private ExecutorService createPool(int concurrency) {
    try {
      return poolFactory.apply(concurrency);
    } catch (RuntimeException e) {
      throw new BatchExecutionException(
          "Could not allocate " + concurrency + " fetch worker slots", e);
    }
  }

  private FetchOutcome runGuarded(String url, Duration timeout, boolean toMarkdown) {
    try {
      return taskRunner.run(url, timeout, toMarkdown);
    } catch (RuntimeException e) {
      log.error("Task for {} failed outside its own error handling", url, e);
      return FetchOutcome.fetchFailed(url, "other-transport-error: " + e.getMessage(), 0);
    }
  }
}
