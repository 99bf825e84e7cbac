package dev.pagereader.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /fetch}. Only {@code urls} is required; range checks and defaults are
 * applied by {@link dev.pagereader.batch.FetchRequestFactory}.
 *
 * @param urls URLs to fetch, in the order results are wanted
 * @param timeout per-URL timeout in seconds (1-60)
 * @param concurrency number of URLs processed at once
 * @param toMarkdown render Markdown (default) or plain text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchRequestBody(
    @NotEmpty List<String> urls,
    @Nullable Double timeout,
    @Nullable Integer concurrency,
    @JsonProperty("to_markdown") @Nullable Boolean toMarkdown) {}
