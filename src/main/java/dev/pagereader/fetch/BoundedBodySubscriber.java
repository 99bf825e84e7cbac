package dev.pagereader.fetch;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Body subscriber that keeps at most {@code limit} bytes of a response and counts the rest.
 *
 * <p>The whole body is still drained from the connection, so the response completes normally and
 * the byte count is exact, but bytes beyond the limit are dropped as they arrive.
 */
final class BoundedBodySubscriber
    implements HttpResponse.BodySubscriber<BoundedBodySubscriber.Body> {

  /**
   * Bytes kept from a response and the number actually received.
   *
   * @param bytes the first {@code limit} bytes of the body
   * @param received total body size in bytes
   */
  record Body(byte[] bytes, long received) {}

  private final int limit;
  private final ByteArrayOutputStream kept;
  private final CompletableFuture<Body> result = new CompletableFuture<>();
  private long received;

  BoundedBodySubscriber(int limit) {
    this.limit = limit;
    this.kept = new ByteArrayOutputStream(Math.min(limit, 64 * 1024));
  }

  static HttpResponse.BodyHandler<Body> handler(int limit) {
    return responseInfo -> new BoundedBodySubscriber(limit);
  }

  @Override
  public CompletionStage<Body> getBody() {
    return result;
  }

  @Override
  public void onSubscribe(Flow.Subscription subscription) {
    subscription.request(Long.MAX_VALUE);
  }

  @Override
  public void onNext(List<ByteBuffer> buffers) {
    for (ByteBuffer buffer : buffers) {
      int length = buffer.remaining();
      received += length;
      int room = limit - kept.size();
      if (room > 0) {
        byte[] chunk = new byte[Math.min(room, length)];
        buffer.get(chunk);
        kept.write(chunk, 0, chunk.length);
      }
    }
  }

  @Override
  public void onError(Throwable throwable) {
    result.completeExceptionally(throwable);
  }

  @Override
  public void onComplete() {
    result.complete(new Body(kept.toByteArray(), received));
  }
}
