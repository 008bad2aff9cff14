package streamtrace.trace.core.writer;

import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A pending read of a {@link LoopbackReader}. The tracer loop copies compressed bytes straight
 * into the caller's array and responds with the count, or -1 for end-of-stream.
 */
final class ReadRequest implements InboxItem {
  final LoopbackReader reader;
  final byte[] buffer;
  final int offset;
  final int length;
  private final CompletableFuture<Integer> result = new CompletableFuture<>();

  ReadRequest(LoopbackReader reader, byte[] buffer, int offset, int length) {
    this.reader = reader;
    this.buffer = buffer;
    this.offset = offset;
    this.length = length;
  }

  boolean isDone() {
    return result.isDone();
  }

  void respond(int count) {
    result.complete(count);
  }

  int await() throws InterruptedIOException {
    try {
      return result.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for request data");
    } catch (ExecutionException e) {
      // never completed exceptionally
      throw new IllegalStateException(e.getCause());
    }
  }
}
