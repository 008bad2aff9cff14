package streamtrace.trace.core.writer;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Request body handed to the transport. Each read is posted to the tracer loop, which answers
 * with the next compressed bytes once they exist, so the body is never held in full.
 *
 * <p>One instance per request. {@link #closeRead()} is called by the loop and makes every
 * pending and future read report end-of-stream.
 */
final class LoopbackReader extends InputStream {
  private final Consumer<ReadRequest> requests;
  private volatile boolean closed;
  private volatile ReadRequest pending;

  LoopbackReader(Consumer<ReadRequest> requests) {
    this.requests = requests;
  }

  @Override
  public int read() throws IOException {
    byte[] single = new byte[1];
    int count;
    do {
      count = read(single, 0, 1);
    } while (count == 0);
    return count < 0 ? -1 : single[0] & 0xFF;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    if (off < 0 || len < 0 || len > b.length - off) {
      throw new IndexOutOfBoundsException();
    }
    if (len == 0) {
      return 0;
    }
    if (closed) {
      return -1;
    }
    ReadRequest request = new ReadRequest(this, b, off, len);
    pending = request;
    requests.accept(request);
    if (closed) {
      request.respond(-1);
    }
    return request.await();
  }

  boolean isClosed() {
    return closed;
  }

  void closeRead() {
    closed = true;
    ReadRequest request = pending;
    if (request != null) {
      request.respond(-1);
    }
  }
}
