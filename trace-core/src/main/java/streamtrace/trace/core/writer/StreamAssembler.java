package streamtrace.trace.core.writer;

import java.io.IOException;
import java.util.zip.Deflater;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSink;
import okio.DeflaterSink;
import okio.Okio;
import streamtrace.trace.core.buffer.BlockHeader;
import streamtrace.trace.core.buffer.RingBuffer;
import streamtrace.trace.core.model.Metadata;

/**
 * Compresses buffered blocks into the body of the current request. The body starts with the
 * metadata line; each block becomes one line. Compressed output accumulates until the request
 * body reader takes it.
 *
 * <p>The size ceiling is checked against uncompressed bytes, and every request carries at least
 * one block.
 *
 * <p>Used by the tracer loop only.
 */
final class StreamAssembler {
  private final Metadata metadata;
  @Nullable private byte[] encodedMetadata;

  private final Buffer compressed = new Buffer();
  @Nullable private Deflater deflater;
  @Nullable private BufferedSink compressor;

  private long uncompressedBytes;
  private long bytesRead;
  private boolean flushed = true;
  private boolean closed;

  private long transactions;
  private long spans;
  private long errors;
  private long metricsets;

  StreamAssembler(Metadata metadata) {
    this.metadata = metadata;
  }

  void open() throws IOException {
    if (encodedMetadata == null) {
      Buffer json = new Buffer();
      ModelJsonEncoder.writeMetadata(json, metadata);
      encodedMetadata = json.readByteArray();
    }
    deflater = new Deflater(Deflater.BEST_SPEED);
    compressor = Okio.buffer(new DeflaterSink(compressed, deflater));
    compressor.write(encodedMetadata);
    uncompressedBytes = encodedMetadata.length;
    flushed = false;
    closed = false;
  }

  /**
   * Moves the oldest block of {@code source} into the request.
   *
   * @return the moved block's header, or null if {@code source} was empty
   */
  @Nullable
  BlockHeader writeBlock(RingBuffer source) throws IOException {
    BlockHeader header = source.writeBlockTo(compressor);
    if (header == null) {
      return null;
    }
    compressor.writeByte('\n');
    uncompressedBytes += header.getSize() + 1;
    flushed = false;
    switch (header.getTag()) {
      case TRANSACTION:
        transactions++;
        break;
      case SPAN:
        spans++;
        break;
      case ERROR:
        errors++;
        break;
      case METRICS:
        metricsets++;
        break;
      default:
        break;
    }
    return header;
  }

  boolean isFull(int requestSize) {
    return recordCount() > 0 && uncompressedBytes >= requestSize;
  }

  /** Makes everything written so far readable. */
  void flush() throws IOException {
    compressor.flush();
    flushed = true;
  }

  /** Finishes the compressed stream; the reader sees end-of-stream once it drained the rest. */
  void close() throws IOException {
    compressor.close();
    compressor = null;
    deflater = null;
    flushed = true;
    closed = true;
  }

  boolean isFlushed() {
    return flushed;
  }

  boolean isClosed() {
    return closed;
  }

  /** Compressed bytes ready to be read. */
  long available() {
    return compressed.size();
  }

  /** Compressed bytes produced for this request, read or not. */
  long produced() {
    return bytesRead + compressed.size();
  }

  int read(byte[] sink, int offset, int length) {
    int count = compressed.read(sink, offset, length);
    if (count > 0) {
      bytesRead += count;
    }
    return count;
  }

  long transactions() {
    return transactions;
  }

  long spans() {
    return spans;
  }

  long errors() {
    return errors;
  }

  long metricsets() {
    return metricsets;
  }

  long recordCount() {
    return transactions + spans + errors + metricsets;
  }

  void reset() {
    if (deflater != null) {
      deflater.end();
    }
    deflater = null;
    compressor = null;
    compressed.clear();
    uncompressedBytes = 0;
    bytesRead = 0;
    flushed = true;
    closed = false;
    transactions = 0;
    spans = 0;
    errors = 0;
    metricsets = 0;
  }
}
