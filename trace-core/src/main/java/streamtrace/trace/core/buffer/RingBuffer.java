package streamtrace.trace.core.buffer;

import java.io.IOException;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSink;

/**
 * Fixed capacity store of tagged byte blocks. Inserting into a full buffer evicts the oldest
 * blocks until the new block fits, reporting each eviction to the callback supplied at
 * construction.
 *
 * <p>Each block is stored as a one byte tag, a four byte big-endian payload length and the
 * payload. The stored bytes, headers included, never exceed the capacity.
 *
 * <p>Not thread-safe: owned by the tracer loop.
 */
public final class RingBuffer {
  static final int HEADER_SIZE = 5;

  private final byte[] data;
  private final Consumer<BlockHeader> evicted;
  private final byte[] header = new byte[HEADER_SIZE];

  private int readIndex;
  private int writeIndex;
  private int len;

  public RingBuffer(int capacity, Consumer<BlockHeader> evicted) {
    if (capacity <= HEADER_SIZE) {
      throw new IllegalArgumentException("Capacity too small: " + capacity);
    }
    this.data = new byte[capacity];
    this.evicted = evicted;
  }

  public int capacity() {
    return data.length;
  }

  /** Occupied bytes, block headers included. */
  public int len() {
    return len;
  }

  public boolean isEmpty() {
    return len == 0;
  }

  public boolean insert(BlockTag tag, byte[] payload) {
    return insert(tag, new Buffer().write(payload));
  }

  /**
   * Moves the whole content of {@code payload} into a new block.
   *
   * @return false if the block can never fit; it is then reported as evicted and discarded
   */
  public boolean insert(BlockTag tag, Buffer payload) {
    final long size = payload.size();
    if (size + HEADER_SIZE > data.length) {
      payload.clear();
      evicted.accept(new BlockHeader(tag, (int) size));
      return false;
    }
    final int total = (int) size + HEADER_SIZE;
    while (data.length - len < total) {
      evicted.accept(evictOldest());
    }
    header[0] = tag.code;
    header[1] = (byte) (size >>> 24);
    header[2] = (byte) (size >>> 16);
    header[3] = (byte) (size >>> 8);
    header[4] = (byte) size;
    put(header, HEADER_SIZE);
    while (payload.size() > 0) {
      int chunk = Math.min(data.length - writeIndex, (int) payload.size());
      advanceWrite(payload.read(data, writeIndex, chunk));
    }
    return true;
  }

  /**
   * Removes the oldest block and writes its payload to {@code sink}.
   *
   * @return the removed block's header, or null if the buffer is empty
   */
  @Nullable
  public BlockHeader writeBlockTo(BufferedSink sink) throws IOException {
    if (len == 0) {
      return null;
    }
    BlockHeader blockHeader = takeHeader();
    int remaining = blockHeader.getSize();
    while (remaining > 0) {
      int chunk = Math.min(data.length - readIndex, remaining);
      sink.write(data, readIndex, chunk);
      advanceRead(chunk);
      remaining -= chunk;
    }
    return blockHeader;
  }

  private BlockHeader evictOldest() {
    BlockHeader blockHeader = takeHeader();
    advanceRead(blockHeader.getSize());
    return blockHeader;
  }

  private BlockHeader takeHeader() {
    for (int i = 0; i < HEADER_SIZE; i++) {
      header[i] = data[readIndex];
      advanceRead(1);
    }
    int size =
        ((header[1] & 0xFF) << 24)
            | ((header[2] & 0xFF) << 16)
            | ((header[3] & 0xFF) << 8)
            | (header[4] & 0xFF);
    return new BlockHeader(BlockTag.fromCode(header[0]), size);
  }

  private void put(byte[] bytes, int count) {
    for (int i = 0; i < count; i++) {
      data[writeIndex] = bytes[i];
      advanceWrite(1);
    }
  }

  private void advanceWrite(int count) {
    writeIndex = (writeIndex + count) % data.length;
    len += count;
  }

  private void advanceRead(int count) {
    readIndex = (readIndex + count) % data.length;
    len -= count;
  }
}
