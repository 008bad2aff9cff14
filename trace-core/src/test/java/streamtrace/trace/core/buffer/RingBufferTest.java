package streamtrace.trace.core.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import okio.Buffer;
import org.junit.jupiter.api.Test;

class RingBufferTest {

  private final List<BlockHeader> evicted = new ArrayList<>();

  @Test
  void insertThenDrainKeepsTagAndLength() throws IOException {
    RingBuffer buffer = new RingBuffer(64, evicted::add);
    byte[] payload = "{\"span\":{}}".getBytes(StandardCharsets.UTF_8);

    assertTrue(buffer.insert(BlockTag.SPAN, payload));
    assertEquals(payload.length + RingBuffer.HEADER_SIZE, buffer.len());

    Buffer sink = new Buffer();
    BlockHeader header = buffer.writeBlockTo(sink);
    assertEquals(new BlockHeader(BlockTag.SPAN, payload.length), header);
    assertArrayEquals(payload, sink.readByteArray());
    assertEquals(0, buffer.len());
    assertTrue(evicted.isEmpty());
  }

  @Test
  void emptyBufferYieldsNoBlock() throws IOException {
    RingBuffer buffer = new RingBuffer(64, evicted::add);
    Buffer sink = new Buffer();
    assertNull(buffer.writeBlockTo(sink));
    assertEquals(0, sink.size());
  }

  @Test
  void evictsOldestBlocksFirst() throws IOException {
    int blockSize = 10;
    int capacityInBlocks = 4;
    RingBuffer buffer =
        new RingBuffer(capacityInBlocks * (blockSize + RingBuffer.HEADER_SIZE), evicted::add);

    int records = 11;
    for (int i = 0; i < records; i++) {
      buffer.insert(i % 2 == 0 ? BlockTag.TRANSACTION : BlockTag.ERROR, block(i, blockSize));
    }

    assertEquals(records - capacityInBlocks, evicted.size());
    assertEquals(BlockTag.TRANSACTION, evicted.get(0).getTag());
    assertEquals(BlockTag.ERROR, evicted.get(1).getTag());
    for (int i = records - capacityInBlocks; i < records; i++) {
      Buffer sink = new Buffer();
      BlockHeader header = buffer.writeBlockTo(sink);
      assertEquals(blockSize, header.getSize());
      assertArrayEquals(block(i, blockSize), sink.readByteArray());
    }
    assertNull(buffer.writeBlockTo(new Buffer()));
  }

  @Test
  void blocksWrapAroundTheEnd() throws IOException {
    RingBuffer buffer = new RingBuffer(32, evicted::add);
    for (int i = 0; i < 20; i++) {
      byte[] payload = block(i, 3 + i % 7);
      buffer.insert(BlockTag.METRICS, payload);
      Buffer sink = new Buffer();
      assertEquals(payload.length, buffer.writeBlockTo(sink).getSize());
      assertArrayEquals(payload, sink.readByteArray());
    }
    assertTrue(evicted.isEmpty());
    assertTrue(buffer.isEmpty());
  }

  @Test
  void evictsAsManyBlocksAsNeeded() {
    RingBuffer buffer = new RingBuffer(30, evicted::add);
    buffer.insert(BlockTag.SPAN, block(0, 5));
    buffer.insert(BlockTag.SPAN, block(1, 5));
    buffer.insert(BlockTag.SPAN, block(2, 5));

    assertTrue(buffer.insert(BlockTag.ERROR, block(3, 20)));

    assertEquals(3, evicted.size());
    assertEquals(25, buffer.len());
  }

  @Test
  void oversizedBlockIsDroppedAndReported() {
    RingBuffer buffer = new RingBuffer(16, evicted::add);
    buffer.insert(BlockTag.SPAN, block(0, 4));

    assertFalse(buffer.insert(BlockTag.TRANSACTION, block(1, 12)));

    assertEquals(1, evicted.size());
    assertEquals(new BlockHeader(BlockTag.TRANSACTION, 12), evicted.get(0));
    assertEquals(4 + RingBuffer.HEADER_SIZE, buffer.len());
  }

  @Test
  void rejectsTinyCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new RingBuffer(5, evicted::add));
  }

  private static byte[] block(int index, int size) {
    byte[] bytes = new byte[size];
    for (int i = 0; i < size; i++) {
      bytes[i] = (byte) (index * 31 + i);
    }
    return bytes;
  }
}
