package streamtrace.trace.core.buffer;

/** Tag and payload size of a block. */
public final class BlockHeader {
  private final BlockTag tag;
  private final int size;

  public BlockHeader(BlockTag tag, int size) {
    this.tag = tag;
    this.size = size;
  }

  public BlockTag getTag() {
    return tag;
  }

  /** Payload length in bytes, excluding the header. */
  public int getSize() {
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BlockHeader)) {
      return false;
    }
    BlockHeader that = (BlockHeader) o;
    return size == that.size && tag == that.tag;
  }

  @Override
  public int hashCode() {
    return 31 * tag.hashCode() + size;
  }

  @Override
  public String toString() {
    return "BlockHeader{tag=" + tag + ", size=" + size + '}';
  }
}
