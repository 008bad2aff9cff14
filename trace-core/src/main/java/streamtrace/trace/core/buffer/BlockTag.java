package streamtrace.trace.core.buffer;

/** Category of a buffered block. The code is stored in the block header. */
public enum BlockTag {
  TRANSACTION((byte) 1),
  SPAN((byte) 2),
  ERROR((byte) 3),
  METRICS((byte) 4);

  private static final BlockTag[] BY_CODE = new BlockTag[5];

  static {
    for (BlockTag tag : values()) {
      BY_CODE[tag.code] = tag;
    }
  }

  final byte code;

  BlockTag(byte code) {
    this.code = code;
  }

  static BlockTag fromCode(byte code) {
    if (code <= 0 || code >= BY_CODE.length) {
      throw new IllegalStateException("Unknown block tag " + code);
    }
    return BY_CODE[code];
  }
}
