package streamtrace.trace.core.sampling;

/**
 * Samples a fixed ratio of traces. The decision is taken from the low 64 bits of the trace id, so
 * every participant of a trace decides the same way.
 */
public final class RatioSampler implements Sampler {

  private static final double MAX = Math.pow(2, 64) - 1;

  private final double ratio;
  private final long threshold;

  /**
   * @param ratio between 0 and 1, clamped otherwise
   */
  public RatioSampler(double ratio) {
    this.ratio = Math.max(0, Math.min(1, ratio));
    this.threshold = cutoff(this.ratio);
  }

  public double getRatio() {
    return ratio;
  }

  @Override
  public boolean sample(String traceId) {
    if (ratio <= 0) {
      return false;
    }
    if (ratio >= 1) {
      return true;
    }
    // unsigned 64 bit comparison with the threshold
    return samplingId(traceId) + Long.MIN_VALUE < threshold;
  }

  static long cutoff(double ratio) {
    if (ratio < 0.5) {
      return (long) (ratio * MAX) + Long.MIN_VALUE;
    }
    if (ratio < 1.0) {
      return (long) ((ratio * MAX) + Long.MIN_VALUE);
    }
    return Long.MAX_VALUE;
  }

  private static long samplingId(String traceId) {
    int start = Math.max(0, traceId.length() - 16);
    try {
      return Long.parseUnsignedLong(traceId.substring(start), 16);
    } catch (NumberFormatException e) {
      return traceId.hashCode();
    }
  }

  @Override
  public String toString() {
    return "RatioSampler{ratio=" + ratio + '}';
  }
}
