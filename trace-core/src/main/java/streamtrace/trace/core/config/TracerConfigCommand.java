package streamtrace.trace.core.config;

/** A change to the loop-owned configuration, applied by the tracer loop in submission order. */
public interface TracerConfigCommand {

  void apply(TracerConfig config);
}
