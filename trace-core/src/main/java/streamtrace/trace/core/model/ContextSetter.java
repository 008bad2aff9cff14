package streamtrace.trace.core.model;

/** Fills in the source lines around a stack frame. */
public interface ContextSetter {

  /**
   * @param preContextLines lines to capture before the frame's line
   * @param postContextLines lines to capture after the frame's line
   * @throws Exception if the source cannot be read, the frame is then kept without context
   */
  void setContext(StackFrame frame, int preContextLines, int postContextLines) throws Exception;
}
