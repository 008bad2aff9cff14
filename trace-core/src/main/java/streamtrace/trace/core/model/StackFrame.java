package streamtrace.trace.core.model;

import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One stack frame of a span or error. Source context lines are filled in by a {@link
 * ContextSetter} while the owning record is written.
 */
public final class StackFrame {
  private final String classname;
  private final String function;
  @Nullable private final String file;
  @Nullable private final String absPath;
  private final int line;

  @Nullable private String contextLine;
  private List<String> preContext = Collections.emptyList();
  private List<String> postContext = Collections.emptyList();

  public StackFrame(
      String classname,
      String function,
      @Nullable String file,
      @Nullable String absPath,
      int line) {
    this.classname = classname;
    this.function = function;
    this.file = file;
    this.absPath = absPath;
    this.line = line;
  }

  public static StackFrame of(StackTraceElement element) {
    return new StackFrame(
        element.getClassName(),
        element.getMethodName(),
        element.getFileName(),
        null,
        element.getLineNumber());
  }

  public String getClassname() {
    return classname;
  }

  public String getFunction() {
    return function;
  }

  @Nullable
  public String getFile() {
    return file;
  }

  @Nullable
  public String getAbsPath() {
    return absPath;
  }

  public int getLine() {
    return line;
  }

  @Nullable
  public String getContextLine() {
    return contextLine;
  }

  public List<String> getPreContext() {
    return preContext;
  }

  public List<String> getPostContext() {
    return postContext;
  }

  public void setContext(
      List<String> preContext, @Nullable String contextLine, List<String> postContext) {
    this.preContext = preContext;
    this.contextLine = contextLine;
    this.postContext = postContext;
  }
}
