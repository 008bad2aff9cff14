package streamtrace.trace.core.model;

import java.lang.management.ManagementFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.environment.SystemProperties;

public final class ProcessInfo {
  private static final Logger log = LoggerFactory.getLogger(ProcessInfo.class);

  private final long pid;
  private final String title;
  private final List<String> argv;

  public ProcessInfo(long pid, String title, List<String> argv) {
    this.pid = pid;
    this.title = title;
    this.argv = Collections.unmodifiableList(argv);
  }

  public static ProcessInfo current() {
    String command = SystemProperties.get("sun.java.command");
    List<String> argv =
        command == null || command.trim().isEmpty()
            ? Collections.<String>emptyList()
            : Arrays.asList(command.trim().split("\\s+"));
    return new ProcessInfo(currentPid(), "java", argv);
  }

  private static long currentPid() {
    // RuntimeMXBean name is "pid@hostname" on HotSpot and OpenJ9
    String name = ManagementFactory.getRuntimeMXBean().getName();
    int at = name.indexOf('@');
    try {
      return Long.parseLong(at > 0 ? name.substring(0, at) : name);
    } catch (NumberFormatException e) {
      log.debug("Unable to determine pid from '{}'", name);
      return 0;
    }
  }

  public long getPid() {
    return pid;
  }

  public String getTitle() {
    return title;
  }

  public List<String> getArgv() {
    return argv;
  }
}
