package streamtrace.trace.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Describes the reporting process; sent once at the head of every request. */
public final class Metadata {
  private final SystemInfo system;
  private final ProcessInfo process;
  private final ServiceInfo service;
  private final Map<String, String> labels;

  public Metadata(
      SystemInfo system, ProcessInfo process, ServiceInfo service, Map<String, String> labels) {
    this.system = system;
    this.process = process;
    this.service = service;
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
  }

  public SystemInfo getSystem() {
    return system;
  }

  public ProcessInfo getProcess() {
    return process;
  }

  public ServiceInfo getService() {
    return service;
  }

  public Map<String, String> getLabels() {
    return labels;
  }
}
