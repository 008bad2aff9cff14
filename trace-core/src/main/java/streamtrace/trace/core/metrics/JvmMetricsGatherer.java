package streamtrace.trace.core.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/** Reports memory, thread and CPU usage of the JVM and its host. */
public final class JvmMetricsGatherer implements MetricsGatherer {

  private final MemoryMXBean memory;
  private final ThreadMXBean threads;
  private final OperatingSystemMXBean os;

  public JvmMetricsGatherer() {
    this(
        ManagementFactory.getMemoryMXBean(),
        ManagementFactory.getThreadMXBean(),
        ManagementFactory.getOperatingSystemMXBean());
  }

  JvmMetricsGatherer(MemoryMXBean memory, ThreadMXBean threads, OperatingSystemMXBean os) {
    this.memory = memory;
    this.threads = threads;
    this.os = os;
  }

  @Override
  public void gatherMetrics(Metrics metrics) {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    metrics.add("jvm.memory.heap.used", heap.getUsed());
    metrics.add("jvm.memory.heap.committed", heap.getCommitted());
    if (heap.getMax() >= 0) {
      metrics.add("jvm.memory.heap.max", heap.getMax());
    }
    MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();
    metrics.add("jvm.memory.non_heap.used", nonHeap.getUsed());
    metrics.add("jvm.memory.non_heap.committed", nonHeap.getCommitted());

    metrics.add("jvm.thread.count", threads.getThreadCount());

    double loadAverage = os.getSystemLoadAverage();
    if (loadAverage >= 0) {
      metrics.add("system.load.average.1m", loadAverage);
    }
    if (os instanceof com.sun.management.OperatingSystemMXBean) {
      com.sun.management.OperatingSystemMXBean sunOs = (com.sun.management.OperatingSystemMXBean) os;
      addRatio(metrics, "system.cpu.total.norm.pct", sunOs.getSystemCpuLoad());
      addRatio(metrics, "system.process.cpu.total.norm.pct", sunOs.getProcessCpuLoad());
      metrics.add("system.memory.total", sunOs.getTotalPhysicalMemorySize());
      metrics.add("system.memory.actual.free", sunOs.getFreePhysicalMemorySize());
      metrics.add("system.process.memory.size", sunOs.getCommittedVirtualMemorySize());
    }
  }

  private static void addRatio(Metrics metrics, String name, double value) {
    // negative when not yet available
    if (value >= 0) {
      metrics.add(name, value);
    }
  }

  @Override
  public String toString() {
    return "JvmMetricsGatherer";
  }
}
