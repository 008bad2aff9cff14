package streamtrace.trace.core.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.environment.EnvironmentVariables;
import streamtrace.environment.SystemProperties;

public final class SystemInfo {
  private static final Logger log = LoggerFactory.getLogger(SystemInfo.class);

  private final String hostname;
  private final String architecture;
  private final String platform;

  public SystemInfo(String hostname, String architecture, String platform) {
    this.hostname = hostname;
    this.architecture = architecture;
    this.platform = platform;
  }

  public static SystemInfo current() {
    return new SystemInfo(
        hostname(),
        SystemProperties.getOrDefault("os.arch", "unknown"),
        SystemProperties.getOrDefault("os.name", "unknown").toLowerCase(Locale.ROOT));
  }

  private static String hostname() {
    String fromEnv = EnvironmentVariables.get("HOSTNAME");
    if (fromEnv != null && !fromEnv.isEmpty()) {
      return fromEnv;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException e) {
      log.debug("Unable to resolve hostname", e);
      return "unknown";
    }
  }

  public String getHostname() {
    return hostname;
  }

  public String getArchitecture() {
    return architecture;
  }

  public String getPlatform() {
    return platform;
  }
}
