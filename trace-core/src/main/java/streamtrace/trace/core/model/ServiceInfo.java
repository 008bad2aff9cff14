package streamtrace.trace.core.model;

import java.util.regex.Pattern;
import javax.annotation.Nullable;
import streamtrace.environment.SystemProperties;

/** Identifies the instrumented service in the request metadata. */
public final class ServiceInfo {
  public static final String AGENT_NAME = "java";
  public static final String AGENT_VERSION = "0.1.0";

  private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z0-9 _-]+$");
  private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9 _-]");
  private static final String UNKNOWN_SERVICE = "unknown-java-service";

  private final String name;
  @Nullable private final String version;
  @Nullable private final String environment;
  private final String runtimeName;
  private final String runtimeVersion;

  public ServiceInfo(String name, @Nullable String version, @Nullable String environment) {
    this.name = name;
    this.version = version;
    this.environment = environment;
    this.runtimeName = SystemProperties.getOrDefault("java.vm.name", "java");
    this.runtimeVersion = SystemProperties.getOrDefault("java.version", "unknown");
  }

  public static boolean isValidName(String name) {
    return VALID_NAME.matcher(name).matches();
  }

  /** Replaces every character not allowed in a service name with an underscore. */
  public static String sanitizeName(String name) {
    return INVALID_NAME_CHARS.matcher(name).replaceAll("_");
  }

  /**
   * Derives a service name from the command that started the JVM: the jar file name without its
   * extension, or the simple name of the main class.
   */
  public static String defaultName(@Nullable String javaCommand) {
    if (javaCommand == null || javaCommand.trim().isEmpty()) {
      return UNKNOWN_SERVICE;
    }
    String main = javaCommand.trim().split("\\s+")[0];
    if (main.endsWith(".jar")) {
      main = main.substring(Math.max(main.lastIndexOf('/'), main.lastIndexOf('\\')) + 1);
      main = main.substring(0, main.length() - ".jar".length());
    } else {
      main = main.substring(main.lastIndexOf('.') + 1);
    }
    return main.isEmpty() ? UNKNOWN_SERVICE : sanitizeName(main);
  }

  public String getName() {
    return name;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  @Nullable
  public String getEnvironment() {
    return environment;
  }

  public String getRuntimeName() {
    return runtimeName;
  }

  public String getRuntimeVersion() {
    return runtimeVersion;
  }
}
