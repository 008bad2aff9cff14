package streamtrace.environment;

import javax.annotation.Nullable;

/** Reads environment variables, treating a security manager refusal as an unset variable. */
public final class EnvironmentVariables {
  private EnvironmentVariables() {}

  public static class EnvironmentVariablesProvider {
    public String get(String name) {
      return System.getenv(name);
    }
  }

  // Swapped by tests.
  public static EnvironmentVariablesProvider provider = new EnvironmentVariablesProvider();

  /**
   * @return the variable value, {@code null} if missing or not readable
   */
  public static @Nullable String get(String name) {
    return getOrDefault(name, null);
  }

  public static String getOrDefault(String name, String defaultValue) {
    if (name == null) {
      return defaultValue;
    }
    try {
      String value = provider.get(name);
      return value == null ? defaultValue : value;
    } catch (SecurityException e) {
      return defaultValue;
    }
  }
}
