package streamtrace.environment;

import javax.annotation.Nullable;

/** Safely queries system properties against security manager. */
public final class SystemProperties {
  private SystemProperties() {}

  /**
   * Gets a system property value.
   *
   * @param property The system property name.
   * @return The system property value, {@code null} if missing, can't be retrieved, or the system
   *     property name is {@code null}.
   */
  public static @Nullable String get(String property) {
    return getOrDefault(property, null);
  }

  public static String getOrDefault(String property, String defaultValue) {
    if (property == null) {
      return defaultValue;
    }
    try {
      return System.getProperty(property, defaultValue);
    } catch (SecurityException ignored) {
      return defaultValue;
    }
  }
}
