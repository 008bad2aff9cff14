package streamtrace.config;

import java.util.Locale;
import javax.annotation.Nonnull;

public final class ConfigStrings {

  static final String SYSTEM_PROPERTY_PREFIX = "streamtrace.";
  static final String ENVIRONMENT_VARIABLE_PREFIX = "STREAMTRACE_";

  private ConfigStrings() {}

  public static String toEnvVar(String string) {
    return string.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  /**
   * Converts the property name, e.g. 'service.name' into a public environment variable name, e.g.
   * `STREAMTRACE_SERVICE_NAME`.
   *
   * @param setting The setting name, e.g. `service.name`
   * @return The public facing environment variable name
   */
  @Nonnull
  public static String propertyNameToEnvironmentVariableName(final String setting) {
    return ENVIRONMENT_VARIABLE_PREFIX + toEnvVar(setting);
  }

  /**
   * Converts the property name, e.g. 'service.name' into a public system property name, e.g.
   * `streamtrace.service.name`.
   *
   * @param setting The setting name, e.g. `service.name`
   * @return The public facing system property name
   */
  @Nonnull
  public static String propertyNameToSystemPropertyName(final String setting) {
    return SYSTEM_PROPERTY_PREFIX + setting;
  }
}
