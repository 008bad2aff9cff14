package streamtrace.config;

import static streamtrace.config.ConfigOrigin.JVM_PROP;
import static streamtrace.config.ConfigStrings.propertyNameToSystemPropertyName;

import streamtrace.environment.SystemProperties;

public final class SystemPropertiesConfigSource extends ConfigProvider.Source {
  @Override
  protected String get(String key) {
    return SystemProperties.get(propertyNameToSystemPropertyName(key));
  }

  @Override
  public ConfigOrigin origin() {
    return JVM_PROP;
  }
}
