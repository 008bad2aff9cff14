package streamtrace.config;

import static streamtrace.config.ConfigOrigin.ENV;
import static streamtrace.config.ConfigStrings.propertyNameToEnvironmentVariableName;

import streamtrace.environment.EnvironmentVariables;

final class EnvironmentConfigSource extends ConfigProvider.Source {
  @Override
  protected String get(String key) {
    return EnvironmentVariables.get(propertyNameToEnvironmentVariableName(key));
  }

  @Override
  public ConfigOrigin origin() {
    return ENV;
  }
}
