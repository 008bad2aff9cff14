package streamtrace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ConfigStringsTest {

  @Test
  void mapsSettingNames() {
    assertEquals(
        "STREAMTRACE_API_REQUEST_TIME",
        ConfigStrings.propertyNameToEnvironmentVariableName("api.request.time"));
    assertEquals(
        "streamtrace.api.request.time",
        ConfigStrings.propertyNameToSystemPropertyName("api.request.time"));
    assertEquals("SPAN_FRAMES_MIN", ConfigStrings.toEnvVar("span-frames.min"));
  }
}
