package streamtrace.config;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import streamtrace.environment.EnvironmentVariables;

class ConfigProviderTest {

  private final EnvironmentVariables.EnvironmentVariablesProvider originalEnv =
      EnvironmentVariables.provider;

  @AfterEach
  void restore() {
    EnvironmentVariables.provider = originalEnv;
    System.clearProperty("streamtrace.service.name");
  }

  @Test
  void systemPropertiesWinOverEnvironment() {
    fakeEnvironment(Collections.singletonMap("STREAMTRACE_SERVICE_NAME", "from-env"));
    ConfigProvider provider = ConfigProvider.createDefault();
    assertEquals("from-env", provider.getString("service.name"));

    System.setProperty("streamtrace.service.name", "from-prop");
    assertEquals("from-prop", provider.getString("service.name"));
  }

  @Test
  void reportsOriginOfTheWinningSource() {
    fakeEnvironment(Collections.singletonMap("STREAMTRACE_SERVICE_NAME", "from-env"));
    ConfigProvider provider = ConfigProvider.createDefault();
    assertEquals(ConfigOrigin.ENV, provider.getOrigin("service.name"));
    assertEquals(ConfigOrigin.DEFAULT, provider.getOrigin("environment"));

    System.setProperty("streamtrace.service.name", "from-prop");
    assertEquals(ConfigOrigin.JVM_PROP, provider.getOrigin("service.name"));

    assertEquals(
        ConfigOrigin.CODE,
        ConfigProvider.withValues(Collections.singletonMap("active", "true")).getOrigin("active"));
  }

  @Test
  void missingKeyReturnsDefault() {
    fakeEnvironment(Collections.<String, String>emptyMap());
    ConfigProvider provider = ConfigProvider.createDefault();
    assertNull(provider.getString("service.name"));
    assertEquals("fallback", provider.getString("service.name", "fallback"));
    assertFalse(provider.isSet("service.name"));
  }

  @Test
  void typedGettersParseValues() {
    Map<String, String> values = new HashMap<>();
    values.put("active", "false");
    values.put("transaction.max.spans", "42");
    values.put("transaction.sample.rate", "0.25");
    values.put("api.request.time", "2s");
    values.put("api.buffer.size", "10KB");
    values.put("sanitize.field.names", "foo, *bar");
    ConfigProvider provider = ConfigProvider.withValues(values);

    assertFalse(provider.getBoolean("active", true));
    assertEquals(42, provider.getInteger("transaction.max.spans", 500));
    assertEquals(0.25, provider.getDouble("transaction.sample.rate", 1.0));
    assertEquals(2000, provider.getDurationMillis("api.request.time", 10_000, TimeUnit.SECONDS));
    assertEquals(10 * 1024, provider.getSize("api.buffer.size", 0));
    assertEquals(asList("foo", "*bar"), provider.getList("sanitize.field.names", null));
    assertTrue(provider.isSet("active"));
  }

  @Test
  void invalidValuesFallBackToDefaults() {
    Map<String, String> values = new HashMap<>();
    values.put("active", "maybe");
    values.put("transaction.max.spans", "many");
    values.put("transaction.sample.rate", "half");
    values.put("api.request.time", "later");
    values.put("api.buffer.size", "huge");
    ConfigProvider provider = ConfigProvider.withValues(values);

    assertTrue(provider.getBoolean("active", true));
    assertEquals(500, provider.getInteger("transaction.max.spans", 500));
    assertEquals(1.0, provider.getDouble("transaction.sample.rate", 1.0));
    assertEquals(10_000, provider.getDurationMillis("api.request.time", 10_000, TimeUnit.SECONDS));
    assertEquals(1024, provider.getSize("api.buffer.size", 1024));
  }

  private static void fakeEnvironment(final Map<String, String> env) {
    EnvironmentVariables.provider =
        new EnvironmentVariables.EnvironmentVariablesProvider() {
          @Override
          public String get(String name) {
            return env.get(name);
          }
        };
  }
}
