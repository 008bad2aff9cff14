package streamtrace.config;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConfigConverterTest {

  @Test
  void parsesBooleans() {
    assertTrue(ConfigConverter.parseBoolean("true"));
    assertTrue(ConfigConverter.parseBoolean(" TRUE "));
    assertTrue(ConfigConverter.parseBoolean("1"));
    assertFalse(ConfigConverter.parseBoolean("false"));
    assertFalse(ConfigConverter.parseBoolean("0"));
    assertThrows(IllegalArgumentException.class, () -> ConfigConverter.parseBoolean("yes"));
  }

  @Test
  void parsesDurationsWithUnits() {
    assertEquals(5, ConfigConverter.parseDurationMillis("5ms", TimeUnit.SECONDS));
    assertEquals(10_000, ConfigConverter.parseDurationMillis("10s", TimeUnit.MILLISECONDS));
    assertEquals(60_000, ConfigConverter.parseDurationMillis("1m", TimeUnit.MILLISECONDS));
    assertEquals(-5, ConfigConverter.parseDurationMillis("-5ms", TimeUnit.SECONDS));
  }

  @Test
  void bareDurationUsesDefaultUnit() {
    assertEquals(30_000, ConfigConverter.parseDurationMillis("30", TimeUnit.SECONDS));
    assertEquals(30, ConfigConverter.parseDurationMillis("30", TimeUnit.MILLISECONDS));
  }

  @Test
  void rejectsBadDurations() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigConverter.parseDurationMillis("soon", TimeUnit.SECONDS));
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigConverter.parseDurationMillis("", TimeUnit.SECONDS));
  }

  @Test
  void parsesSizes() {
    assertEquals(750 * 1024, ConfigConverter.parseSize("750KB"));
    assertEquals(1024 * 1024, ConfigConverter.parseSize("1mb"));
    assertEquals(2L * 1024 * 1024 * 1024, ConfigConverter.parseSize("2GB"));
    assertEquals(100, ConfigConverter.parseSize("100B"));
    assertEquals(100, ConfigConverter.parseSize("100"));
    assertThrows(IllegalArgumentException.class, () -> ConfigConverter.parseSize("-1KB"));
    assertThrows(IllegalArgumentException.class, () -> ConfigConverter.parseSize("big"));
  }

  @Test
  void parsesLists() {
    assertEquals(asList("a", "b*", "*c"), ConfigConverter.parseList("a, b* ,, *c,"));
    assertTrue(ConfigConverter.parseList("  ").isEmpty());
  }
}
