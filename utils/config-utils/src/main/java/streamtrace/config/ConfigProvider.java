package streamtrace.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads settings from an ordered list of sources, the first source holding a key wins.
 *
 * <p>Typed getters never throw: a value that cannot be parsed is logged and the supplied default
 * is returned instead.
 */
public final class ConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  public abstract static class Source {
    protected abstract String get(String key);

    public abstract ConfigOrigin origin();
  }

  private final Source[] sources;

  public ConfigProvider(Source... sources) {
    this.sources = sources;
  }

  /** System properties first, then environment variables. */
  public static ConfigProvider createDefault() {
    return new ConfigProvider(new SystemPropertiesConfigSource(), new EnvironmentConfigSource());
  }

  /** A provider over fixed values, used when settings are supplied programmatically. */
  public static ConfigProvider withValues(Map<String, String> values) {
    return new ConfigProvider(new MapConfigSource(values));
  }

  @Nullable
  public String getString(String key) {
    return getString(key, null);
  }

  public String getString(String key, String defaultValue) {
    for (Source source : sources) {
      String value = source.get(key);
      if (value != null) {
        return value;
      }
    }
    return defaultValue;
  }

  /** Where the value of {@code key} comes from, {@link ConfigOrigin#DEFAULT} if no source has it. */
  public ConfigOrigin getOrigin(String key) {
    for (Source source : sources) {
      if (source.get(key) != null) {
        return source.origin();
      }
    }
    return ConfigOrigin.DEFAULT;
  }

  public boolean isSet(String key) {
    return getString(key) != null;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return ConfigConverter.parseBoolean(value);
    } catch (IllegalArgumentException e) {
      return invalid(key, value, defaultValue, e);
    }
  }

  public int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return invalid(key, value, defaultValue, e);
    }
  }

  public double getDouble(String key, double defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return invalid(key, value, defaultValue, e);
    }
  }

  public long getDurationMillis(String key, long defaultMillis, TimeUnit defaultUnit) {
    String value = getString(key);
    if (value == null) {
      return defaultMillis;
    }
    try {
      return ConfigConverter.parseDurationMillis(value, defaultUnit);
    } catch (IllegalArgumentException e) {
      return invalid(key, value, defaultMillis, e);
    }
  }

  public long getSize(String key, long defaultBytes) {
    String value = getString(key);
    if (value == null) {
      return defaultBytes;
    }
    try {
      return ConfigConverter.parseSize(value);
    } catch (IllegalArgumentException e) {
      return invalid(key, value, defaultBytes, e);
    }
  }

  public List<String> getList(String key, List<String> defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    return ConfigConverter.parseList(value);
  }

  private <T> T invalid(String key, String value, T defaultValue, Exception e) {
    log.warn(
        "Invalid value '{}' for setting '{}' from {} ({}), using default {}",
        value,
        key,
        getOrigin(key).value,
        e.getMessage(),
        defaultValue);
    return defaultValue;
  }

  static final class MapConfigSource extends Source {
    private final Map<String, String> values;

    MapConfigSource(Map<String, String> values) {
      this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    @Override
    protected String get(String key) {
      return values.get(key);
    }

    @Override
    public ConfigOrigin origin() {
      return ConfigOrigin.CODE;
    }
  }
}
