package io.intellixity.sqlbind.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Process-level switches read from system properties, then environment variables.\n
 *
 * - {@code sqlbind.debug.param} / {@code SQLBIND_DEBUG_PARAM}: include parameter values in request dumps.
 *   Only {@code true} (any case) turns it on; unrecognised values are logged and treated as off.\n
 */
public record SqlbindSettings(boolean debugParam) {
  private static final Logger log = LoggerFactory.getLogger(SqlbindSettings.class);

  public static final String DEBUG_PARAM_PROPERTY = "sqlbind.debug.param";
  public static final String DEBUG_PARAM_ENV = "SQLBIND_DEBUG_PARAM";

  private static volatile SqlbindSettings current;

  public static SqlbindSettings defaults() {
    return new SqlbindSettings(false);
  }

  /** Settings of this process, resolved once. */
  public static SqlbindSettings fromEnvironment() {
    SqlbindSettings s = current;
    if (s == null) {
      synchronized (SqlbindSettings.class) {
        s = current;
        if (s == null) {
          s = fromSources(System::getProperty, System::getenv);
          current = s;
        }
      }
    }
    return s;
  }

  public static SqlbindSettings fromSources(Function<String, String> properties, Function<String, String> env) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(env, "env");
    String raw = properties.apply(DEBUG_PARAM_PROPERTY);
    String source = DEBUG_PARAM_PROPERTY;
    if (raw == null || raw.isBlank()) {
      raw = env.apply(DEBUG_PARAM_ENV);
      source = DEBUG_PARAM_ENV;
    }
    boolean debugParam = parseFlag(source, raw);
    if (debugParam) {
      log.warn("sqlbind.settings {}=true: parameter values, including redacted ones, will appear in request dumps", source);
    }
    return new SqlbindSettings(debugParam);
  }

  private static boolean parseFlag(String source, String raw) {
    if (raw == null || raw.isBlank()) return false;
    String v = raw.trim().toLowerCase(Locale.ROOT);
    if (v.equals("true")) return true;
    if (!v.equals("false")) {
      log.warn("sqlbind.settings ignoring {}={}: expected true or false, treating as false", source, raw);
    }
    return false;
  }
}
