package org.provisioner.util;

import java.util.Map;

/**
 * Utility for reading settings from environment variables.
 */
public final class Env {

  private Env() {
  }

  /**
   * Reads a boolean flag, falling back to {@code defaultValue} when the variable is unset.
   *
   * @throws IllegalArgumentException if the variable is set to something other than true/false
   */
  public static boolean getBoolean(final Map<String, String> env, final String key, final boolean defaultValue) {
    final String value = env.get(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    final String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    } else if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException(String.format("Environment variable %s is not a boolean: '%s'", key, value));
  }

  public static String getString(final Map<String, String> env, final String key, final String defaultValue) {
    final String value = env.get(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    return value.trim();
  }
}
