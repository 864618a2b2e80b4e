package org.provisioner.config;

/**
 * Indicates an unreadable or invalid action plan configuration.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
