package com.gentoro.llmc.exception;

/** Configuration problem: unreadable file or a value that cannot be interpreted. */
public class ConfigException extends LlmcException {
  public ConfigException(String message) {
    super(LlmcErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LlmcErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
