package com.gentoro.llmc.exception;

/**
 * Canonical error codes for llmc. Codes are stable and suitable for callers that map failures to
 * their own reporting. Prefer the most specific code that reflects the failure origin.
 */
public enum LlmcErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  COMPILATION_ERROR,
}
