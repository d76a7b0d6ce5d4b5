package com.gentoro.llmc.exception;

import java.util.Map;

/** Structured error information for logs and diagnostics. */
public record ErrorDetails(
    String type, String message, LlmcErrorCode code, Map<String, Object> context) {

  /** Short {@code Type: message} form, or just the type when there is no message. */
  public String summary() {
    return message == null || message.isBlank() ? type : type + ": " + message;
  }
}
