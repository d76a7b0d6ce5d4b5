package com.gentoro.llmc.exception;

/** Illegal argument passed to a public llmc API. */
public class ValidationException extends LlmcException {
  public ValidationException(String message) {
    super(LlmcErrorCode.INVALID_ARGUMENT, message);
  }
}
