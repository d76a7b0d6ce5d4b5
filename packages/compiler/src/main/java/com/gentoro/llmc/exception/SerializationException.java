package com.gentoro.llmc.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends LlmcException {
  public SerializationException(String message) {
    super(LlmcErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(LlmcErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
