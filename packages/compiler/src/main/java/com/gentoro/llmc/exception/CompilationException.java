package com.gentoro.llmc.exception;

import java.util.Map;

/** A compilation finished with error diagnostics and the caller asked for a hard failure. */
public class CompilationException extends LlmcException {
  public CompilationException(String message, Map<String, ?> context) {
    super(LlmcErrorCode.COMPILATION_ERROR, message, context);
  }
}
