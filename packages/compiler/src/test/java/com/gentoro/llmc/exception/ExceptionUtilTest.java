package com.gentoro.llmc.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("llmc exceptions keep their code and context")
  void llmcException() {
    CompilationException e =
        new CompilationException("Compilation failed", Map.of("errors", 2));
    ErrorDetails details = ExceptionUtil.toErrorDetails(e);
    assertEquals("CompilationException", details.type());
    assertEquals(LlmcErrorCode.COMPILATION_ERROR, details.code());
    assertEquals(Map.of("errors", 2), details.context());
    assertEquals("CompilationException: Compilation failed", details.summary());
  }

  @Test
  @DisplayName("other throwables map to UNKNOWN and a message-less summary is the type")
  void otherThrowable() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(LlmcErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
    assertEquals("IllegalStateException", details.summary());
  }

  @Test
  @DisplayName("every error code is produced by some failure")
  void everyCodeInUse() {
    Set<LlmcErrorCode> produced =
        EnumSet.of(
            ExceptionUtil.toErrorDetails(new RuntimeException("x")).code(),
            new ValidationException("blank tool name").getCode(),
            new ConfigException("bad visibility").getCode(),
            new SerializationException("unreadable catalog").getCode(),
            new CompilationException("failed", Map.of()).getCode());
    assertEquals(EnumSet.allOf(LlmcErrorCode.class), produced);
  }

  @Test
  @DisplayName("compact stack traces are single-line and bounded")
  void compactStackTrace() {
    RuntimeException e = new RuntimeException("x");
    String one = ExceptionUtil.formatCompactStackTrace(e, 1);
    assertFalse(one.contains(" > "));
    assertTrue(one.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace"));
    assertTrue(ExceptionUtil.formatCompactStackTrace(e).contains(" > "));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  @DisplayName("toString names the code, the context and the cause")
  void describe() {
    ConfigException e = new ConfigException("bad value", new IllegalArgumentException("nope"));
    String text = e.toString();
    assertTrue(text.startsWith("ConfigException{code=CONFIGURATION_ERROR, message=bad value"));
    assertTrue(text.contains("cause=IllegalArgumentException"));
  }
}
