package com.gentoro.llmc.ast;

import java.util.Objects;

/**
 * A structured finding produced by one compilation phase.
 *
 * @param line 1-based line, or {@code null} when the finding has no position
 * @param column 1-based column, or {@code null} when the finding has no position
 * @param node the offending node, if any
 */
public record Diagnostic(
    Severity severity,
    String message,
    CompilationPhase phase,
    Integer line,
    Integer column,
    AstNode node) {

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(phase, "phase");
    message = message == null ? "" : message;
  }

  public static Diagnostic info(CompilationPhase phase, String message, AstNode node) {
    return new Diagnostic(Severity.INFO, message, phase, null, null, node);
  }

  public static Diagnostic warning(CompilationPhase phase, String message, AstNode node) {
    return new Diagnostic(Severity.WARNING, message, phase, null, null, node);
  }

  public static Diagnostic error(CompilationPhase phase, String message, AstNode node) {
    return new Diagnostic(Severity.ERROR, message, phase, null, null, node);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public boolean hasPosition() {
    return line != null;
  }

  public Diagnostic withPosition(int line, int column) {
    return new Diagnostic(severity, message, phase, line, column, node);
  }

  @Override
  public String toString() {
    String where = hasPosition() ? " (%d:%d)".formatted(line, column) : "";
    return "[%s/%s]%s %s".formatted(phase, severity, where, message);
  }
}
