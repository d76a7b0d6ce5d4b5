package com.gentoro.llmc.compiler;

import com.gentoro.llmc.ast.Diagnostic;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.Severity;
import com.gentoro.llmc.exception.CompilationException;
import com.gentoro.llmc.lexer.Token;
import com.gentoro.llmc.semantic.SemanticSummary;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one compile call.
 *
 * @param diagnostics findings of every phase, in phase order
 * @param elapsed wall-clock time of the call
 * @param success {@code false} iff {@code diagnostics} contains an error
 */
public record CompilationResult(
    List<Token> tokens,
    ResponseNode tree,
    SemanticSummary summary,
    List<Diagnostic> diagnostics,
    Duration elapsed,
    boolean success) {

  public CompilationResult {
    tokens = List.copyOf(tokens);
    diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> errors() {
    return ofSeverity(Severity.ERROR);
  }

  public List<Diagnostic> warnings() {
    return ofSeverity(Severity.WARNING);
  }

  public List<Diagnostic> ofSeverity(Severity severity) {
    return diagnostics.stream().filter(d -> d.severity() == severity).toList();
  }

  /**
   * Returns this result, or throws when the compilation failed.
   *
   * @throws CompilationException carrying the error messages as context
   */
  public CompilationResult requireSuccess() {
    if (success) {
      return this;
    }
    List<Diagnostic> errors = errors();
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("errors", errors.stream().map(Diagnostic::toString).toList());
    context.put("elapsedMillis", elapsed.toMillis());
    String first = errors.isEmpty() ? "unknown error" : errors.get(0).message();
    throw new CompilationException(
        "Compilation failed with %d error(s): %s".formatted(errors.size(), first), context);
  }
}
