package com.gentoro.llmc.ast;

/** Pipeline phase a {@link Diagnostic} originates from, in execution order. */
public enum CompilationPhase {
  LEXICAL,
  PARSING,
  SEMANTIC,
  OPTIMIZATION,
  VALIDATION
}
