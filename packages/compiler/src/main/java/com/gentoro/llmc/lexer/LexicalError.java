package com.gentoro.llmc.lexer;

import com.gentoro.llmc.ast.Severity;

/** Tokenization ambiguity. Never thrown; reported alongside the tokens. */
public record LexicalError(Severity severity, String message, int offset, int line, int column) {}
