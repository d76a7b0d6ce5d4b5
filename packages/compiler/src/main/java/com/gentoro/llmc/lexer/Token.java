package com.gentoro.llmc.lexer;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.Objects;

/**
 * A lexical span of the response text.
 *
 * @param start inclusive offset
 * @param end exclusive offset
 * @param line 1-based line of {@code start}
 * @param column 1-based column of {@code start}
 * @param attribute kind-specific detail (fence language, tag name, heading level), or {@code null}
 */
public record Token(
    TokenType type, String text, int start, int end, int line, int column, String attribute) {

  public Token {
    Objects.requireNonNull(type, "type");
    text = text == null ? "" : text;
  }

  public SourceSpan span() {
    return new SourceSpan(start, end);
  }

  public boolean is(TokenType other) {
    return type == other;
  }

  @Override
  public String toString() {
    return "%s[%d,%d)%s".formatted(type, start, end, attribute == null ? "" : "<" + attribute + ">");
  }
}
