package com.gentoro.llmc.lexer;

import com.gentoro.llmc.ast.Severity;
import java.util.List;

public record LexerResult(List<Token> tokens, List<LexicalError> errors) {
  public LexerResult {
    tokens = List.copyOf(tokens);
    errors = List.copyOf(errors);
  }

  public boolean hasErrors() {
    return errors.stream().anyMatch(e -> e.severity() == Severity.ERROR);
  }

  public List<Token> tokensOfType(TokenType type) {
    return tokens.stream().filter(t -> t.type() == type).toList();
  }
}
