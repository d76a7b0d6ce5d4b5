package com.gentoro.llmc.parser;

import com.gentoro.llmc.lexer.LexerResult;
import java.util.Objects;

/**
 * Per-call inputs of {@link ResponseParser#parse(String, ParserContext)}.
 *
 * @param lexerResult tokens of the same text being parsed
 * @param preserveThoughts keep thought spans as nodes instead of dropping them
 * @param extractSemantics extract file references, questions, commands and similar elements
 */
public record ParserContext(
    String modelProvider,
    String modelName,
    boolean preserveThoughts,
    boolean extractSemantics,
    LexerResult lexerResult) {

  public ParserContext {
    modelProvider = modelProvider == null ? "" : modelProvider;
    modelName = modelName == null ? "" : modelName;
    Objects.requireNonNull(lexerResult, "lexerResult");
  }
}
