package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.ResponseNode;

/**
 * Turns the text of one model response into a response tree. One implementation exists per model
 * dialect; {@link ParserRegistry} picks one per compiler.
 *
 * <p>Implementations never throw from {@link #parse}: in the worst case the whole text becomes a
 * single text node.
 */
public interface ResponseParser {

  ResponseNode parse(String text, ParserContext context);

  ValidationResult validate(ResponseNode tree);

  ParserCapabilities capabilities();
}
