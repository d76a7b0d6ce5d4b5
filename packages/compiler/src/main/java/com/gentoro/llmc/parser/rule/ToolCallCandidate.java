package com.gentoro.llmc.parser.rule;

import com.gentoro.llmc.ast.SourceSpan;

/**
 * A span of text that one rule believes is a tool call.
 *
 * @param span the text to remove when the candidate is accepted
 * @param json the JSON part of the span, handed to JSON repair
 */
public record ToolCallCandidate(String rule, SourceSpan span, String json) {}
