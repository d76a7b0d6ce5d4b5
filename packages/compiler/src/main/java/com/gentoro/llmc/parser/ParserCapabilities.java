package com.gentoro.llmc.parser;

import java.util.List;

/** Declared feature set of a parser variant. */
public record ParserCapabilities(
    String dialect,
    boolean supportsToolCalls,
    boolean supportsThoughts,
    boolean supportsTagDialect,
    boolean supportsToolResults,
    boolean supportsStreaming,
    List<String> extractionRules,
    List<String> scrubRules) {

  public ParserCapabilities {
    extractionRules = List.copyOf(extractionRules);
    scrubRules = List.copyOf(scrubRules);
  }
}
