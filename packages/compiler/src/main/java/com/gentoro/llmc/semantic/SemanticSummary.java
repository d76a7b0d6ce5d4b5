package com.gentoro.llmc.semantic;

import java.util.List;

/**
 * What a response is about, derived from its tree.
 *
 * @param totalNodes node count including the root
 * @param fileReferences distinct referenced paths in first-seen order
 * @param toolsUsed distinct tool names in first-seen order
 * @param primaryIntent majority intent label, or {@code Unknown} for an empty tree
 */
public record SemanticSummary(
    boolean hasToolCalls,
    boolean hasCode,
    boolean hasQuestions,
    boolean hasErrors,
    int totalNodes,
    List<String> fileReferences,
    List<String> toolsUsed,
    String primaryIntent) {

  public static final String UNKNOWN_INTENT = "Unknown";

  public static final SemanticSummary EMPTY =
      new SemanticSummary(false, false, false, false, 0, List.of(), List.of(), UNKNOWN_INTENT);

  public SemanticSummary {
    fileReferences = List.copyOf(fileReferences);
    toolsUsed = List.copyOf(toolsUsed);
  }
}
