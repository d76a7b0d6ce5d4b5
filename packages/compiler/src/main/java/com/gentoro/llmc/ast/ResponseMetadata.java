package com.gentoro.llmc.ast;

/**
 * Facts about a compiled response as a whole.
 *
 * @param complete {@code false} when the text looks truncated
 * @param droppedToolCandidates tool-call candidates that could not be parsed
 */
public record ResponseMetadata(
    String modelProvider, String modelName, boolean complete, int droppedToolCandidates) {

  public static final ResponseMetadata EMPTY = new ResponseMetadata("", "", true, 0);

  public ResponseMetadata {
    modelProvider = modelProvider == null ? "" : modelProvider;
    modelName = modelName == null ? "" : modelName;
  }
}
