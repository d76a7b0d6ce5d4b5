package com.gentoro.llmc.ast;

/** Identity of a tool call for duplicate detection: tool name plus canonical arguments. */
public record ToolCallSignature(String toolName, String canonicalArguments) {
  @Override
  public String toString() {
    return toolName + canonicalArguments;
  }
}
