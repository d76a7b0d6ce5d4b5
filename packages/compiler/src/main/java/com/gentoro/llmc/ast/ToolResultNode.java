package com.gentoro.llmc.ast;

import java.util.Objects;

/** A tool result echoed back inside the model text. */
public record ToolResultNode(
    String toolName,
    String callId,
    String result,
    boolean success,
    String errorMessage,
    SourceSpan span)
    implements AstNode {

  public ToolResultNode {
    toolName = toolName == null ? "" : toolName;
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TOOL_RESULT;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitToolResult(this);
  }
}
