package com.gentoro.llmc.ast;

import java.util.Objects;

/**
 * Scratchpad reasoning kept in the tree.
 *
 * @param originalText the full span as written, markers included
 */
public record ThoughtNode(String content, String originalText, boolean hidden, SourceSpan span)
    implements AstNode {

  public ThoughtNode {
    content = content == null ? "" : content;
    originalText = originalText == null ? "" : originalText;
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.THOUGHT;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitThought(this);
  }
}
