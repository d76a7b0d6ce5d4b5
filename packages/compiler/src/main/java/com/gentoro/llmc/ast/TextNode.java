package com.gentoro.llmc.ast;

import java.util.Objects;

/** Prose left over after every structured element was extracted. */
public record TextNode(String content, TextFormat format, SourceSpan span) implements AstNode {
  public TextNode {
    content = content == null ? "" : content;
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(span, "span");
  }

  public boolean isBlank() {
    return content.isBlank();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TEXT;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitText(this);
  }
}
