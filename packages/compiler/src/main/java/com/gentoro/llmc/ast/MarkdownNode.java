package com.gentoro.llmc.ast;

import java.util.Objects;

/**
 * A markdown structural marker.
 *
 * @param level heading level (1-6); 0 for other elements
 * @param marker the marker as written, e.g. {@code "##"}, {@code "-"} or {@code "1."}
 * @param text the rest of the marked line
 */
public record MarkdownNode(
    MarkdownElement element, int level, String marker, String text, SourceSpan span)
    implements AstNode {

  public MarkdownNode {
    Objects.requireNonNull(element, "element");
    marker = marker == null ? "" : marker;
    text = text == null ? "" : text;
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.MARKDOWN;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitMarkdown(this);
  }
}
