package com.gentoro.llmc.ast;

import java.util.Objects;

/** An error the model itself reports in its text. */
public record ErrorNode(String message, ErrorSeverity severity, SourceSpan span)
    implements AstNode {

  public ErrorNode {
    message = message == null ? "" : message;
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ERROR;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitError(this);
  }
}
