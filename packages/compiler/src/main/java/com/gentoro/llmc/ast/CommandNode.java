package com.gentoro.llmc.ast;

import java.util.Objects;

/** A shell-style command line ({@code $ make test}). */
public record CommandNode(String command, SourceSpan span) implements AstNode {
  public CommandNode {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.COMMAND;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCommand(this);
  }
}
