package com.gentoro.llmc.ast;

import java.util.Objects;

/**
 * A fenced code block.
 *
 * @param language lower-cased fence language, empty when the fence had none
 * @param fileName file name announced in the first body line, or {@code null}
 * @param executable whether the language is a shell dialect
 * @param complete {@code false} when the closing fence is missing
 */
public record CodeNode(
    String language,
    String code,
    String fileName,
    boolean executable,
    boolean complete,
    SourceSpan span)
    implements AstNode {

  public CodeNode {
    language = language == null ? "" : language;
    code = code == null ? "" : code;
    Objects.requireNonNull(span, "span");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CODE;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCode(this);
  }
}
