package com.gentoro.llmc.ast;

import java.util.Objects;

public record FileReferenceNode(
    String path,
    FileReferenceType referenceType,
    String lineReference,
    boolean absolute,
    SourceSpan span)
    implements AstNode {

  public FileReferenceNode {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(span, "span");
  }

  public FileReferenceNode withPath(String newPath) {
    return new FileReferenceNode(newPath, referenceType, lineReference, absolute, span);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FILE_REFERENCE;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitFileReference(this);
  }
}
