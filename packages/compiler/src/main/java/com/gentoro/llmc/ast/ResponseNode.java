package com.gentoro.llmc.ast;

import com.gentoro.llmc.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of a response tree. Owns an ordered list of leaf nodes.
 *
 * <p>A tree is built fresh by a parser for every compile call. After that only two owners may
 * change the child list, both synchronously and before rendering: the compiler when it applies
 * analyzer rewrites, and the optimizer. Everything downstream treats the tree as read-only.
 */
public final class ResponseNode implements AstNode {
  private final List<AstNode> children = new ArrayList<>();
  private final ResponseMetadata metadata;
  private final SourceSpan span;

  public ResponseNode(ResponseMetadata metadata, SourceSpan span) {
    this.metadata = metadata == null ? ResponseMetadata.EMPTY : metadata;
    this.span = Objects.requireNonNull(span, "span");
  }

  public ResponseMetadata metadata() {
    return metadata;
  }

  /** Read-only view of the children in order. */
  public List<AstNode> children() {
    return Collections.unmodifiableList(children);
  }

  public void add(AstNode child) {
    checkChild(child);
    children.add(child);
  }

  /** Replace the whole child list. */
  public void setChildren(List<? extends AstNode> newChildren) {
    newChildren.forEach(ResponseNode::checkChild);
    children.clear();
    children.addAll(newChildren);
  }

  /**
   * Replace the child at the same position as {@code original} (identity match).
   *
   * @return whether a child was replaced
   */
  public boolean replace(AstNode original, AstNode replacement) {
    checkChild(replacement);
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == original) {
        children.set(i, replacement);
        return true;
      }
    }
    return false;
  }

  public <T extends AstNode> List<T> childrenOfType(Class<T> type) {
    List<T> out = new ArrayList<>();
    for (AstNode child : children) {
      if (type.isInstance(child)) {
        out.add(type.cast(child));
      }
    }
    return out;
  }

  /** Node count including this root. */
  public int totalNodeCount() {
    return children.size() + 1;
  }

  private static void checkChild(AstNode child) {
    if (child == null) {
      throw new ValidationException("Response children must not be null");
    }
    if (child instanceof ResponseNode) {
      throw new ValidationException("A response node cannot be nested in another response");
    }
  }

  @Override
  public NodeKind kind() {
    return NodeKind.RESPONSE;
  }

  @Override
  public SourceSpan span() {
    return span;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitResponse(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResponseNode other)) return false;
    return children.equals(other.children)
        && metadata.equals(other.metadata)
        && span.equals(other.span);
  }

  @Override
  public int hashCode() {
    return Objects.hash(children, metadata, span);
  }

  @Override
  public String toString() {
    return "ResponseNode{children=" + children + ", metadata=" + metadata + '}';
  }
}
