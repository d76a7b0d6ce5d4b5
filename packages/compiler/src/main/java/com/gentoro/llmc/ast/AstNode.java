package com.gentoro.llmc.ast;

/**
 * A node of the response tree. The set of node kinds is closed; consumers that need per-kind
 * behavior implement {@link AstVisitor}, so adding a kind breaks every visitor at compile time.
 *
 * <p>Leaf nodes are immutable records. Only {@link ResponseNode} holds children.
 */
public sealed interface AstNode
    permits ResponseNode,
        TextNode,
        ToolCallNode,
        ToolResultNode,
        CodeNode,
        FileReferenceNode,
        QuestionNode,
        ThoughtNode,
        ErrorNode,
        CommandNode,
        MarkdownNode {

  NodeKind kind();

  /** Location in the compiled source text. */
  SourceSpan span();

  <R> R accept(AstVisitor<R> visitor);
}
