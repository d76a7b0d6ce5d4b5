package com.gentoro.llmc.ast;

public interface AstVisitor<R> {
  R visitResponse(ResponseNode node);

  R visitText(TextNode node);

  R visitToolCall(ToolCallNode node);

  R visitToolResult(ToolResultNode node);

  R visitCode(CodeNode node);

  R visitFileReference(FileReferenceNode node);

  R visitQuestion(QuestionNode node);

  R visitThought(ThoughtNode node);

  R visitError(ErrorNode node);

  R visitCommand(CommandNode node);

  R visitMarkdown(MarkdownNode node);
}
