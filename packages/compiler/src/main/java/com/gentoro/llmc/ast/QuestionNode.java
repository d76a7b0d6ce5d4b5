package com.gentoro.llmc.ast;

import java.util.List;
import java.util.Objects;

/** A question the model asks the user. */
public record QuestionNode(
    String question, QuestionType type, List<String> suggestedOptions, SourceSpan span)
    implements AstNode {

  public QuestionNode {
    Objects.requireNonNull(question, "question");
    Objects.requireNonNull(type, "type");
    suggestedOptions = suggestedOptions == null ? List.of() : List.copyOf(suggestedOptions);
    Objects.requireNonNull(span, "span");
  }

  public QuestionNode withSuggestedOptions(List<String> options) {
    return new QuestionNode(question, type, options, span);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.QUESTION;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitQuestion(this);
  }
}
