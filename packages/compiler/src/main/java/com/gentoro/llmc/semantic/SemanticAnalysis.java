package com.gentoro.llmc.semantic;

import com.gentoro.llmc.ast.Diagnostic;
import java.util.List;

public record SemanticAnalysis(
    List<Diagnostic> diagnostics, SemanticSummary summary, List<QuestionRewrite> questionRewrites) {
  public SemanticAnalysis {
    diagnostics = List.copyOf(diagnostics);
    questionRewrites = List.copyOf(questionRewrites);
  }
}
