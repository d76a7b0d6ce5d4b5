package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.Severity;
import java.util.List;

/**
 * Structural check of a tree against what a parser variant guarantees.
 *
 * @param valid {@code false} iff any issue has {@link Severity#ERROR}
 */
public record ValidationResult(boolean valid, List<ValidationIssue> issues) {
  public ValidationResult {
    issues = List.copyOf(issues);
  }

  public static ValidationResult of(List<ValidationIssue> issues) {
    boolean valid = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
    return new ValidationResult(valid, issues);
  }
}
