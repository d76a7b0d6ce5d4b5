package com.gentoro.llmc.semantic;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.CodeNode;
import com.gentoro.llmc.ast.CommandNode;
import com.gentoro.llmc.ast.CompilationPhase;
import com.gentoro.llmc.ast.Diagnostic;
import com.gentoro.llmc.ast.ErrorNode;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.FileReferenceType;
import com.gentoro.llmc.ast.NodeKind;
import com.gentoro.llmc.ast.QuestionNode;
import com.gentoro.llmc.ast.QuestionType;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.ToolCallNode;
import com.gentoro.llmc.ast.ToolCallSignature;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a response tree and summarizes it. The analyzer never changes the tree: question
 * normalization is returned as {@link QuestionRewrite}s for the tree's owner to apply.
 */
public class SemanticAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(SemanticAnalyzer.class);

  static final List<String> DEFAULT_YES_NO_OPTIONS = List.of("Yes", "No");
  private static final int MAX_QUESTIONS = 3;

  private static final Map<NodeKind, String> INTENTS = new EnumMap<>(NodeKind.class);

  static {
    INTENTS.put(NodeKind.TOOL_CALL, "ToolExecution");
    INTENTS.put(NodeKind.CODE, "CodeGeneration");
    INTENTS.put(NodeKind.QUESTION, "Clarification");
    INTENTS.put(NodeKind.ERROR, "ErrorReporting");
    INTENTS.put(NodeKind.COMMAND, "CommandExecution");
    INTENTS.put(NodeKind.TEXT, "Explanation");
  }

  private static final Pattern CD_COMMAND = Pattern.compile("^cd(?:\\s|$)");
  private static final Pattern RELATIVE_ARGUMENT =
      Pattern.compile("(?:^|\\s)(?:\\.{1,2}/|[\\w\\-]+/)[\\w\\-./]*");

  private final ToolSchemaRegistry schemas;

  public SemanticAnalyzer() {
    this(ToolSchemaRegistry.builtIn());
  }

  public SemanticAnalyzer(ToolSchemaRegistry schemas) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  public SemanticAnalysis analyze(ResponseNode tree, AnalysisOptions options) {
    AnalysisOptions opts = options == null ? AnalysisOptions.DEFAULT : options;
    List<Diagnostic> diagnostics = new ArrayList<>();

    List<ToolCallNode> calls = tree.childrenOfType(ToolCallNode.class);
    checkDuplicateCalls(calls, diagnostics);
    calls.forEach(call -> checkParameters(call, opts, diagnostics));
    checkFileConflicts(tree.childrenOfType(FileReferenceNode.class), diagnostics);
    checkControlFlow(tree.children(), diagnostics);
    checkCommands(tree.childrenOfType(CommandNode.class), diagnostics);
    tree.childrenOfType(CodeNode.class).forEach(code -> checkCode(code, diagnostics));

    List<QuestionNode> questions = tree.childrenOfType(QuestionNode.class);
    if (questions.size() > MAX_QUESTIONS) {
      diagnostics.add(
          Diagnostic.info(
              CompilationPhase.SEMANTIC,
              "Response asks %d questions; asking one at a time is clearer"
                  .formatted(questions.size()),
              null));
    }
    List<QuestionRewrite> rewrites = new ArrayList<>();
    for (QuestionNode q : questions) {
      if (q.type() == QuestionType.YES_NO && q.suggestedOptions().isEmpty()) {
        rewrites.add(new QuestionRewrite(q, q.withSuggestedOptions(DEFAULT_YES_NO_OPTIONS)));
      }
    }

    SemanticSummary summary = summarize(tree);
    log.debug(
        "Analyzed {} nodes: {} diagnostics, intent {}",
        summary.totalNodes(),
        diagnostics.size(),
        summary.primaryIntent());
    return new SemanticAnalysis(diagnostics, summary, rewrites);
  }

  private static void checkDuplicateCalls(List<ToolCallNode> calls, List<Diagnostic> out) {
    Set<ToolCallSignature> seen = new HashSet<>();
    for (ToolCallNode call : calls) {
      if (!seen.add(call.signature())) {
        out.add(
            Diagnostic.warning(
                CompilationPhase.SEMANTIC,
                "Duplicate tool call '%s' with identical arguments".formatted(call.toolName()),
                call));
      }
    }
  }

  private void checkParameters(ToolCallNode call, AnalysisOptions opts, List<Diagnostic> out) {
    Optional<ToolSchema> found = schemas.find(call.toolName());
    if (found.isEmpty()) {
      String message = "Unknown tool '%s'; parameters not checked".formatted(call.toolName());
      out.add(
          opts.strictMode()
              ? Diagnostic.warning(CompilationPhase.SEMANTIC, message, call)
              : Diagnostic.info(CompilationPhase.SEMANTIC, message, call));
      return;
    }
    ToolSchema schema = found.get();
    for (ParameterSchema required : schema.requiredParameters()) {
      boolean present =
          call.arguments().entrySet().stream()
              .anyMatch(e -> required.answersTo(e.getKey()) && e.getValue() != null);
      if (!present) {
        out.add(
            Diagnostic.error(
                CompilationPhase.SEMANTIC,
                "Tool '%s' is missing required parameter '%s'"
                    .formatted(call.toolName(), required.name()),
                call));
      }
    }
    for (Map.Entry<String, Object> arg : call.arguments().entrySet()) {
      Optional<ParameterSchema> param = schema.parameterFor(arg.getKey());
      if (param.isEmpty() || arg.getValue() == null || param.get().type().matches(arg.getValue())) {
        continue;
      }
      String message =
          "Parameter '%s' of tool '%s' should be %s but was %s"
              .formatted(
                  arg.getKey(),
                  call.toolName(),
                  param.get().type().label(),
                  jsonTypeOf(arg.getValue()));
      out.add(
          opts.strictMode()
              ? Diagnostic.error(CompilationPhase.SEMANTIC, message, call)
              : Diagnostic.warning(CompilationPhase.SEMANTIC, message, call));
    }
  }

  private static String jsonTypeOf(Object value) {
    if (value instanceof String) return "string";
    if (value instanceof Boolean) return "boolean";
    if (value instanceof Number) return "number";
    if (value instanceof List<?>) return "array";
    if (value instanceof Map<?, ?>) return "object";
    return value.getClass().getSimpleName();
  }

  private static void checkFileConflicts(List<FileReferenceNode> refs, List<Diagnostic> out) {
    Map<String, List<FileReferenceNode>> byPath = new LinkedHashMap<>();
    for (FileReferenceNode ref : refs) {
      byPath.computeIfAbsent(ref.path(), k -> new ArrayList<>()).add(ref);
    }
    for (Map.Entry<String, List<FileReferenceNode>> entry : byPath.entrySet()) {
      String path = entry.getKey();
      List<FileReferenceNode> group = entry.getValue();
      Optional<FileReferenceNode> delete = firstOfType(group, FileReferenceType.DELETE);
      Optional<FileReferenceNode> write =
          firstOfType(group, FileReferenceType.WRITE).or(() -> firstOfType(group, FileReferenceType.CREATE));
      if (delete.isPresent() && write.isPresent()) {
        out.add(
            Diagnostic.warning(
                CompilationPhase.SEMANTIC,
                "Conflicting operations on %s: both delete and %s"
                    .formatted(path, write.get().referenceType().name().toLowerCase()),
                delete.get()));
      }
      long creates =
          group.stream().filter(r -> r.referenceType() == FileReferenceType.CREATE).count();
      if (creates > 1) {
        out.add(
            Diagnostic.warning(
                CompilationPhase.SEMANTIC,
                "File %s is created %d times".formatted(path, creates),
                group.get(0)));
      }
    }
  }

  private static Optional<FileReferenceNode> firstOfType(
      List<FileReferenceNode> refs, FileReferenceType type) {
    return refs.stream().filter(r -> r.referenceType() == type).findFirst();
  }

  private static void checkControlFlow(List<AstNode> children, List<Diagnostic> out) {
    for (int i = 1; i < children.size(); i++) {
      AstNode previous = children.get(i - 1);
      if (children.get(i) instanceof QuestionNode q
          && (previous instanceof ToolCallNode || previous instanceof CommandNode)) {
        out.add(
            Diagnostic.info(
                CompilationPhase.SEMANTIC,
                "Question follows a %s; the answer may be delayed until it completes"
                    .formatted(previous instanceof ToolCallNode ? "tool call" : "command"),
                q));
      }
    }
  }

  private static void checkCommands(List<CommandNode> commands, List<Diagnostic> out) {
    boolean changedDirectory = false;
    for (CommandNode command : commands) {
      String line = command.command().trim();
      if (CD_COMMAND.matcher(line).find()) {
        changedDirectory = true;
      } else if (changedDirectory && RELATIVE_ARGUMENT.matcher(line).find()) {
        out.add(
            Diagnostic.info(
                CompilationPhase.SEMANTIC,
                "Command '%s' uses a relative path after a directory change".formatted(line),
                command));
      }
    }
  }

  private static void checkCode(CodeNode code, List<Diagnostic> out) {
    if (CodeHeuristics.hasIncompleteMarker(code.code())) {
      out.add(
          Diagnostic.info(
              CompilationPhase.SEMANTIC,
              "Code block looks incomplete (trailing ellipsis or TODO marker)",
              code));
    }
    if (!CodeHeuristics.isBalanced(code.code())) {
      out.add(
          Diagnostic.warning(
              CompilationPhase.SEMANTIC,
              "Code block%s has unbalanced brackets"
                  .formatted(code.language().isEmpty() ? "" : " (" + code.language() + ")"),
              code));
    }
  }

  /** Summary of a tree; pure and safe to call on any tree. */
  public static SemanticSummary summarize(ResponseNode tree) {
    Set<String> files = new LinkedHashSet<>();
    Set<String> tools = new LinkedHashSet<>();
    Map<String, Integer> votes = new LinkedHashMap<>();
    boolean hasToolCalls = false;
    boolean hasCode = false;
    boolean hasQuestions = false;
    boolean hasErrors = false;
    for (AstNode child : tree.children()) {
      if (child instanceof ToolCallNode call) {
        hasToolCalls = true;
        tools.add(call.toolName());
      } else if (child instanceof CodeNode) {
        hasCode = true;
      } else if (child instanceof QuestionNode) {
        hasQuestions = true;
      } else if (child instanceof ErrorNode) {
        hasErrors = true;
      } else if (child instanceof FileReferenceNode ref) {
        files.add(ref.path());
      }
      String intent = INTENTS.get(child.kind());
      if (intent != null) {
        votes.merge(intent, 1, Integer::sum);
      }
    }
    String primary = SemanticSummary.UNKNOWN_INTENT;
    int best = 0;
    for (Map.Entry<String, Integer> vote : votes.entrySet()) {
      if (vote.getValue() > best) {
        best = vote.getValue();
        primary = vote.getKey();
      }
    }
    return new SemanticSummary(
        hasToolCalls,
        hasCode,
        hasQuestions,
        hasErrors,
        tree.totalNodeCount(),
        new ArrayList<>(files),
        new ArrayList<>(tools),
        primary);
  }
}
