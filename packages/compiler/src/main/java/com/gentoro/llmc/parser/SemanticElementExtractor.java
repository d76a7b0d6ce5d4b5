package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.CommandNode;
import com.gentoro.llmc.ast.ErrorNode;
import com.gentoro.llmc.ast.ErrorSeverity;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.FileReferenceType;
import com.gentoro.llmc.ast.QuestionNode;
import com.gentoro.llmc.ast.QuestionType;
import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.ast.TextFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern rules for the semantic elements found in residual prose: file references, questions,
 * shell commands and model-reported errors. Each rule maps its matches through {@code
 * toOriginal}, so node spans point into the text the parser received.
 */
public final class SemanticElementExtractor {

  static final Pattern FILE_PATH =
      Pattern.compile(
          "(?<![\\w/\\\\.:])(?<path>"
              + "(?:[A-Za-z]:)?(?:[/\\\\][\\w\\-.]+)+"
              + "|\\.{1,2}[/\\\\][\\w\\-.]+(?:[/\\\\][\\w\\-.]+)*"
              + "|[\\w\\-]+(?:[/\\\\][\\w\\-.]+)*[/\\\\][\\w\\-]+\\.[A-Za-z0-9]+"
              + ")(?<line>:\\d+(?:-\\d+)?)?");

  private static final Pattern INTENT =
      Pattern.compile(
          "\\b(?:(?<create>create|creating|created|new file|generate|touch|mkdir)"
              + "|(?<write>write|writing|wrote|save|saving|overwrite)"
              + "|(?<read>read|reading|open|opening|view|show|cat|look at|check|inspect|examine)"
              + "|(?<delete>delete|deleting|remove|removing|rm|erase)"
              + "|(?<modify>modify|modifying|edit|editing|update|updating|change|changing|patch)"
              + "|(?<navigate>cd|navigate|go to|switch to))\\b",
          Pattern.CASE_INSENSITIVE);

  static final Pattern QUESTION =
      Pattern.compile(
          "(?:^|(?<=[.!?]\\s))[ \\t]*(?<question>(?:what|how|why|when|where|which|who|whose"
              + "|should|would|could|can|do|does|did|is|are|was|were|will|shall|may|might"
              + "|have|has)\\b[^\\n.!?]*\\?)",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern YES_NO_WORDS = Pattern.compile("\\b(?:yes|no)\\b");
  private static final Pattern YES_NO_START =
      Pattern.compile(
          "^(?:is|are|was|were|do|does|did|can|could|should|would|will|shall|may|have|has)\\b");
  private static final Pattern CHOICE_WORDS =
      Pattern.compile("\\b(?:which|choose|option|options|prefer)\\b");
  private static final Pattern CONFIRM_WORDS = Pattern.compile("\\b(?:confirm|sure|ok|okay)\\b");
  private static final Pattern CLARIFY_WORDS =
      Pattern.compile("\\b(?:clarify|mean|specifically)\\b");

  static final Pattern COMMAND =
      Pattern.compile("^[ \\t]*\\$[ \\t]+(?<command>\\S[^\\n]*?)[ \\t]*$", Pattern.MULTILINE);

  static final Pattern MODEL_ERROR =
      Pattern.compile(
          "^[ \\t]*(?:❌[ \\t]*)?(?<level>error|fatal|critical)[ \\t]*:[ \\t]*(?<message>\\S[^\\n]*)$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern MARKDOWN_HINTS =
      Pattern.compile("(?m)^(?:#{1,6}\\s|[-*+]\\s|\\d+\\.\\s|>\\s)|\\*\\*|`|\\]\\(");

  private SemanticElementExtractor() {}

  public static List<FileReferenceNode> fileReferences(
      String text, UnaryOperator<SourceSpan> toOriginal) {
    List<FileReferenceNode> out = new ArrayList<>();
    Matcher m = FILE_PATH.matcher(text);
    while (m.find()) {
      String path = m.group("path");
      int end = m.end("path");
      while (path.endsWith(".") && path.length() > 1) {
        path = path.substring(0, path.length() - 1);
        end--;
      }
      if (path.isEmpty() || path.equals("/") || path.equals("\\")) {
        continue;
      }
      String line = m.group("line");
      if (line != null) {
        end = m.end("line");
      }
      boolean absolute =
          path.startsWith("/") || path.startsWith("\\") || path.matches("^[A-Za-z]:.*");
      out.add(
          new FileReferenceNode(
              path,
              intentBefore(text, m.start()),
              line,
              absolute,
              toOriginal.apply(new SourceSpan(m.start(), end))));
    }
    return out;
  }

  /** Intent named by the last intent keyword of the clause that precedes {@code offset}. */
  static FileReferenceType intentBefore(String text, int offset) {
    int start = offset;
    while (start > 0) {
      char c = text.charAt(start - 1);
      if (c == '\n' || c == ';') {
        break;
      }
      if ((c == '.' || c == '!' || c == '?')
          && start < text.length()
          && Character.isWhitespace(text.charAt(start))) {
        break;
      }
      start--;
    }
    Matcher m = INTENT.matcher(text).region(start, offset);
    FileReferenceType type = FileReferenceType.MENTION;
    while (m.find()) {
      if (m.group("create") != null) type = FileReferenceType.CREATE;
      else if (m.group("write") != null) type = FileReferenceType.WRITE;
      else if (m.group("read") != null) type = FileReferenceType.READ;
      else if (m.group("delete") != null) type = FileReferenceType.DELETE;
      else if (m.group("modify") != null) type = FileReferenceType.MODIFY;
      else type = FileReferenceType.NAVIGATE;
    }
    return type;
  }

  public static List<QuestionNode> questions(String text, UnaryOperator<SourceSpan> toOriginal) {
    List<QuestionNode> out = new ArrayList<>();
    Matcher m = QUESTION.matcher(text);
    while (m.find()) {
      String question = m.group("question").trim();
      out.add(
          new QuestionNode(
              question,
              questionType(question),
              List.of(),
              toOriginal.apply(new SourceSpan(m.start("question"), m.end("question")))));
    }
    return out;
  }

  static QuestionType questionType(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    if (CHOICE_WORDS.matcher(lower).find()) return QuestionType.MULTIPLE_CHOICE;
    if (YES_NO_WORDS.matcher(lower).find() || YES_NO_START.matcher(lower).find()) {
      return QuestionType.YES_NO;
    }
    if (CONFIRM_WORDS.matcher(lower).find()) return QuestionType.CONFIRMATION;
    if (CLARIFY_WORDS.matcher(lower).find()) return QuestionType.CLARIFICATION;
    return QuestionType.OPEN_ENDED;
  }

  public static List<CommandNode> commands(String text, UnaryOperator<SourceSpan> toOriginal) {
    List<CommandNode> out = new ArrayList<>();
    Matcher m = COMMAND.matcher(text);
    while (m.find()) {
      out.add(
          new CommandNode(
              m.group("command"),
              toOriginal.apply(new SourceSpan(m.start("command"), m.end("command")))));
    }
    return out;
  }

  public static List<ErrorNode> modelErrors(String text, UnaryOperator<SourceSpan> toOriginal) {
    List<ErrorNode> out = new ArrayList<>();
    Matcher m = MODEL_ERROR.matcher(text);
    while (m.find()) {
      String level = m.group("level").toLowerCase(Locale.ROOT);
      ErrorSeverity severity = level.equals("error") ? ErrorSeverity.ERROR : ErrorSeverity.CRITICAL;
      out.add(
          new ErrorNode(
              m.group("message").trim(),
              severity,
              toOriginal.apply(new SourceSpan(m.start(), m.end()))));
    }
    return out;
  }

  public static TextFormat detectFormat(String text) {
    String trimmed = text.trim();
    if ((trimmed.startsWith("{") && trimmed.endsWith("}"))
        || (trimmed.startsWith("[") && trimmed.endsWith("]"))) {
      return TextFormat.JSON;
    }
    if (MARKDOWN_HINTS.matcher(text).find()) {
      return TextFormat.MARKDOWN;
    }
    return TextFormat.PLAIN;
  }
}
