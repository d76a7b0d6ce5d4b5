package com.gentoro.llmc.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.AstVisitor;
import com.gentoro.llmc.ast.CodeNode;
import com.gentoro.llmc.ast.CommandNode;
import com.gentoro.llmc.ast.ErrorNode;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.MarkdownNode;
import com.gentoro.llmc.ast.QuestionNode;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.TextFormat;
import com.gentoro.llmc.ast.TextNode;
import com.gentoro.llmc.ast.ThoughtNode;
import com.gentoro.llmc.ast.ToolCallNode;
import com.gentoro.llmc.ast.ToolResultNode;
import com.gentoro.llmc.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a response tree into display text plus the list of tool invocations for the executor.
 *
 * <p>Rendering reads the tree only. Calling {@link #render} twice on the same tree yields equal
 * results.
 */
public class AstRenderer implements AstVisitor<String> {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(AstRenderer.class);

  private final RenderOptions options;

  public AstRenderer() {
    this(RenderOptions.defaults());
  }

  public AstRenderer(RenderOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public RenderOptions options() {
    return options;
  }

  public RenderResult render(ResponseNode tree) {
    String text = visitResponse(tree);
    List<ToolInvocation> invocations = new ArrayList<>();
    for (ToolCallNode call : tree.childrenOfType(ToolCallNode.class)) {
      invocations.add(ToolInvocation.of(call));
    }
    return new RenderResult(text, invocations, !text.isBlank(), !invocations.isEmpty());
  }

  /** Renders one node as a standalone string, honoring its kind's visibility. */
  public String renderNode(AstNode node) {
    if (node instanceof ResponseNode) {
      return node.accept(this);
    }
    return options.visibility(node.kind()) == Visibility.HIDDEN ? "" : node.accept(this);
  }

  @Override
  public String visitResponse(ResponseNode node) {
    List<String> parts = new ArrayList<>();
    for (AstNode child : node.children()) {
      String rendered = renderNode(child);
      if (!rendered.isEmpty()) {
        parts.add(rendered);
      }
    }
    return String.join(options.nodeSeparator(), parts);
  }

  @Override
  public String visitText(TextNode node) {
    if (isFull(node) && options.formatJson() && node.format() == TextFormat.JSON) {
      return prettyJson(node.content());
    }
    return node.content();
  }

  @Override
  public String visitToolCall(ToolCallNode node) {
    if (!isFull(node)) {
      return "[Calling " + node.toolName() + "]";
    }
    String arguments =
        options.formatJson()
            ? JacksonUtility.toJson(node.arguments())
            : JacksonUtility.toCanonicalJson(node.arguments());
    return "Tool Call: " + node.toolName() + "\nArguments: " + arguments;
  }

  @Override
  public String visitToolResult(ToolResultNode node) {
    if (!isFull(node)) {
      return "[" + node.toolName() + (node.success() ? " completed]" : " failed]");
    }
    if (!node.success()) {
      return "Error: " + Objects.requireNonNullElse(node.errorMessage(), "");
    }
    return "Tool Result (" + node.toolName() + "): " + Objects.requireNonNullElse(node.result(), "");
  }

  @Override
  public String visitCode(CodeNode node) {
    if (!isFull(node)) {
      return node.code();
    }
    StringBuilder sb = new StringBuilder();
    if (node.fileName() != null) {
      sb.append("// File: ").append(node.fileName()).append('\n');
    }
    if (options.useCodeBlockMarkers()) {
      sb.append("```").append(node.language()).append('\n').append(node.code());
      if (!node.code().endsWith("\n")) {
        sb.append('\n');
      }
      sb.append("```");
    } else {
      sb.append(node.code());
    }
    return sb.toString();
  }

  @Override
  public String visitFileReference(FileReferenceNode node) {
    String location = node.path() + Objects.requireNonNullElse(node.lineReference(), "");
    if (!isFull(node)) {
      return location;
    }
    return filePrefix(node) + location;
  }

  private String filePrefix(FileReferenceNode node) {
    boolean emoji = options.useEmoji();
    switch (node.referenceType()) {
      case CREATE:
        return emoji ? "📝 Create: " : "Create: ";
      case READ:
        return emoji ? "📖 Read: " : "Read: ";
      case WRITE:
        return emoji ? "✏️ Write: " : "Write: ";
      case DELETE:
        return emoji ? "🗑️ Delete: " : "Delete: ";
      case MODIFY:
        return emoji ? "📝 Modify: " : "Modify: ";
      case NAVIGATE:
        return emoji ? "📂 Navigate: " : "Navigate: ";
      default:
        return emoji ? "📄 " : "";
    }
  }

  @Override
  public String visitQuestion(QuestionNode node) {
    if (!isFull(node)) {
      return node.question();
    }
    StringBuilder sb = new StringBuilder(options.useEmoji() ? "❓ " : "? ");
    sb.append(node.question());
    if (!node.suggestedOptions().isEmpty()) {
      sb.append(" [").append(String.join(" / ", node.suggestedOptions())).append(']');
    }
    return sb.toString();
  }

  @Override
  public String visitThought(ThoughtNode node) {
    return isFull(node) ? "[Thinking: " + node.content() + "]" : "[Thinking]";
  }

  @Override
  public String visitError(ErrorNode node) {
    if (!isFull(node)) {
      return node.message();
    }
    String prefix;
    switch (node.severity()) {
      case CRITICAL:
        prefix = options.useEmoji() ? "🔴 " : "[CRITICAL] ";
        break;
      case ERROR:
        prefix = options.useEmoji() ? "❌ " : "[ERROR] ";
        break;
      case WARNING:
        prefix = options.useEmoji() ? "⚠️ " : "[WARNING] ";
        break;
      default:
        prefix = options.useEmoji() ? "ℹ️ " : "[INFO] ";
    }
    return prefix + node.message();
  }

  @Override
  public String visitCommand(CommandNode node) {
    if (!isFull(node)) {
      return node.command();
    }
    return options.useCodeBlockMarkers()
        ? "```bash\n" + node.command() + "\n```"
        : "$ " + node.command();
  }

  @Override
  public String visitMarkdown(MarkdownNode node) {
    return node.text().isEmpty() ? node.marker() : node.marker() + " " + node.text();
  }

  private boolean isFull(AstNode node) {
    return options.visibility(node.kind()) == Visibility.FULL;
  }

  private static String prettyJson(String content) {
    try {
      JsonNode parsed = JacksonUtility.getJsonMapper().readTree(content);
      return JacksonUtility.getJsonMapper().writeValueAsString(parsed);
    } catch (JsonProcessingException e) {
      log.debug("Text looked like JSON but did not parse; rendering as is: {}", e.getMessage());
      return content;
    }
  }
}
