package com.gentoro.llmc.ast;

import com.gentoro.llmc.exception.ValidationException;
import com.gentoro.llmc.utility.JacksonUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request, extracted from model text, to run a named external tool.
 *
 * <p>Arguments keep the order in which the model wrote them. Values are JSON-compatible: {@code
 * String}, {@code Number}, {@code Boolean}, {@code null}, {@code List} or {@code Map}.
 */
public record ToolCallNode(
    String toolName, Map<String, Object> arguments, String callId, SourceSpan span)
    implements AstNode {

  public ToolCallNode {
    if (toolName == null || toolName.isBlank()) {
      throw new ValidationException("Tool call requires a non-empty tool name");
    }
    arguments =
        arguments == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    Objects.requireNonNull(span, "span");
  }

  public ToolCallSignature signature() {
    return new ToolCallSignature(toolName, JacksonUtility.toCanonicalJson(arguments));
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TOOL_CALL;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitToolCall(this);
  }
}
