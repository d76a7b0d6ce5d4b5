package com.gentoro.llmc.parser.rule;

import java.util.regex.Pattern;

/** {@code {"tool_call": {"name": "...", "arguments": {...}}}} */
public final class NestedToolCallRule extends JsonObjectRule {
  public static final String NAME = "nested-tool-call";

  // "tool_call" must be a key of the outer object, before any nested brace opens
  private static final Pattern PREFIX =
      Pattern.compile("\\{[^{}]*?[\"']tool_call[\"']\\s*:\\s*\\{");

  public NestedToolCallRule() {
    super(PREFIX);
  }

  @Override
  public String name() {
    return NAME;
  }
}
