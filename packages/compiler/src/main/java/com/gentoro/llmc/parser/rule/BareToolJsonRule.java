package com.gentoro.llmc.parser.rule;

import java.util.regex.Pattern;

/** {@code {"tool": "...", "parameters": {...}}}, single-quoted keys included. */
public final class BareToolJsonRule extends JsonObjectRule {
  public static final String NAME = "bare-tool-json";

  private static final Pattern PREFIX = Pattern.compile("\\{\\s*[\"']tool[\"']\\s*:\\s*[\"']");

  public BareToolJsonRule() {
    super(PREFIX);
  }

  @Override
  public String name() {
    return NAME;
  }
}
