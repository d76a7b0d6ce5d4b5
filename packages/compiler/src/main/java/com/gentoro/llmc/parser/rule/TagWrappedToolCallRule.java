package com.gentoro.llmc.parser.rule;

import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.lexer.JsonSpanScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON wrapped in {@code <tool_call>}, {@code <tool_use>} or {@code <function_call>} tags. The
 * candidate span covers the tags, so accepted calls leave no markup behind.
 */
public final class TagWrappedToolCallRule implements ToolCallRule {
  public static final String NAME = "tag-wrapped-json";

  private static final Pattern TAGGED =
      Pattern.compile(
          "<(tool_call|tool_use|function_call)>(?<body>.*?)</\\1>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<ToolCallCandidate> find(String text) {
    List<ToolCallCandidate> out = new ArrayList<>();
    Matcher m = TAGGED.matcher(text);
    while (m.find()) {
      String body = m.group("body");
      int brace = body.indexOf('{');
      String json = body.trim();
      if (brace >= 0) {
        int end = JsonSpanScanner.findClosing(body, brace);
        json = end > 0 ? body.substring(brace, end) : body.substring(brace).trim();
      }
      out.add(new ToolCallCandidate(NAME, new SourceSpan(m.start(), m.end()), json));
    }
    return out;
  }
}
