package com.gentoro.llmc.parser.rule;

import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.lexer.JsonSpanScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Accepts balanced top-level JSON objects whose opening matches a prefix pattern. Objects are
 * located with a string-aware bracket scanner, so nested argument objects stay inside the span.
 */
abstract class JsonObjectRule implements ToolCallRule {
  private final Pattern prefix;

  JsonObjectRule(Pattern prefix) {
    this.prefix = prefix;
  }

  @Override
  public List<ToolCallCandidate> find(String text) {
    List<ToolCallCandidate> out = new ArrayList<>();
    for (int[] span : JsonSpanScanner.findObjects(text)) {
      String json = text.substring(span[0], span[1]);
      if (prefix.matcher(json).lookingAt()) {
        out.add(new ToolCallCandidate(name(), new SourceSpan(span[0], span[1]), json));
      }
    }
    return out;
  }
}
