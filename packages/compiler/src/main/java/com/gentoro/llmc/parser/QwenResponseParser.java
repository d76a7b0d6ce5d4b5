package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.ast.ToolResultNode;
import com.gentoro.llmc.json.JsonRepair;
import com.gentoro.llmc.parser.rule.BareToolJsonRule;
import com.gentoro.llmc.parser.rule.JsonFixup;
import com.gentoro.llmc.parser.rule.MissingParameterNameFixup;
import com.gentoro.llmc.parser.rule.NestedToolCallRule;
import com.gentoro.llmc.parser.rule.ScrubRule;
import com.gentoro.llmc.parser.rule.TagWrappedToolCallRule;
import com.gentoro.llmc.parser.rule.ThoughtRule;
import com.gentoro.llmc.parser.rule.ToolCallRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tag/JSON dialect of the Qwen model family. Tool calls come tag-wrapped, nested or bare; thoughts
 * use several tag names; tool responses are sometimes echoed back; output carries zero-width
 * garbage, leaked argument keys and "Let me..." preambles.
 */
public class QwenResponseParser extends AbstractResponseParser {
  private static final List<ToolCallRule> TOOL_CALL_RULES =
      List.of(new TagWrappedToolCallRule(), new NestedToolCallRule(), new BareToolJsonRule());

  private static final List<ThoughtRule> THOUGHT_RULES =
      List.of(
          new ThoughtRule("thinking-tags", List.of("thinking", "think", "thought", "internal")));

  private static final List<ScrubRule> SCRUB_RULES =
      List.of(
          ScrubRule.CONTROL_CHARACTERS,
          ScrubRule.ZERO_WIDTH_CHARACTERS,
          ScrubRule.ORPHANED_TOOL_JSON,
          ScrubRule.LEAKED_ARGUMENT_KEYS,
          ScrubRule.ORPHANED_BRACKETS,
          ScrubRule.PREAMBLE_FILLER);

  private static final List<JsonFixup> FIXUPS = List.of(new MissingParameterNameFixup());

  private static final Pattern TOOL_RESPONSE =
      Pattern.compile(
          "<(tool_response|tool_result)>(?<body>.*?)</\\1>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

  public QwenResponseParser(JsonRepair jsonRepair) {
    super(jsonRepair);
  }

  @Override
  protected List<ToolCallRule> toolCallRules() {
    return TOOL_CALL_RULES;
  }

  @Override
  protected List<ThoughtRule> thoughtRules() {
    return THOUGHT_RULES;
  }

  @Override
  protected List<ScrubRule> scrubRules() {
    return SCRUB_RULES;
  }

  @Override
  protected List<JsonFixup> jsonFixups() {
    return FIXUPS;
  }

  @Override
  protected List<AstNode> extractDialectNodes(String source, Predicate<SourceSpan> isFree) {
    List<AstNode> results = new ArrayList<>();
    Matcher m = TOOL_RESPONSE.matcher(source);
    while (m.find()) {
      SourceSpan span = new SourceSpan(m.start(), m.end());
      if (isFree.test(span)) {
        results.add(toolResult(m.group("body").trim(), span));
      }
    }
    return results;
  }

  private ToolResultNode toolResult(String body, SourceSpan span) {
    if (!body.startsWith("{")) {
      return new ToolResultNode("", null, body, true, null, span);
    }
    Map<?, ?> json = jsonRepair.safeParse(body, Map.class).orElse(Map.of());
    String name = stringValue(json, "name", "tool", "tool_name");
    String callId = stringValue(json, "call_id", "id", "tool_call_id");
    String error = stringValue(json, "error");
    String result = stringValue(json, "content", "result", "output");
    if (result == null && error == null) {
      result = body;
    }
    return new ToolResultNode(name, callId, result, error == null, error, span);
  }

  private static String stringValue(Map<?, ?> json, String... keys) {
    for (String key : keys) {
      Object value = json.get(key);
      if (value != null) {
        return String.valueOf(value);
      }
    }
    return null;
  }

  @Override
  protected String normalizeWhitespace(String text) {
    return super.normalizeWhitespace(HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" "));
  }

  @Override
  public ParserCapabilities capabilities() {
    return new ParserCapabilities(
        "qwen-tag-json",
        true,
        true,
        true,
        true,
        true,
        TOOL_CALL_RULES.stream().map(ToolCallRule::name).toList(),
        SCRUB_RULES.stream().map(ScrubRule::name).toList());
  }
}
