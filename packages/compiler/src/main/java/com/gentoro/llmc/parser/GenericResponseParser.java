package com.gentoro.llmc.parser;

import com.gentoro.llmc.json.JsonRepair;
import com.gentoro.llmc.parser.rule.BareToolJsonRule;
import com.gentoro.llmc.parser.rule.NestedToolCallRule;
import com.gentoro.llmc.parser.rule.ScrubRule;
import com.gentoro.llmc.parser.rule.ThoughtRule;
import com.gentoro.llmc.parser.rule.ToolCallRule;
import java.util.List;

/** Plain-text dialect: JSON tool calls in prose, {@code <thinking>} scratchpads. */
public class GenericResponseParser extends AbstractResponseParser {
  private static final List<ToolCallRule> TOOL_CALL_RULES =
      List.of(new NestedToolCallRule(), new BareToolJsonRule());

  private static final List<ThoughtRule> THOUGHT_RULES =
      List.of(new ThoughtRule("thinking-tags", List.of("thinking", "think")));

  private static final List<ScrubRule> SCRUB_RULES =
      List.of(ScrubRule.CONTROL_CHARACTERS, ScrubRule.ORPHANED_BRACKETS);

  public GenericResponseParser(JsonRepair jsonRepair) {
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
  public ParserCapabilities capabilities() {
    return new ParserCapabilities(
        "plain-text",
        true,
        true,
        false,
        false,
        true,
        TOOL_CALL_RULES.stream().map(ToolCallRule::name).toList(),
        SCRUB_RULES.stream().map(ScrubRule::name).toList());
  }
}
