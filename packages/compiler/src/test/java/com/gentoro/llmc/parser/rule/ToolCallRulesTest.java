package com.gentoro.llmc.parser.rule;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolCallRulesTest {

  @Test
  @DisplayName("nested rule: whole object including nested arguments")
  void nestedRule() {
    String json = "{\"tool_call\": {\"name\": \"a\", \"arguments\": {\"k\": {\"n\": 1}}}}";
    String text = "before " + json + " after";
    List<ToolCallCandidate> found = new NestedToolCallRule().find(text);
    assertEquals(1, found.size());
    assertEquals(json, found.get(0).json());
    assertEquals(new SourceSpan(7, 7 + json.length()), found.get(0).span());
    assertEquals(NestedToolCallRule.NAME, found.get(0).rule());
  }

  @Test
  @DisplayName("nested rule ignores tool_call keys of inner objects")
  void nestedRuleNeedsOuterKey() {
    String text = "{\"data\": {\"tool_call\": {\"name\": \"a\"}}}";
    assertTrue(new NestedToolCallRule().find(text).isEmpty());
  }

  @Test
  @DisplayName("bare rule: tool key first, single quotes allowed")
  void bareRule() {
    String text = "Listing: {'tool': 'list_directory', 'parameters': {'path': '.'}}";
    List<ToolCallCandidate> found = new BareToolJsonRule().find(text);
    assertEquals(1, found.size());
    assertTrue(found.get(0).json().startsWith("{'tool'"));
    assertTrue(new BareToolJsonRule().find("{\"tool_call\": {\"name\": \"x\"}}").isEmpty());
  }

  @Test
  @DisplayName("tag-wrapped rule: span covers the tags, JSON is the body")
  void tagWrappedRule() {
    String text = "x <tool_call>\n{\"name\":\"read_file\"}\n</tool_call> y";
    List<ToolCallCandidate> found = new TagWrappedToolCallRule().find(text);
    assertEquals(1, found.size());
    assertEquals("{\"name\":\"read_file\"}", found.get(0).json());
    assertEquals(2, found.get(0).span().start());
    assertEquals(text.indexOf(" y"), found.get(0).span().end());

    assertEquals(
        1, new TagWrappedToolCallRule().find("<function_call>{}</function_call>").size());
  }

  @Test
  @DisplayName("thought rule: closed and unclosed tags")
  void thoughtRule() {
    ThoughtRule rule = new ThoughtRule("thinking", List.of("thinking", "think"));
    List<ThoughtRule.Match> closed = rule.find("<thinking>plan it</thinking>Answer");
    assertEquals(1, closed.size());
    assertEquals("plan it", closed.get(0).content());
    assertEquals("<thinking>plan it</thinking>", closed.get(0).originalText());

    List<ThoughtRule.Match> open = rule.find("Answer <think>still going");
    assertEquals("still going", open.get(0).content());
    assertEquals(25, open.get(0).span().end());
  }

  @Test
  @DisplayName("a bare trailing boolean is named recursive")
  void missingParameterName() {
    String fixed =
        new MissingParameterNameFixup()
            .apply("{\"name\":\"list_directory\",\"arguments\":{\"path\":\"/p\",false}}");
    assertEquals(
        "{\"name\":\"list_directory\",\"arguments\":{\"path\":\"/p\",\"recursive\":false}}", fixed);
    assertEquals("{\"x\":1,true}", new MissingParameterNameFixup().apply("{\"x\":1,true}"));
  }
}
