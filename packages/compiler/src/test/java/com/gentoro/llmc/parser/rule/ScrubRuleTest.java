package com.gentoro.llmc.parser.rule;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScrubRuleTest {

  private static String scrub(ScrubRule rule, String text) {
    StringBuilder out = new StringBuilder();
    int cursor = 0;
    for (SourceSpan hit : rule.find(text)) {
      out.append(text, cursor, hit.start());
      cursor = hit.end();
    }
    return out.append(text, cursor, text.length()).toString();
  }

  @Test
  @DisplayName("control and zero-width characters are removed")
  void invisibleCharacters() {
    assertEquals("ab", scrub(ScrubRule.CONTROL_CHARACTERS, "a\u0000\u0007b"));
    assertEquals("a\nb\tc", scrub(ScrubRule.CONTROL_CHARACTERS, "a\nb\tc"));
    assertEquals("Hello", scrub(ScrubRule.ZERO_WIDTH_CHARACTERS, "Hel\u200Blo\uFEFF"));
  }

  @Test
  @DisplayName("only lines holding a lone bracket are orphaned")
  void orphanedBrackets() {
    List<SourceSpan> hits = ScrubRule.ORPHANED_BRACKETS.find("a\n  }\nb [x]\n]");
    assertEquals(2, hits.size());
    assertEquals("a\n\nb [x]\n", scrub(ScrubRule.ORPHANED_BRACKETS, "a\n  }\nb [x]\n]"));
  }

  @Test
  @DisplayName("preamble filler is removed only when more content follows")
  void preambleFiller() {
    assertEquals(
        " The answer is 42.", scrub(ScrubRule.PREAMBLE_FILLER, "Let me check that. The answer is 42."));
    assertEquals("Let me check that.", scrub(ScrubRule.PREAMBLE_FILLER, "Let me check that."));
    assertEquals(
        "Result: Let me know.", scrub(ScrubRule.PREAMBLE_FILLER, "Result: Let me know."));
  }

  @Test
  @DisplayName("leaked argument keys and flat tool JSON")
  void leakedJson() {
    assertEquals(" files", scrub(ScrubRule.LEAKED_ARGUMENT_KEYS, "\"recursive\": false files"));
    assertEquals(
        "a  b", scrub(ScrubRule.ORPHANED_TOOL_JSON, "a {\"tool\": \"x\", \"oops\": 1} b"));
  }
}
