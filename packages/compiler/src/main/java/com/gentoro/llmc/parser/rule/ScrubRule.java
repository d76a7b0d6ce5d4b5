package com.gentoro.llmc.parser.rule;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named, deterministic removal rule for provider noise. Every match of the pattern is removed
 * from the residual text.
 */
public record ScrubRule(String name, Pattern pattern) {
  public static final ScrubRule CONTROL_CHARACTERS =
      new ScrubRule(
          "control-characters", Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]+"));

  public static final ScrubRule ZERO_WIDTH_CHARACTERS =
      new ScrubRule("zero-width-characters", Pattern.compile("[\\u200B-\\u200F\\uFEFF]+"));

  /** Lines holding nothing but one bracket, left behind by partially extracted JSON. */
  public static final ScrubRule ORPHANED_BRACKETS =
      new ScrubRule("orphaned-brackets", Pattern.compile("(?m)^[ \\t]*[{}\\[\\]][ \\t]*$"));

  /** Flat JSON objects that mention tool keys but were not valid tool calls. */
  public static final ScrubRule ORPHANED_TOOL_JSON =
      new ScrubRule(
          "orphaned-tool-json",
          Pattern.compile("\\{[^{}]*\"(?:tool|tool_call|function|name)\"\\s*:[^{}]*\\}"));

  /** Argument keys of a directory listing that leak into prose. */
  public static final ScrubRule LEAKED_ARGUMENT_KEYS =
      new ScrubRule(
          "leaked-argument-keys",
          Pattern.compile("\"contents\"\\s*:\\s*\\[|\"recursive\"\\s*:\\s*(?:true|false)?"));

  /** A leading "Let me..." style sentence, removed only when more content follows it. */
  public static final ScrubRule PREAMBLE_FILLER =
      new ScrubRule(
          "preamble-filler",
          Pattern.compile(
              "\\A\\s*(?:Let me|I'll|I will|Now I'll|I'm going to|I need to)\\b"
                  + "[^.!?:\\n]*[.!?:]+(?=\\s*\\S)",
              Pattern.CASE_INSENSITIVE));

  public ScrubRule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(pattern, "pattern");
  }

  /** Spans of {@code text} to remove. */
  public List<SourceSpan> find(String text) {
    List<SourceSpan> out = new ArrayList<>();
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      if (m.end() > m.start()) {
        out.add(new SourceSpan(m.start(), m.end()));
      }
    }
    return out;
  }
}
