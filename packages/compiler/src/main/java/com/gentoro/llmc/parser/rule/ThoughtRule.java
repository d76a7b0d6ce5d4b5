package com.gentoro.llmc.parser.rule;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scratchpad spans wrapped in one of a set of tag names. A tag left open runs to the end of the
 * text, which keeps half-streamed reasoning out of the narrative.
 */
public final class ThoughtRule {
  private final String name;
  private final Pattern pattern;

  public ThoughtRule(String name, List<String> tagNames) {
    this.name = Objects.requireNonNull(name, "name");
    String alternation =
        String.join(
            "|", tagNames.stream().map(t -> Pattern.quote(t.toLowerCase(Locale.ROOT))).toList());
    this.pattern =
        Pattern.compile(
            "<(" + alternation + ")>(?<content>.*?)(?:</\\1>|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  }

  public String name() {
    return name;
  }

  public List<Match> find(String text) {
    List<Match> out = new ArrayList<>();
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      out.add(new Match(new SourceSpan(m.start(), m.end()), m.group("content"), m.group()));
    }
    return out;
  }

  /**
   * @param content text between the markers
   * @param originalText the whole span, markers included
   */
  public record Match(SourceSpan span, String content, String originalText) {}
}
