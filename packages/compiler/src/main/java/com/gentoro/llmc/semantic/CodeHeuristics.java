package com.gentoro.llmc.semantic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/** Cheap signals that a generated code block was cut short. */
public final class CodeHeuristics {
  private static final Pattern TODO_MARKER =
      Pattern.compile("(?m)(?://|#|--|/\\*|<!--)\\s*(?:TODO|FIXME)\\b|\\bTODO:");

  private CodeHeuristics() {}

  public static boolean hasIncompleteMarker(String code) {
    String trimmed = code.stripTrailing();
    return trimmed.endsWith("...") || trimmed.endsWith("…") || TODO_MARKER.matcher(code).find();
  }

  /**
   * Whether {@code ()}, {@code []} and {@code {}} pair up. Characters inside string, character and
   * template literals are skipped and backslash escapes are honored. Single- and double-quoted
   * literals end at a line break, so a stray apostrophe in a comment cannot hide the rest of the
   * block.
   */
  public static boolean isBalanced(String code) {
    Deque<Character> expected = new ArrayDeque<>();
    char quote = 0;
    boolean escaped = false;
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (quote != 0) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == quote || (c == '\n' && quote != '`')) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
        case '"', '\'', '`' -> quote = c;
        case '(' -> expected.push(')');
        case '[' -> expected.push(']');
        case '{' -> expected.push('}');
        case ')', ']', '}' -> {
          if (expected.isEmpty() || expected.pop() != c) {
            return false;
          }
        }
        default -> {}
      }
    }
    return expected.isEmpty();
  }
}
