package com.gentoro.llmc.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds balanced JSON-like spans in free text. Brackets inside double-quoted strings are ignored and
 * backslash escapes are honored, so nested objects and braces in string values do not end a span
 * early.
 */
public final class JsonSpanScanner {
  private JsonSpanScanner() {}

  /**
   * Offset just past the bracket that closes the one at {@code start}, or {@code -1} when the
   * input ends first or a closing bracket of the wrong kind is met.
   */
  public static int findClosing(CharSequence text, int start) {
    char open = text.charAt(start);
    if (open != '{' && open != '[') {
      return -1;
    }
    char[] stack = new char[16];
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      switch (c) {
        case '"' -> inString = true;
        case '{', '[' -> {
          if (depth == stack.length) {
            stack = java.util.Arrays.copyOf(stack, depth * 2);
          }
          stack[depth++] = c == '{' ? '}' : ']';
        }
        case '}', ']' -> {
          if (depth == 0 || stack[depth - 1] != c) {
            return -1;
          }
          depth--;
          if (depth == 0) {
            return i + 1;
          }
        }
        default -> {}
      }
    }
    return -1;
  }

  /** Top-level balanced {@code {...}} spans, as {@code [start, end)} pairs, left to right. */
  public static List<int[]> findObjects(CharSequence text) {
    List<int[]> spans = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      if (text.charAt(i) == '{') {
        int end = findClosing(text, i);
        if (end > 0) {
          spans.add(new int[] {i, end});
          i = end;
          continue;
        }
      }
      i++;
    }
    return spans;
  }
}
