package com.gentoro.llmc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Maps character offsets of a text to 1-based line and column numbers. */
public final class LineIndex {
  private final int[] lineStarts;
  private final int length;

  public LineIndex(String text) {
    String source = text == null ? "" : text;
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    this.length = source.length();
  }

  public int line(int offset) {
    int clamped = Math.max(0, Math.min(offset, length));
    int idx = Arrays.binarySearch(lineStarts, clamped);
    return (idx >= 0 ? idx : -idx - 2) + 1;
  }

  public int column(int offset) {
    int clamped = Math.max(0, Math.min(offset, length));
    return clamped - lineStarts[line(clamped) - 1] + 1;
  }
}
