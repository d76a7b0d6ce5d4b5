package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The part of a source text that has not been claimed by an extraction step yet.
 *
 * <p>Removals are recorded as spans of the original text, so offsets found in the residual text
 * can always be mapped back to the original. Instances are immutable.
 */
final class ResidualText {
  private final String original;
  private final List<SourceSpan> removed;
  private final String text;
  // retained segments: original start, residual start, length
  private final int[] origStarts;
  private final int[] resStarts;
  private final int[] lengths;

  private ResidualText(String original, List<SourceSpan> removed) {
    this.original = original;
    this.removed = List.copyOf(removed);

    List<int[]> segments = new ArrayList<>();
    StringBuilder sb = new StringBuilder(original.length());
    int cursor = 0;
    for (SourceSpan gap : removed) {
      if (gap.start() > cursor) {
        segments.add(new int[] {cursor, sb.length(), gap.start() - cursor});
        sb.append(original, cursor, gap.start());
      }
      cursor = gap.end();
    }
    if (cursor < original.length()) {
      segments.add(new int[] {cursor, sb.length(), original.length() - cursor});
      sb.append(original, cursor, original.length());
    }
    this.text = sb.toString();
    this.origStarts = segments.stream().mapToInt(s -> s[0]).toArray();
    this.resStarts = segments.stream().mapToInt(s -> s[1]).toArray();
    this.lengths = segments.stream().mapToInt(s -> s[2]).toArray();
  }

  static ResidualText of(String original) {
    return new ResidualText(original, List.of());
  }

  String text() {
    return text;
  }

  /** A copy with the given original-text spans removed as well. */
  ResidualText without(Collection<SourceSpan> originalSpans) {
    if (originalSpans.isEmpty()) {
      return this;
    }
    List<SourceSpan> all = new ArrayList<>(removed);
    for (SourceSpan s : originalSpans) {
      int start = Math.max(0, Math.min(s.start(), original.length()));
      int end = Math.max(start, Math.min(s.end(), original.length()));
      if (end > start) {
        all.add(new SourceSpan(start, end));
      }
    }
    all.sort(Comparator.comparingInt(SourceSpan::start));
    List<SourceSpan> merged = new ArrayList<>();
    for (SourceSpan s : all) {
      int last = merged.size() - 1;
      if (last >= 0 && s.start() <= merged.get(last).end()) {
        merged.set(last, merged.get(last).cover(s));
      } else {
        merged.add(s);
      }
    }
    return new ResidualText(original, merged);
  }

  /** A copy with the given residual-text spans removed. */
  ResidualText withoutResidual(Collection<SourceSpan> residualSpans) {
    List<SourceSpan> mapped = new ArrayList<>(residualSpans.size());
    for (SourceSpan s : residualSpans) {
      if (s.length() > 0) {
        mapped.add(toOriginal(s));
      }
    }
    return without(mapped);
  }

  /** Whether any character of the original-text span has been removed. */
  boolean isTouched(SourceSpan originalSpan) {
    for (SourceSpan gap : removed) {
      if (gap.overlaps(originalSpan)) {
        return true;
      }
    }
    return false;
  }

  SourceSpan toOriginal(SourceSpan residualSpan) {
    int start = toOriginalOffset(residualSpan.start());
    int end =
        residualSpan.length() == 0 ? start : toOriginalOffset(residualSpan.end() - 1) + 1;
    return new SourceSpan(start, Math.max(start, end));
  }

  int toOriginalOffset(int residualOffset) {
    if (lengths.length == 0) {
      return original.length();
    }
    if (residualOffset >= text.length()) {
      int last = lengths.length - 1;
      return origStarts[last] + lengths[last];
    }
    int idx = Arrays.binarySearch(resStarts, Math.max(0, residualOffset));
    int seg = idx >= 0 ? idx : -idx - 2;
    return origStarts[seg] + (residualOffset - resStarts[seg]);
  }
}
