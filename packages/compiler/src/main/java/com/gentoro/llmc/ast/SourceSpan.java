package com.gentoro.llmc.ast;

import com.gentoro.llmc.exception.ValidationException;

/** Half-open character range {@code [start, end)} in the compiled source text. */
public record SourceSpan(int start, int end) {
  public static final SourceSpan EMPTY = new SourceSpan(0, 0);

  public SourceSpan {
    if (start < 0 || end < start) {
      throw new ValidationException("Invalid span [%d, %d)".formatted(start, end));
    }
  }

  public int length() {
    return end - start;
  }

  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  public boolean overlaps(SourceSpan other) {
    return start < other.end && other.start < end;
  }

  public boolean encloses(SourceSpan other) {
    return start <= other.start && other.end <= end;
  }

  /** Smallest span covering both. */
  public SourceSpan cover(SourceSpan other) {
    return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
  }
}
