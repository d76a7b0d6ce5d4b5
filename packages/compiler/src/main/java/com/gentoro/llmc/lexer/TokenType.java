package com.gentoro.llmc.lexer;

public enum TokenType {
  /** Run of plain characters. */
  TEXT,
  NEWLINE,
  /** Opening {@code ```} fence; attribute holds the language tag. */
  CODE_FENCE_OPEN,
  CODE_CONTENT,
  CODE_FENCE_CLOSE,
  INLINE_CODE,
  /** Balanced {@code {...}} or {@code [...]} span; may be unterminated. */
  JSON_SPAN,
  /** {@code <thinking>}, {@code <tool_call>} and similar wrappers; attribute holds the tag name. */
  TAG_OPEN,
  TAG_CLOSE,
  /** Attribute holds the heading level. */
  HEADING,
  LIST_MARKER,
  BLOCKQUOTE,
  HORIZONTAL_RULE,
  EMPHASIS,
  EOF
}
