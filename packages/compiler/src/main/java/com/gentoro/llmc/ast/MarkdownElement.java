package com.gentoro.llmc.ast;

public enum MarkdownElement {
  HEADING,
  LIST_ITEM,
  BLOCKQUOTE,
  HORIZONTAL_RULE
}
