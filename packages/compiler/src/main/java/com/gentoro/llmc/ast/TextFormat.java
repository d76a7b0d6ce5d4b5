package com.gentoro.llmc.ast;

public enum TextFormat {
  PLAIN,
  MARKDOWN,
  JSON
}
