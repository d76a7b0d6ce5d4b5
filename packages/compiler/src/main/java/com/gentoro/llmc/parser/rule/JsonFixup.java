package com.gentoro.llmc.parser.rule;

/** Dialect-specific textual fix applied to a tool-call candidate before JSON repair. */
public interface JsonFixup {
  String name();

  String apply(String json);
}
