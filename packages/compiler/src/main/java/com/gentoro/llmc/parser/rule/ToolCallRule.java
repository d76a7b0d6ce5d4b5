package com.gentoro.llmc.parser.rule;

import java.util.List;

/** One independent way of spotting tool-call intent in model text. */
public interface ToolCallRule {

  /** Stable name used in capabilities and logs. */
  String name();

  /** Candidates in the order they appear in {@code text}. */
  List<ToolCallCandidate> find(String text);
}
