package com.gentoro.llmc.ast;

public enum NodeKind {
  RESPONSE,
  TEXT,
  TOOL_CALL,
  TOOL_RESULT,
  CODE,
  FILE_REFERENCE,
  QUESTION,
  THOUGHT,
  ERROR,
  COMMAND,
  MARKDOWN
}
