package com.gentoro.llmc.ast;

public enum QuestionType {
  YES_NO,
  MULTIPLE_CHOICE,
  CONFIRMATION,
  CLARIFICATION,
  OPEN_ENDED
}
