package com.gentoro.llmc.ast;

public enum ErrorSeverity {
  INFO,
  WARNING,
  ERROR,
  CRITICAL
}
