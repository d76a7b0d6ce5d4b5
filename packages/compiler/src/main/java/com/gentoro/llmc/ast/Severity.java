package com.gentoro.llmc.ast;

public enum Severity {
  INFO,
  WARNING,
  ERROR
}
