package com.gentoro.llmc.validation;

/** Signs that a model described tool work it never requested. */
public enum HallucinationIndicator {
  FAKE_TOOL_RESULT,
  FAKE_FILE_CONTENT,
  UNSUBSTANTIATED_CLAIM,
  FAKE_DIRECTORY_LISTING,
  SUSPICIOUS_CODE
}
