package com.gentoro.llmc.ast;

/** What the model intends to do with a referenced file. */
public enum FileReferenceType {
  CREATE,
  READ,
  WRITE,
  DELETE,
  MODIFY,
  NAVIGATE,
  MENTION
}
