package com.gentoro.llmc.json;

import java.util.Optional;

/**
 * Best-effort correction of malformed JSON written by language models. No method throws; callers
 * treat an empty result as "not JSON".
 */
public interface JsonRepair {

  /** Parse {@code json}, repairing it when needed. Empty when the text cannot be salvaged. */
  <T> Optional<T> safeParse(String json, Class<T> type);

  RepairResult tryRepair(String raw);

  /** Whether {@code text} is exactly one complete, strictly valid JSON object or array. */
  boolean isCompleteJson(String text);
}
