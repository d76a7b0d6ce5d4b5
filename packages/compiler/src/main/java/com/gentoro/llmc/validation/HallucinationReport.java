package com.gentoro.llmc.validation;

import java.util.List;
import java.util.Set;

/**
 * @param hallucinating whether the indicators are strong enough to retry the request
 * @param issues one human-readable line per finding
 * @param suggestedAction what the caller should do, or {@code null} when not hallucinating
 */
public record HallucinationReport(
    boolean hallucinating,
    Set<HallucinationIndicator> indicators,
    List<String> issues,
    String suggestedAction) {

  public static final HallucinationReport CLEAN =
      new HallucinationReport(false, Set.of(), List.of(), null);

  public HallucinationReport {
    indicators = Set.copyOf(indicators);
    issues = List.copyOf(issues);
  }

  public boolean has(HallucinationIndicator indicator) {
    return indicators.contains(indicator);
  }
}
