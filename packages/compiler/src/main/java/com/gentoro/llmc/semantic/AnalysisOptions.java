package com.gentoro.llmc.semantic;

/**
 * @param strictMode report unknown tools as warnings and parameter type mismatches as errors
 */
public record AnalysisOptions(boolean strictMode) {
  public static final AnalysisOptions DEFAULT = new AnalysisOptions(false);
}
