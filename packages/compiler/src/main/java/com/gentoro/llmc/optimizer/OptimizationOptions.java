package com.gentoro.llmc.optimizer;

/**
 * @param normalizeFilePaths rewrite file-reference paths to forward slashes with an explicit
 *     {@code ./} for bare relative paths
 */
public record OptimizationOptions(boolean normalizeFilePaths) {
  public static final OptimizationOptions DEFAULT = new OptimizationOptions(true);
}
