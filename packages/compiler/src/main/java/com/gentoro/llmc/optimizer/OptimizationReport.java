package com.gentoro.llmc.optimizer;

/** Counts of what one {@link AstOptimizer#optimize} call changed. */
public record OptimizationReport(
    int removedDuplicateCalls, int droppedBlankText, int mergedText, int normalizedPaths) {

  public boolean changed() {
    return removedDuplicateCalls + droppedBlankText + mergedText + normalizedPaths > 0;
  }
}
