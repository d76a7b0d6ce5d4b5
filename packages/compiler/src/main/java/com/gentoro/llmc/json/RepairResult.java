package com.gentoro.llmc.json;

/**
 * Outcome of {@link JsonRepair#tryRepair(String)}.
 *
 * @param repaired whether the returned text parses as JSON
 * @param text the repaired text, or the input unchanged when repair failed
 */
public record RepairResult(boolean repaired, String text) {}
