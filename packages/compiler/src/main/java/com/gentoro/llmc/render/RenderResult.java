package com.gentoro.llmc.render;

import java.util.List;

public record RenderResult(
    String text, List<ToolInvocation> toolInvocations, boolean hasContent, boolean hasToolCalls) {
  public RenderResult {
    text = text == null ? "" : text;
    toolInvocations = List.copyOf(toolInvocations);
  }
}
