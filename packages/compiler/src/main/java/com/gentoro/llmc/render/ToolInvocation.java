package com.gentoro.llmc.render;

import com.gentoro.llmc.ast.ToolCallNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call handed to the external tool executor.
 *
 * @param arguments arguments in the order the model wrote them
 * @param callId unique within one response
 */
public record ToolInvocation(String toolName, Map<String, Object> arguments, String callId) {
  public ToolInvocation {
    arguments =
        arguments == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  public static ToolInvocation of(ToolCallNode call) {
    return new ToolInvocation(call.toolName(), call.arguments(), call.callId());
  }
}
