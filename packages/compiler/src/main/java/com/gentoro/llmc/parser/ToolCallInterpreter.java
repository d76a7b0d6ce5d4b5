package com.gentoro.llmc.parser;

import com.gentoro.llmc.json.JsonRepair;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the tool name and arguments out of a parsed candidate object. Understands the shapes
 * models use: {@code tool_call} wrappers, {@code function} wrappers, {@code name}/{@code tool}
 * keys and arguments given as an object or as a JSON string.
 */
final class ToolCallInterpreter {
  private static final String[] NAME_KEYS = {"name", "tool", "tool_name", "function"};
  private static final String[] ARGUMENT_KEYS = {"arguments", "parameters", "args", "input"};

  private final JsonRepair jsonRepair;

  ToolCallInterpreter(JsonRepair jsonRepair) {
    this.jsonRepair = jsonRepair;
  }

  record Call(String toolName, Map<String, Object> arguments) {}

  Optional<Call> interpret(Map<?, ?> raw) {
    if (raw.get("tool_call") instanceof Map<?, ?> inner) {
      return interpret(inner);
    }
    if (raw.get("function") instanceof Map<?, ?> function) {
      return interpret(function);
    }

    String name = toolName(raw);
    if (name == null) {
      return Optional.empty();
    }

    Object args = null;
    for (String key : ARGUMENT_KEYS) {
      if (raw.containsKey(key)) {
        args = raw.get(key);
        break;
      }
    }
    if (args == null) {
      return Optional.of(new Call(name, new LinkedHashMap<>()));
    }
    if (args instanceof Map<?, ?> map) {
      return Optional.of(new Call(name, stringKeyed(map)));
    }
    if (args instanceof String s) {
      if (s.isBlank()) {
        return Optional.of(new Call(name, new LinkedHashMap<>()));
      }
      return jsonRepair.safeParse(s, Map.class).map(m -> new Call(name, stringKeyed(m)));
    }
    return Optional.empty();
  }

  private static String toolName(Map<?, ?> raw) {
    for (String key : NAME_KEYS) {
      if (raw.get(key) instanceof String s && !s.isBlank()) {
        return s.trim();
      }
    }
    return null;
  }

  private static Map<String, Object> stringKeyed(Map<?, ?> map) {
    Map<String, Object> out = new LinkedHashMap<>();
    map.forEach((k, v) -> out.put(String.valueOf(k), v));
    return out;
  }
}
