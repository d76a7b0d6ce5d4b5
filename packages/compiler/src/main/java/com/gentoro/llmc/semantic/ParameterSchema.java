package com.gentoro.llmc.semantic;

import java.util.List;
import java.util.Objects;

/**
 * One declared parameter of a tool.
 *
 * @param aliases other argument names models use for the same parameter
 */
public record ParameterSchema(
    String name, ParameterType type, boolean required, List<String> aliases) {

  public ParameterSchema {
    Objects.requireNonNull(name, "name");
    type = type == null ? ParameterType.ANY : type;
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  public static ParameterSchema required(String name, ParameterType type, String... aliases) {
    return new ParameterSchema(name, type, true, List.of(aliases));
  }

  public static ParameterSchema optional(String name, ParameterType type, String... aliases) {
    return new ParameterSchema(name, type, false, List.of(aliases));
  }

  public boolean answersTo(String argumentName) {
    return name.equals(argumentName) || aliases.contains(argumentName);
  }
}
