package com.gentoro.llmc.semantic;

import com.gentoro.llmc.exception.ValidationException;
import java.util.List;
import java.util.Optional;

public record ToolSchema(String name, List<ParameterSchema> parameters) {
  public ToolSchema {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Tool schema requires a name");
    }
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public static ToolSchema of(String name, ParameterSchema... parameters) {
    return new ToolSchema(name, List.of(parameters));
  }

  /** The parameter an argument name (or one of its aliases) refers to. */
  public Optional<ParameterSchema> parameterFor(String argumentName) {
    return parameters.stream().filter(p -> p.answersTo(argumentName)).findFirst();
  }

  public List<ParameterSchema> requiredParameters() {
    return parameters.stream().filter(ParameterSchema::required).toList();
  }
}
