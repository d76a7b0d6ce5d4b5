package com.gentoro.llmc.semantic;

import com.gentoro.llmc.exception.ConfigException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** JSON value types a tool parameter can declare. */
public enum ParameterType {
  STRING,
  NUMBER,
  INTEGER,
  BOOLEAN,
  ARRAY,
  OBJECT,
  ANY;

  public boolean matches(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case NUMBER -> value instanceof Number;
      case INTEGER -> value instanceof Integer
          || value instanceof Long
          || value instanceof java.math.BigInteger
          || value instanceof Short;
      case BOOLEAN -> value instanceof Boolean;
      case ARRAY -> value instanceof List<?>;
      case OBJECT -> value instanceof Map<?, ?>;
      case ANY -> true;
    };
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ParameterType fromName(String name) {
    if (name == null || name.isBlank()) {
      return ANY;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown parameter type '%s'".formatted(name), e);
    }
  }
}
