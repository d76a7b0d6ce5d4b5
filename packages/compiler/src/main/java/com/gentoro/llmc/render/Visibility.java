package com.gentoro.llmc.render;

import com.gentoro.llmc.exception.ConfigException;
import java.util.Locale;

/** How much of a node kind the renderer shows. */
public enum Visibility {
  HIDDEN,
  SUMMARY,
  FULL;

  public static Visibility fromName(String name) {
    if (name != null) {
      try {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException(
            "Unknown visibility '" + name + "'; expected hidden, summary or full", e);
      }
    }
    throw new ConfigException("Visibility must not be null");
  }
}
