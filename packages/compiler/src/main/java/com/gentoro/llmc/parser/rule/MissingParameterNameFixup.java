package com.gentoro.llmc.parser.rule;

import java.util.regex.Pattern;

/**
 * Names a bare trailing boolean argument. Some models write {@code {"path":"/p",false}} for a
 * directory listing; the value belongs to {@code recursive}.
 */
public final class MissingParameterNameFixup implements JsonFixup {
  public static final String NAME = "missing-parameter-name";

  private static final Pattern BARE_BOOLEAN = Pattern.compile(",\\s*(true|false)\\s*}");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String apply(String json) {
    if (json.contains("list_directory") || json.contains("\"path\"")) {
      return BARE_BOOLEAN.matcher(json).replaceAll(",\"recursive\":$1}");
    }
    return json;
  }
}
