package com.gentoro.llmc.parser;

import com.gentoro.llmc.exception.ValidationException;
import com.gentoro.llmc.json.JsonRepair;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Lookup table from model/provider identifiers to parser variants. Entries are checked in
 * registration order; the first key contained in any identifier wins, otherwise the fallback is
 * used.
 */
public final class ParserRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(ParserRegistry.class);

  private record Entry(String key, Function<JsonRepair, ResponseParser> factory) {}

  private final List<Entry> entries = new ArrayList<>();
  private final Function<JsonRepair, ResponseParser> fallback;

  public ParserRegistry(Function<JsonRepair, ResponseParser> fallback) {
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  /** Qwen models get the tag/JSON dialect; everything else the plain-text dialect. */
  public static ParserRegistry defaults() {
    return new ParserRegistry(GenericResponseParser::new)
        .register("qwen", QwenResponseParser::new);
  }

  public ParserRegistry register(String key, Function<JsonRepair, ResponseParser> factory) {
    if (key == null || key.isBlank()) {
      throw new ValidationException("Parser key must not be blank");
    }
    entries.add(new Entry(key.toLowerCase(Locale.ROOT), Objects.requireNonNull(factory)));
    return this;
  }

  public ResponseParser select(JsonRepair jsonRepair, String... identifiers) {
    for (Entry entry : entries) {
      for (String id : identifiers) {
        if (id != null && id.toLowerCase(Locale.ROOT).contains(entry.key())) {
          log.debug("Selected parser for key '{}' (identifier '{}')", entry.key(), id);
          return entry.factory().apply(jsonRepair);
        }
      }
    }
    return fallback.apply(jsonRepair);
  }
}
