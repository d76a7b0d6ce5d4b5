package com.gentoro.llmc.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link JsonRepair} backed by a lenient Jackson mapper plus a handful of textual fixes for the
 * malformations models produce most: smart quotes, trailing commas, truncated output and surplus
 * closing brackets.
 */
public class LenientJsonRepair implements JsonRepair {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(LenientJsonRepair.class);

  private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

  private static final ObjectMapper STRICT =
      JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build();

  private static final ObjectMapper LENIENT =
      JsonMapper.builder()
          .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
          .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
          .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
          .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
          .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
          .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .build();

  @Override
  public <T> Optional<T> safeParse(String json, Class<T> type) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    RepairResult repair = tryRepair(json);
    if (!repair.repaired()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(LENIENT.readValue(repair.text(), type));
    } catch (JsonProcessingException e) {
      log.debug(
          "Repaired JSON does not bind to {}: {}", type.getSimpleName(), e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public RepairResult tryRepair(String raw) {
    if (raw == null || raw.isBlank()) {
      return new RepairResult(false, raw == null ? "" : raw);
    }
    String candidate = raw.trim();
    if (parses(candidate)) {
      return new RepairResult(true, candidate);
    }

    candidate = normalizeQuotes(candidate);
    candidate = TRAILING_COMMA.matcher(candidate).replaceAll("$1");
    if (parses(candidate)) {
      return new RepairResult(true, candidate);
    }

    String balanced = balance(candidate);
    if (!balanced.equals(candidate) && parses(balanced)) {
      return new RepairResult(true, balanced);
    }
    log.debug("Unable to repair JSON candidate of {} chars", raw.length());
    return new RepairResult(false, raw);
  }

  @Override
  public boolean isCompleteJson(String text) {
    if (text == null) {
      return false;
    }
    String trimmed = text.trim();
    if (!(trimmed.startsWith("{") && trimmed.endsWith("}"))
        && !(trimmed.startsWith("[") && trimmed.endsWith("]"))) {
      return false;
    }
    try {
      JsonNode node = STRICT.readTree(trimmed);
      return node != null && node.isContainerNode();
    } catch (JsonProcessingException e) {
      return false;
    }
  }

  private static boolean parses(String text) {
    try {
      JsonNode node = LENIENT.readTree(text);
      return node != null && !node.isMissingNode();
    } catch (JsonProcessingException e) {
      return false;
    }
  }

  static String normalizeQuotes(String text) {
    return text.replace('“', '"')
        .replace('”', '"')
        .replace('„', '"')
        .replace('″', '"')
        .replace('‘', '\'')
        .replace('’', '\'');
  }

  /**
   * Close what truncation left open (string, arrays, objects) and drop closing brackets that have
   * no opener.
   */
  static String balance(String text) {
    StringBuilder out = new StringBuilder(text.length() + 8);
    Deque<Character> expected = new ArrayDeque<>();
    boolean inString = false;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        out.append(c);
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      switch (c) {
        case '"' -> {
          inString = true;
          out.append(c);
        }
        case '{' -> {
          expected.push('}');
          out.append(c);
        }
        case '[' -> {
          expected.push(']');
          out.append(c);
        }
        case '}', ']' -> {
          if (!expected.isEmpty() && expected.peek() == c) {
            expected.pop();
            out.append(c);
          }
        }
        default -> out.append(c);
      }
    }
    if (escaped) {
      out.setLength(out.length() - 1);
    }
    if (inString) {
      out.append('"');
    }
    String body = TRAILING_COMMA.matcher(out).replaceAll("$1");
    StringBuilder closed = new StringBuilder(body.stripTrailing());
    int last = closed.length() - 1;
    if (last >= 0 && closed.charAt(last) == ',') {
      closed.setLength(last);
    } else if (last >= 0 && closed.charAt(last) == ':') {
      closed.append("null");
    }
    while (!expected.isEmpty()) {
      closed.append(expected.pop());
    }
    return closed.toString();
  }
}
