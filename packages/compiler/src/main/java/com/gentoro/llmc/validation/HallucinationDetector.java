package com.gentoro.llmc.validation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects responses that pretend tools ran: invented result blocks, or file contents, directory
 * trees and finished code shown although the response requested no tool call.
 */
public class HallucinationDetector {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(HallucinationDetector.class);

  static final String RETRY_ACTION =
      "The model appears to be hallucinating. Request should be retried with stricter prompting.";

  private static final Pattern FAKE_TOOL_RESULT =
      Pattern.compile(
          "\\[Tool Results?]|\\[Tool Execution]|\\[Output]|\\[Result]|<<<.*?>>>|```tool.*?```",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern FAKE_TOOL_JSON =
      Pattern.compile(
          "^\\s*\\[Tool Results?]\\s*\\n\\s*\\{.*?\"tool\"\\s*:\\s*\".*?\"",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern FAKE_FILE_CONTENT =
      Pattern.compile(
          "(?:Here(?:'s| is) (?:the )?(?:content|code)|The (?:file|code) contains?"
              + "|File contents?:)[\\s\\S]*?```[\\s\\S]*?```",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern CLAIM =
      Pattern.compile(
          "(?:I've |I have |I |Let me )(?:read|checked|looked at|examined|found|executed|ran|listed)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern FAKE_DIRECTORY =
      Pattern.compile("├──|└──|│\\s+|Directory listing:|Files? found:");

  private static final Pattern CODE_BLOCK =
      Pattern.compile("```(?<lang>\\w+)?\\s*(?<code>[\\s\\S]*?)```");

  private static final List<Pattern> COMPLETE_CODE_DECLARATIONS =
      List.of(
          Pattern.compile(
              "^\\s*(?:public|private|internal)?\\s*(?:class|interface|namespace)\\s+\\w+",
              Pattern.MULTILINE),
          Pattern.compile("^\\s*(?:def|class)\\s+\\w+", Pattern.MULTILINE),
          Pattern.compile("^\\s*(?:export|module\\.exports)", Pattern.MULTILINE));

  private static final int MIN_CODE_LENGTH = 100;

  private static final Pattern BRACKETED_OUTPUT =
      Pattern.compile(
          "\\[(?:Tool |Output|Result|File).*?][\\s\\S]*?(?=\\n\\n|\\z)", Pattern.CASE_INSENSITIVE);
  private static final Pattern TREE_LINE = Pattern.compile("(?:├──|└──|│).*\\n");
  private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

  public HallucinationReport check(String responseText, boolean hadToolCalls) {
    if (responseText == null || responseText.isBlank()) {
      return HallucinationReport.CLEAN;
    }
    Set<HallucinationIndicator> found = EnumSet.noneOf(HallucinationIndicator.class);
    List<String> issues = new ArrayList<>();

    // Result markers are fabricated whether or not the response also requested tools.
    if (FAKE_TOOL_RESULT.matcher(responseText).find()
        || FAKE_TOOL_JSON.matcher(responseText).find()) {
      found.add(HallucinationIndicator.FAKE_TOOL_RESULT);
      issues.add("Response contains fake tool result markers like [Tool Results]");
    }
    if (!hadToolCalls) {
      if (FAKE_FILE_CONTENT.matcher(responseText).find()) {
        found.add(HallucinationIndicator.FAKE_FILE_CONTENT);
        issues.add("Response claims to show file content without actual tool calls");
      }
      long claims = CLAIM.matcher(responseText).results().count();
      if (claims > 0) {
        found.add(HallucinationIndicator.UNSUBSTANTIATED_CLAIM);
        issues.add(
            "Response claims to have performed %d action(s) without tool calls".formatted(claims));
      }
      if (FAKE_DIRECTORY.matcher(responseText).find()) {
        found.add(HallucinationIndicator.FAKE_DIRECTORY_LISTING);
        issues.add("Response contains a directory listing without a list_directory tool call");
      }
      Matcher block = CODE_BLOCK.matcher(responseText);
      while (block.find()) {
        if (looksLikeCompleteCode(block.group("code"))) {
          found.add(HallucinationIndicator.SUSPICIOUS_CODE);
          String lang = block.group("lang") == null ? "" : block.group("lang") + " ";
          issues.add("Response contains complete " + lang + "code without a read_file tool call");
        }
      }
    }
    if (found.isEmpty()) {
      return HallucinationReport.CLEAN;
    }

    boolean hallucinating =
        found.contains(HallucinationIndicator.FAKE_TOOL_RESULT)
            || found.contains(HallucinationIndicator.FAKE_FILE_CONTENT)
            || found.contains(HallucinationIndicator.FAKE_DIRECTORY_LISTING)
            || found.contains(HallucinationIndicator.SUSPICIOUS_CODE)
            || (found.contains(HallucinationIndicator.UNSUBSTANTIATED_CLAIM) && issues.size() > 1);
    log.debug("Hallucination check found {} (hallucinating: {})", issues, hallucinating);
    return new HallucinationReport(
        hallucinating, found, issues, hallucinating ? RETRY_ACTION : null);
  }

  static boolean looksLikeCompleteCode(String code) {
    if (code == null || code.isBlank() || code.length() < MIN_CODE_LENGTH) {
      return false;
    }
    return COMPLETE_CODE_DECLARATIONS.stream().anyMatch(p -> p.matcher(code).find());
  }

  /** Removes fabricated result markers, bracketed output blocks and directory-tree lines. */
  public String clean(String responseText) {
    if (responseText == null || responseText.isBlank()) {
      return responseText;
    }
    String cleaned = FAKE_TOOL_RESULT.matcher(responseText).replaceAll("");
    cleaned = BRACKETED_OUTPUT.matcher(cleaned).replaceAll("");
    cleaned = TREE_LINE.matcher(cleaned).replaceAll("");
    cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
    return cleaned.trim();
  }
}
