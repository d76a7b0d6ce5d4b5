package com.gentoro.llmc.lexer;

import com.gentoro.llmc.ast.LineIndex;
import com.gentoro.llmc.ast.Severity;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes raw model output into lexical spans.
 *
 * <p>{@link #tokenize(String)} is total: any input, including {@code null}, empty text or binary
 * garbage, yields a token list ending in {@link TokenType#EOF}. Problems are reported as {@link
 * LexicalError}s:
 *
 * <ul>
 *   <li>{@code ERROR}: an unterminated code fence, which swallows the rest of the input
 *   <li>{@code WARNING}: an unterminated JSON span or an unclosed wrapper tag
 *   <li>{@code INFO}: stray control characters and unmatched closing tags
 * </ul>
 */
public class ResponseLexer {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(ResponseLexer.class);

  static final Set<String> KNOWN_TAGS =
      Set.of(
          "thinking",
          "thought",
          "think",
          "internal",
          "tool_call",
          "tool_use",
          "function_call",
          "tool_response",
          "tool_result");

  private static final String FENCE = "```";
  private static final Pattern TAG = Pattern.compile("<(/?)([A-Za-z_]+)>");
  private static final Pattern HEADING = Pattern.compile("(#{1,6})[ \\t]+");
  private static final Pattern LIST_MARKER =
      Pattern.compile("[ \\t]{0,3}(?:[-*+]|\\d{1,3}[.)])[ \\t]+");
  private static final Pattern BLOCKQUOTE = Pattern.compile(">[ \\t]?");
  private static final Pattern RULE =
      Pattern.compile("[ \\t]{0,3}(?:-{3,}|\\*{3,}|_{3,})[ \\t]*(?=\\n|$)");
  private static final Pattern FENCE_LANGUAGE = Pattern.compile("[\\w+#.\\-]*");

  public LexerResult tokenize(String input) {
    String text = input == null ? "" : input;
    Scan scan = new Scan(text);
    scan.run();
    log.debug(
        "Tokenized {} chars into {} tokens ({} issues)",
        text.length(),
        scan.tokens.size(),
        scan.errors.size());
    return new LexerResult(scan.tokens, scan.errors);
  }

  /** Mutable state of one tokenization. */
  private static final class Scan {
    private final String text;
    private final LineIndex lines;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexicalError> errors = new ArrayList<>();
    private final Deque<Token> openTags = new ArrayDeque<>();
    private int pos;
    private int textStart = -1;
    private boolean lineStart = true;
    private boolean inControlRun;

    Scan(String text) {
      this.text = text;
      this.lines = new LineIndex(text);
    }

    void run() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (text.startsWith(FENCE, pos)) {
          fence();
        } else if (c == '\n') {
          emit(TokenType.NEWLINE, pos, pos + 1, null);
          lineStart = true;
        } else if (lineStart && lineMarker()) {
          lineStart = false;
        } else if (c == '`') {
          inlineCode();
        } else if (c == '<') {
          tag();
        } else if (c == '{' || (c == '[' && looksLikeJsonArray(pos))) {
          json();
        } else if (text.startsWith("**", pos) || text.startsWith("__", pos)) {
          emit(TokenType.EMPHASIS, pos, pos + 2, null);
        } else {
          plain(c);
        }
      }
      flushText();
      for (java.util.Iterator<Token> it = openTags.descendingIterator(); it.hasNext(); ) {
        Token open = it.next();
        error(Severity.WARNING, "Unclosed <%s> tag".formatted(open.attribute()), open.start());
      }
      tokens.add(token(TokenType.EOF, text.length(), text.length(), null));
    }

    private void plain(char c) {
      if (Character.isISOControl(c) && c != '\t' && c != '\r') {
        if (!inControlRun) {
          error(Severity.INFO, "Stray control character U+%04X".formatted((int) c), pos);
          inControlRun = true;
        }
      } else {
        inControlRun = false;
      }
      if (textStart < 0) {
        textStart = pos;
      }
      if (!Character.isWhitespace(c)) {
        lineStart = false;
      }
      pos++;
    }

    private void fence() {
      int open = pos;
      int afterTicks = pos + FENCE.length();
      Matcher lang = FENCE_LANGUAGE.matcher(text).region(afterTicks, text.length());
      lang.lookingAt();
      String language = lang.group().toLowerCase(Locale.ROOT);
      int contentStart = lang.end();
      int eol = text.indexOf('\n', contentStart);
      if (eol >= 0 && text.substring(contentStart, eol).isBlank()) {
        contentStart = eol + 1;
      }
      emit(TokenType.CODE_FENCE_OPEN, open, contentStart, language);

      int close = text.indexOf(FENCE, contentStart);
      if (close < 0) {
        if (contentStart < text.length()) {
          emit(TokenType.CODE_CONTENT, contentStart, text.length(), null);
        }
        error(Severity.ERROR, "Unterminated code fence", open);
        pos = text.length();
        return;
      }
      if (close > contentStart) {
        emit(TokenType.CODE_CONTENT, contentStart, close, null);
      }
      emit(TokenType.CODE_FENCE_CLOSE, close, close + FENCE.length(), null);
      lineStart = false;
    }

    private boolean lineMarker() {
      for (Pattern p : new Pattern[] {RULE, HEADING, LIST_MARKER, BLOCKQUOTE}) {
        Matcher m = p.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
          TokenType type;
          String attribute = null;
          if (p == HEADING) {
            type = TokenType.HEADING;
            attribute = String.valueOf(m.group(1).length());
          } else if (p == LIST_MARKER) {
            type = TokenType.LIST_MARKER;
          } else if (p == BLOCKQUOTE) {
            type = TokenType.BLOCKQUOTE;
          } else {
            type = TokenType.HORIZONTAL_RULE;
          }
          emit(type, m.start(), m.end(), attribute);
          return true;
        }
      }
      return false;
    }

    private void inlineCode() {
      int close = text.indexOf('`', pos + 1);
      int eol = text.indexOf('\n', pos + 1);
      if (close > pos + 1 && (eol < 0 || close < eol)) {
        emit(TokenType.INLINE_CODE, pos, close + 1, null);
      } else {
        plain('`');
      }
    }

    private void tag() {
      Matcher m = TAG.matcher(text).region(pos, text.length());
      if (!m.lookingAt() || !KNOWN_TAGS.contains(m.group(2).toLowerCase(Locale.ROOT))) {
        plain('<');
        return;
      }
      String name = m.group(2).toLowerCase(Locale.ROOT);
      boolean closing = !m.group(1).isEmpty();
      Token tok =
          emit(closing ? TokenType.TAG_CLOSE : TokenType.TAG_OPEN, m.start(), m.end(), name);
      if (!closing) {
        openTags.push(tok);
        return;
      }
      Token match = null;
      for (Token open : openTags) {
        if (open.attribute().equals(name)) {
          match = open;
          break;
        }
      }
      if (match == null) {
        error(Severity.INFO, "Closing </%s> tag without opening tag".formatted(name), tok.start());
      } else {
        openTags.remove(match);
      }
    }

    private void json() {
      int end = JsonSpanScanner.findClosing(text, pos);
      if (end < 0) {
        error(Severity.WARNING, "Unterminated JSON span", pos);
        plain(text.charAt(pos));
        return;
      }
      emit(TokenType.JSON_SPAN, pos, end, null);
      lineStart = false;
    }

    private boolean looksLikeJsonArray(int at) {
      int i = at + 1;
      while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
        i++;
      }
      return i < text.length() && (text.charAt(i) == '{' || text.charAt(i) == '"');
    }

    private Token emit(TokenType type, int start, int end, String attribute) {
      flushText();
      Token t = token(type, start, end, attribute);
      tokens.add(t);
      pos = end;
      inControlRun = false;
      lineStart = false;
      return t;
    }

    private void flushText() {
      if (textStart >= 0 && textStart < pos) {
        tokens.add(token(TokenType.TEXT, textStart, pos, null));
      }
      textStart = -1;
    }

    private Token token(TokenType type, int start, int end, String attribute) {
      return new Token(
          type,
          text.substring(start, end),
          start,
          end,
          lines.line(start),
          lines.column(start),
          attribute);
    }

    private void error(Severity severity, String message, int offset) {
      errors.add(
          new LexicalError(severity, message, offset, lines.line(offset), lines.column(offset)));
    }
  }
}
