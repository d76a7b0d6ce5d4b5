package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.CodeNode;
import com.gentoro.llmc.ast.MarkdownElement;
import com.gentoro.llmc.ast.MarkdownNode;
import com.gentoro.llmc.ast.ResponseMetadata;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.Severity;
import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.ast.TextFormat;
import com.gentoro.llmc.ast.TextNode;
import com.gentoro.llmc.ast.ThoughtNode;
import com.gentoro.llmc.ast.ToolCallNode;
import com.gentoro.llmc.ast.ToolCallSignature;
import com.gentoro.llmc.ast.ToolResultNode;
import com.gentoro.llmc.exception.ExceptionUtil;
import com.gentoro.llmc.json.JsonRepair;
import com.gentoro.llmc.lexer.Token;
import com.gentoro.llmc.lexer.TokenType;
import com.gentoro.llmc.parser.rule.JsonFixup;
import com.gentoro.llmc.parser.rule.ScrubRule;
import com.gentoro.llmc.parser.rule.ThoughtRule;
import com.gentoro.llmc.parser.rule.ToolCallCandidate;
import com.gentoro.llmc.parser.rule.ToolCallRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared extraction pipeline of every parser variant. Variants contribute their dialect through the
 * rule lists ({@link #toolCallRules()}, {@link #thoughtRules()}, {@link #scrubRules()}, {@link
 * #jsonFixups()}) and a few hooks; the order of the steps is fixed here:
 *
 * <ol>
 *   <li>tool calls, de-duplicated by signature while extracting; calls inside untagged or
 *       {@code json} fences count, other fences are left to the code step
 *   <li>dialect extras such as echoed tool results
 *   <li>thought spans, kept as nodes or dropped
 *   <li>fenced code blocks (taken from the lexer tokens)
 *   <li>noise scrubbing of the residual text
 *   <li>file references, questions, commands, model-reported errors, markdown markers
 *   <li>one text node for whatever is left
 * </ol>
 *
 * <p>Every removal is tracked as a span of the original text, so all node spans point into the
 * text that was parsed.
 */
public abstract class AbstractResponseParser implements ResponseParser {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(AbstractResponseParser.class);

  private static final Set<String> EXECUTABLE_LANGUAGES =
      Set.of("bash", "sh", "shell", "zsh", "powershell", "ps1", "cmd", "bat", "console");

  private static final Pattern FILE_NAME_COMMENT =
      Pattern.compile(
          "^\\s*(?://|#|--|<!--|/\\*)\\s*(?:file(?:name)?|path)\\s*:\\s*(?<name>[^\\s*>]+)",
          Pattern.CASE_INSENSITIVE);

  /** Fence languages whose bodies are searched for tool calls. */
  private static final Set<String> CALL_FENCE_LANGUAGES = Set.of("", "json", "jsonc", "json5");

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

  /** Text-node content that still looks like tool-call JSON. */
  private static final Pattern LEFTOVER_TOOL_JSON =
      Pattern.compile("\\{\\s*[\"'](?:tool_call|tool)[\"']\\s*:");

  protected final JsonRepair jsonRepair;
  private final ToolCallInterpreter interpreter;

  protected AbstractResponseParser(JsonRepair jsonRepair) {
    this.jsonRepair = Objects.requireNonNull(jsonRepair, "jsonRepair");
    this.interpreter = new ToolCallInterpreter(jsonRepair);
  }

  protected abstract List<ToolCallRule> toolCallRules();

  protected abstract List<ThoughtRule> thoughtRules();

  protected abstract List<ScrubRule> scrubRules();

  protected List<JsonFixup> jsonFixups() {
    return List.of();
  }

  /**
   * Dialect-specific nodes taken from the residual text after tool calls. Returned nodes' spans
   * are removed from the residual text.
   */
  protected List<AstNode> extractDialectNodes(String source, Predicate<SourceSpan> isFree) {
    return List.of();
  }

  /** Whitespace normalization applied to the final text node. */
  protected String normalizeWhitespace(String text) {
    return EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
  }

  @Override
  public final ResponseNode parse(String text, ParserContext context) {
    String source = text == null ? "" : text;
    try {
      return doParse(source, context);
    } catch (RuntimeException | StackOverflowError e) {
      log.debug(
          "Parser {} failed, falling back to a single text node: {}",
          getClass().getSimpleName(),
          ExceptionUtil.formatCompactStackTrace(e));
      ResponseNode fallback =
          new ResponseNode(metadata(source, context, 0), new SourceSpan(0, source.length()));
      if (!source.isBlank()) {
        fallback.add(
            new TextNode(source.trim(), TextFormat.PLAIN, new SourceSpan(0, source.length())));
      }
      return fallback;
    }
  }

  private ResponseNode doParse(String source, ParserContext context) {
    List<SourceSpan> fences = fenceRegions(context.lexerResult().tokens());
    List<CodeNode> blocks = codeBlocks(source, context.lexerResult().tokens());
    ResidualText residual = ResidualText.of(source);

    // 1-2. tool calls
    ToolCallExtraction calls = extractToolCalls(source, blocks);
    residual = residual.without(calls.claimed());

    // dialect extras
    ResidualText afterCalls = residual;
    List<AstNode> extras =
        extractDialectNodes(
            source, span -> !afterCalls.isTouched(span) && !overlapsAny(span, fences));
    residual = residual.without(extras.stream().map(AstNode::span).toList());

    // 3. thoughts
    List<ThoughtNode> thoughts = new ArrayList<>();
    List<SourceSpan> thoughtSpans = new ArrayList<>();
    for (ThoughtRule rule : thoughtRules()) {
      for (ThoughtRule.Match match : rule.find(source)) {
        if (startsInside(match.span(), fences) || overlapsAny(match.span(), thoughtSpans)) {
          continue;
        }
        thoughtSpans.add(match.span());
        if (context.preserveThoughts()) {
          thoughts.add(
              new ThoughtNode(match.content().trim(), match.originalText(), true, match.span()));
        }
      }
    }
    residual = residual.without(thoughtSpans);

    // 4. code blocks
    List<CodeNode> code = new ArrayList<>();
    List<SourceSpan> codeSpans = new ArrayList<>();
    for (CodeNode block : blocks) {
      if (!residual.isTouched(block.span())) {
        code.add(block);
        codeSpans.add(block.span());
        continue;
      }
      Optional<String> rest = withoutClaimedCalls(block, source, calls.claimed());
      if (rest.isPresent()) {
        codeSpans.add(block.span());
        if (!rest.get().isBlank()) {
          code.add(
              new CodeNode(
                  block.language(),
                  rest.get().strip(),
                  block.fileName(),
                  block.executable(),
                  block.complete(),
                  block.span()));
        }
      }
    }
    residual = residual.without(codeSpans);

    // 5. noise
    for (ScrubRule rule : scrubRules()) {
      List<SourceSpan> hits = rule.find(residual.text());
      if (!hits.isEmpty()) {
        log.trace("Scrub rule {} removed {} span(s)", rule.name(), hits.size());
        residual = residual.withoutResidual(hits);
      }
    }

    ResponseNode root =
        new ResponseNode(
            metadata(source, context, calls.dropped()), new SourceSpan(0, source.length()));
    calls.nodes().forEach(root::add);
    extras.forEach(root::add);
    thoughts.forEach(root::add);
    code.forEach(root::add);

    // 6. semantic elements
    if (context.extractSemantics()) {
      String prose = residual.text();
      ResidualText view = residual;
      SemanticElementExtractor.fileReferences(prose, view::toOriginal).forEach(root::add);
      SemanticElementExtractor.questions(prose, view::toOriginal).forEach(root::add);
      SemanticElementExtractor.commands(prose, view::toOriginal).forEach(root::add);
      SemanticElementExtractor.modelErrors(prose, view::toOriginal).forEach(root::add);
      markdownNodes(source, context.lexerResult().tokens(), residual).forEach(root::add);
    }

    // 7. remaining text
    textNode(residual).ifPresent(root::add);

    log.debug(
        "{} parsed {} chars into {} nodes ({} tool calls, {} dropped candidates)",
        getClass().getSimpleName(),
        source.length(),
        root.children().size(),
        calls.nodes().size(),
        calls.dropped());
    return root;
  }

  private record ToolCallExtraction(
      List<ToolCallNode> nodes, List<SourceSpan> claimed, int dropped) {}

  private ToolCallExtraction extractToolCalls(String source, List<CodeNode> blocks) {
    List<SourceSpan> opaque = new ArrayList<>();
    List<SourceSpan> searchable = new ArrayList<>();
    for (CodeNode block : blocks) {
      if (CALL_FENCE_LANGUAGES.contains(block.language())) {
        searchable.add(block.span());
      } else {
        opaque.add(block.span());
      }
    }
    List<ToolCallCandidate> candidates = new ArrayList<>();
    List<ToolCallRule> rules = toolCallRules();
    for (ToolCallRule rule : rules) {
      candidates.addAll(rule.find(source));
    }
    // text order; at equal starts the wider span and then the earlier rule wins
    candidates.sort(
        Comparator.comparingInt((ToolCallCandidate c) -> c.span().start())
            .thenComparing(c -> -c.span().end())
            .thenComparingInt(c -> ruleIndex(rules, c.rule())));

    List<ToolCallNode> nodes = new ArrayList<>();
    List<SourceSpan> claimed = new ArrayList<>();
    Set<ToolCallSignature> seen = new HashSet<>();
    int dropped = 0;
    for (ToolCallCandidate candidate : candidates) {
      if (overlapsAny(candidate.span(), opaque)
          || straddles(candidate.span(), searchable)
          || overlapsAny(candidate.span(), claimed)) {
        continue;
      }
      Optional<ToolCallInterpreter.Call> call = parseCandidate(candidate);
      if (call.isEmpty()) {
        dropped++;
        log.debug(
            "Dropped {} candidate at [{}, {}): not a parseable tool call",
            candidate.rule(),
            candidate.span().start(),
            candidate.span().end());
        continue;
      }
      claimed.add(candidate.span());
      ToolCallNode node =
          new ToolCallNode(
              call.get().toolName(),
              call.get().arguments(),
              "call_" + (nodes.size() + 1),
              candidate.span());
      if (seen.add(node.signature())) {
        nodes.add(node);
      } else {
        log.debug("Skipped repeated tool call {}", node.signature());
      }
    }
    return new ToolCallExtraction(nodes, claimed, dropped);
  }

  private Optional<ToolCallInterpreter.Call> parseCandidate(ToolCallCandidate candidate) {
    String json = candidate.json();
    for (JsonFixup fixup : jsonFixups()) {
      json = fixup.apply(json);
    }
    return jsonRepair.safeParse(json, Map.class).flatMap(interpreter::interpret);
  }

  private static int ruleIndex(List<ToolCallRule> rules, String name) {
    for (int i = 0; i < rules.size(); i++) {
      if (rules.get(i).name().equals(name)) {
        return i;
      }
    }
    return rules.size();
  }

  /** Spans from each opening fence to its closing fence (or the end of the text). */
  static List<SourceSpan> fenceRegions(List<Token> tokens) {
    List<SourceSpan> regions = new ArrayList<>();
    int open = -1;
    int last = -1;
    for (Token t : tokens) {
      if (t.is(TokenType.CODE_FENCE_OPEN)) {
        open = t.start();
        last = t.end();
      } else if (open >= 0 && t.is(TokenType.CODE_CONTENT)) {
        last = t.end();
      } else if (open >= 0 && t.is(TokenType.CODE_FENCE_CLOSE)) {
        regions.add(new SourceSpan(open, t.end()));
        open = -1;
      }
    }
    if (open >= 0) {
      regions.add(new SourceSpan(open, last));
    }
    return regions;
  }

  private static List<CodeNode> codeBlocks(String source, List<Token> tokens) {
    List<CodeNode> blocks = new ArrayList<>();
    Token open = null;
    Token content = null;
    for (Token t : tokens) {
      if (t.is(TokenType.CODE_FENCE_OPEN)) {
        open = t;
        content = null;
      } else if (open != null && t.is(TokenType.CODE_CONTENT)) {
        content = t;
      } else if (open != null && t.is(TokenType.CODE_FENCE_CLOSE)) {
        blocks.add(codeNode(open, content, t.end(), true));
        open = null;
      }
    }
    if (open != null) {
      blocks.add(codeNode(open, content, source.length(), false));
    }
    return blocks;
  }

  private static CodeNode codeNode(Token open, Token content, int end, boolean complete) {
    String language = open.attribute() == null ? "" : open.attribute();
    String body = content == null ? "" : stripTrailingNewline(content.text());
    String fileName = null;
    int eol = body.indexOf('\n');
    Matcher m = FILE_NAME_COMMENT.matcher(eol < 0 ? body : body.substring(0, eol));
    if (m.find()) {
      fileName = m.group("name");
    }
    return new CodeNode(
        language,
        body,
        fileName,
        EXECUTABLE_LANGUAGES.contains(language),
        complete,
        new SourceSpan(open.start(), end));
  }

  private static String stripTrailingNewline(String text) {
    if (text.endsWith("\r\n")) return text.substring(0, text.length() - 2);
    if (text.endsWith("\n")) return text.substring(0, text.length() - 1);
    return text;
  }

  private static List<MarkdownNode> markdownNodes(
      String source, List<Token> tokens, ResidualText residual) {
    List<MarkdownNode> out = new ArrayList<>();
    for (Token t : tokens) {
      MarkdownElement element =
          switch (t.type()) {
            case HEADING -> MarkdownElement.HEADING;
            case LIST_MARKER -> MarkdownElement.LIST_ITEM;
            case BLOCKQUOTE -> MarkdownElement.BLOCKQUOTE;
            case HORIZONTAL_RULE -> MarkdownElement.HORIZONTAL_RULE;
            default -> null;
          };
      if (element == null || residual.isTouched(t.span())) {
        continue;
      }
      int eol = source.indexOf('\n', t.end());
      int lineEnd = eol < 0 ? source.length() : eol;
      int level = element == MarkdownElement.HEADING ? Integer.parseInt(t.attribute()) : 0;
      out.add(
          new MarkdownNode(
              element,
              level,
              t.text().trim(),
              source.substring(t.end(), lineEnd).trim(),
              new SourceSpan(t.start(), lineEnd)));
    }
    return out;
  }

  private Optional<TextNode> textNode(ResidualText residual) {
    String raw = residual.text();
    String content = normalizeWhitespace(raw).trim();
    if (content.isEmpty()) {
      return Optional.empty();
    }
    int first = 0;
    while (first < raw.length() && Character.isWhitespace(raw.charAt(first))) {
      first++;
    }
    int last = raw.length();
    while (last > first && Character.isWhitespace(raw.charAt(last - 1))) {
      last--;
    }
    SourceSpan span = residual.toOriginal(new SourceSpan(first, last));
    return Optional.of(
        new TextNode(content, SemanticElementExtractor.detectFormat(content), span));
  }

  private static ResponseMetadata metadata(String source, ParserContext context, int dropped) {
    boolean complete =
        !source.contains("[INCOMPLETE]") && !source.stripTrailing().endsWith("...");
    return new ResponseMetadata(context.modelProvider(), context.modelName(), complete, dropped);
  }

  private static boolean overlapsAny(SourceSpan span, List<SourceSpan> spans) {
    for (SourceSpan s : spans) {
      if (s.overlaps(span)) {
        return true;
      }
    }
    return false;
  }

  /** Whether the span overlaps a region without lying inside it. */
  private static boolean straddles(SourceSpan span, List<SourceSpan> regions) {
    for (SourceSpan r : regions) {
      if (r.overlaps(span) && !r.encloses(span)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The body of a fenced block once the tool calls claimed inside it are cut out, or empty when
   * the block holds no claimed call.
   */
  private static Optional<String> withoutClaimedCalls(
      CodeNode block, String source, List<SourceSpan> claimed) {
    String rest = block.code();
    boolean found = false;
    for (SourceSpan span : claimed) {
      if (block.span().encloses(span)) {
        rest = rest.replace(source.substring(span.start(), span.end()), "");
        found = true;
      }
    }
    return found ? Optional.of(rest) : Optional.empty();
  }

  private static boolean startsInside(SourceSpan span, List<SourceSpan> regions) {
    for (SourceSpan r : regions) {
      if (r.contains(span.start())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public ValidationResult validate(ResponseNode tree) {
    List<ValidationIssue> issues = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (AstNode child : tree.children()) {
      if (child instanceof ToolCallNode call) {
        if (call.callId() == null || call.callId().isBlank()) {
          issues.add(
              new ValidationIssue(
                  Severity.WARNING,
                  "Tool call '%s' has no call id".formatted(call.toolName()),
                  call));
        } else if (!ids.add(call.callId())) {
          issues.add(
              new ValidationIssue(
                  Severity.ERROR, "Duplicate call id '%s'".formatted(call.callId()), call));
        }
      } else if (child instanceof CodeNode block && block.language().isBlank()) {
        issues.add(
            new ValidationIssue(Severity.INFO, "Code block has no language tag", block));
      } else if (child instanceof TextNode text
          && LEFTOVER_TOOL_JSON.matcher(text.content()).find()) {
        issues.add(
            new ValidationIssue(
                Severity.WARNING, "Text contains what looks like an unextracted tool call", text));
      } else if (child instanceof ToolResultNode result && result.toolName().isBlank()) {
        issues.add(
            new ValidationIssue(Severity.INFO, "Tool result does not name its tool", result));
      }
    }
    return ValidationResult.of(issues);
  }
}
