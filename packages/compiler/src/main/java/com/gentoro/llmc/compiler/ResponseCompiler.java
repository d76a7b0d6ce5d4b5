package com.gentoro.llmc.compiler;

import com.gentoro.llmc.ast.CompilationPhase;
import com.gentoro.llmc.ast.Diagnostic;
import com.gentoro.llmc.ast.LineIndex;
import com.gentoro.llmc.ast.ResponseMetadata;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.ast.ToolCallNode;
import com.gentoro.llmc.exception.ExceptionUtil;
import com.gentoro.llmc.json.JsonRepair;
import com.gentoro.llmc.json.LenientJsonRepair;
import com.gentoro.llmc.lexer.LexerResult;
import com.gentoro.llmc.lexer.LexicalError;
import com.gentoro.llmc.lexer.ResponseLexer;
import com.gentoro.llmc.lexer.Token;
import com.gentoro.llmc.optimizer.AstOptimizer;
import com.gentoro.llmc.parser.ParserContext;
import com.gentoro.llmc.parser.ParserRegistry;
import com.gentoro.llmc.parser.ResponseParser;
import com.gentoro.llmc.parser.ValidationIssue;
import com.gentoro.llmc.semantic.QuestionRewrite;
import com.gentoro.llmc.semantic.SemanticAnalysis;
import com.gentoro.llmc.semantic.SemanticAnalyzer;
import com.gentoro.llmc.semantic.SemanticSummary;
import com.gentoro.llmc.semantic.ToolSchemaRegistry;
import com.gentoro.llmc.validation.HallucinationDetector;
import com.gentoro.llmc.validation.HallucinationReport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Compiles model response text into a response tree: lex, parse, analyze, optimize, validate.
 *
 * <p>{@link #compile} never throws. Unexpected failures in any phase become a single error
 * diagnostic tagged with the phase that was running.
 *
 * <p>An instance caches its last result and is not safe for concurrent use; use one compiler per
 * conversation turn.
 */
public class ResponseCompiler {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(ResponseCompiler.class);

  static final String INTERNAL_ERROR_PREFIX = "Internal compiler error: ";

  private final ResponseLexer lexer;
  private final ResponseParser parser;
  private final SemanticAnalyzer analyzer;
  private final AstOptimizer optimizer;
  private final HallucinationDetector hallucinationDetector;
  private final String modelProvider;
  private final String modelName;

  private CompilationResult lastResult;

  public ResponseCompiler(String modelProvider) {
    this(modelProvider, "", new LenientJsonRepair(), ToolSchemaRegistry.builtIn());
  }

  public ResponseCompiler(String modelProvider, String modelName) {
    this(modelProvider, modelName, new LenientJsonRepair(), ToolSchemaRegistry.builtIn());
  }

  /** Picks the parser variant for the provider and model from {@link ParserRegistry#defaults()}. */
  public ResponseCompiler(
      String modelProvider, String modelName, JsonRepair jsonRepair, ToolSchemaRegistry schemas) {
    this(
        modelProvider,
        modelName,
        new ResponseLexer(),
        ParserRegistry.defaults().select(jsonRepair, modelProvider, modelName),
        new SemanticAnalyzer(schemas),
        new AstOptimizer(),
        new HallucinationDetector());
  }

  public ResponseCompiler(
      String modelProvider,
      String modelName,
      ResponseLexer lexer,
      ResponseParser parser,
      SemanticAnalyzer analyzer,
      AstOptimizer optimizer,
      HallucinationDetector hallucinationDetector) {
    this.modelProvider = modelProvider == null ? "" : modelProvider;
    this.modelName = modelName == null ? "" : modelName;
    this.lexer = Objects.requireNonNull(lexer, "lexer");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.optimizer = Objects.requireNonNull(optimizer, "optimizer");
    this.hallucinationDetector =
        Objects.requireNonNull(hallucinationDetector, "hallucinationDetector");
  }

  public ResponseParser parser() {
    return parser;
  }

  /** The result of the most recent compile call, if any. */
  public Optional<CompilationResult> lastResult() {
    return Optional.ofNullable(lastResult);
  }

  public CompilationResult compile(String text) {
    return compile(text, CompilerOptions.defaults());
  }

  public CompilationResult compile(String text, CompilerOptions options) {
    long started = System.nanoTime();
    String source = text == null ? "" : text;
    CompilerOptions opts = options == null ? CompilerOptions.defaults() : options;
    LineIndex lines = new LineIndex(source);

    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Token> tokens = List.of();
    ResponseNode tree = null;
    SemanticSummary summary = SemanticSummary.EMPTY;
    CompilationPhase phase = CompilationPhase.LEXICAL;
    try {
      LexerResult lexed = lexer.tokenize(source);
      tokens = lexed.tokens();
      for (LexicalError error : lexed.errors()) {
        diagnostics.add(
            new Diagnostic(
                error.severity(),
                error.message(),
                CompilationPhase.LEXICAL,
                error.line(),
                error.column(),
                null));
      }
      if (opts.stopOnLexicalErrors() && lexed.hasErrors()) {
        log.debug("Stopping after lexical errors: {}", lexed.errors());
        return finish(tokens, emptyTree(source, opts), summary, diagnostics, started);
      }

      phase = CompilationPhase.PARSING;
      tree = parser.parse(source, parserContext(opts, lexed));

      phase = CompilationPhase.SEMANTIC;
      SemanticAnalysis analysis = analyzer.analyze(tree, opts.analysisOptions());
      for (QuestionRewrite rewrite : analysis.questionRewrites()) {
        tree.replace(rewrite.original(), rewrite.normalized());
      }
      analysis.diagnostics().forEach(d -> diagnostics.add(positioned(d, lines)));
      summary = analysis.summary();

      if (opts.enableOptimizations()) {
        phase = CompilationPhase.OPTIMIZATION;
        optimizer.optimize(tree, opts.optimizationOptions());
      }

      phase = CompilationPhase.VALIDATION;
      for (ValidationIssue issue : parser.validate(tree).issues()) {
        diagnostics.add(
            positioned(
                new Diagnostic(
                    issue.severity(),
                    issue.message(),
                    CompilationPhase.VALIDATION,
                    null,
                    null,
                    issue.node()),
                lines));
      }
      if (opts.detectHallucinations()) {
        boolean hadToolCalls = !tree.childrenOfType(ToolCallNode.class).isEmpty();
        HallucinationReport report = hallucinationDetector.check(source, hadToolCalls);
        for (String issue : report.issues()) {
          diagnostics.add(Diagnostic.warning(CompilationPhase.VALIDATION, issue, null));
        }
      }
    } catch (Exception | StackOverflowError e) {
      log.debug(
          "Internal fault during {}: {}", phase, ExceptionUtil.formatCompactStackTrace(e));
      diagnostics.add(
          Diagnostic.error(
              phase, INTERNAL_ERROR_PREFIX + ExceptionUtil.toErrorDetails(e).summary(), null));
    }
    return finish(
        tokens, tree == null ? emptyTree(source, opts) : tree, summary, diagnostics, started);
  }

  private CompilationResult finish(
      List<Token> tokens,
      ResponseNode tree,
      SemanticSummary summary,
      List<Diagnostic> diagnostics,
      long started) {
    boolean success = diagnostics.stream().noneMatch(Diagnostic::isError);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    CompilationResult result =
        new CompilationResult(tokens, tree, summary, diagnostics, elapsed, success);
    log.debug(
        "Compiled {} tokens into {} nodes with {} diagnostics in {} ms (success: {})",
        tokens.size(),
        tree.totalNodeCount(),
        diagnostics.size(),
        elapsed.toMillis(),
        success);
    lastResult = result;
    return result;
  }

  private ParserContext parserContext(CompilerOptions opts, LexerResult lexed) {
    return new ParserContext(
        opts.modelProvider().isBlank() ? modelProvider : opts.modelProvider(),
        opts.modelName().isBlank() ? modelName : opts.modelName(),
        opts.preserveThoughts(),
        opts.extractSemantics(),
        lexed);
  }

  private ResponseNode emptyTree(String source, CompilerOptions opts) {
    return new ResponseNode(
        new ResponseMetadata(
            opts.modelProvider().isBlank() ? modelProvider : opts.modelProvider(),
            opts.modelName().isBlank() ? modelName : opts.modelName(),
            true,
            0),
        new SourceSpan(0, source.length()));
  }

  private static Diagnostic positioned(Diagnostic diagnostic, LineIndex lines) {
    if (diagnostic.hasPosition() || diagnostic.node() == null) {
      return diagnostic;
    }
    int offset = diagnostic.node().span().start();
    return diagnostic.withPosition(lines.line(offset), lines.column(offset));
  }

  public CompilationResult compileIncremental(Iterable<String> chunks, CompilerOptions options) {
    return compileIncremental(
        chunks.iterator(), options, IncrementalUpdateListener.NONE, CancellationSignal.NEVER);
  }

  public CompilationResult compileIncremental(
      Stream<String> chunks,
      CompilerOptions options,
      IncrementalUpdateListener listener,
      CancellationSignal cancellation) {
    return compileIncremental(chunks.iterator(), options, listener, cancellation);
  }

  /**
   * Recompiles a growing buffer as chunks arrive. After each chunk the listener receives the
   * tokens and diagnostics beyond the previous chunk's counts.
   *
   * <p>Every chunk recompiles the whole buffer, so a full stream costs quadratic time in its
   * length. Cancellation is checked before each chunk; chunks already consumed stay compiled and
   * their result is returned. Exceptions thrown by {@code chunks} itself reach the caller.
   *
   * @return the result for the whole buffer, equal to {@code compile(buffer, options)}
   */
  public CompilationResult compileIncremental(
      Iterator<String> chunks,
      CompilerOptions options,
      IncrementalUpdateListener listener,
      CancellationSignal cancellation) {
    IncrementalUpdateListener target = listener == null ? IncrementalUpdateListener.NONE : listener;
    CancellationSignal signal = cancellation == null ? CancellationSignal.NEVER : cancellation;

    StringBuilder buffer = new StringBuilder();
    int lastTokenCount = 0;
    int lastDiagnosticCount = 0;
    int chunkIndex = 0;
    CompilationResult result = null;
    while (true) {
      if (signal.isCancelled()) {
        log.debug("Incremental compilation cancelled after {} chunk(s)", chunkIndex);
        break;
      }
      if (!chunks.hasNext()) {
        break;
      }
      String chunk = chunks.next();
      if (chunk == null) {
        continue;
      }
      buffer.append(chunk);
      result = compile(buffer.toString(), options);
      IncrementalUpdate update =
          new IncrementalUpdate(
              chunkIndex++,
              buffer.length(),
              tail(result.tokens(), lastTokenCount),
              tail(result.diagnostics(), lastDiagnosticCount),
              result.tree(),
              result.success());
      lastTokenCount = result.tokens().size();
      lastDiagnosticCount = result.diagnostics().size();
      notify(target, update);
    }
    return result == null ? compile(buffer.toString(), options) : result;
  }

  private static <T> List<T> tail(List<T> items, int previousCount) {
    return items.subList(Math.min(previousCount, items.size()), items.size());
  }

  private static void notify(IncrementalUpdateListener listener, IncrementalUpdate update) {
    try {
      listener.onUpdate(update);
    } catch (RuntimeException e) {
      log.warn(
          "Incremental update listener failed on chunk {}: {}",
          update.chunkIndex(),
          ExceptionUtil.formatCompactStackTrace(e));
    }
  }
}
