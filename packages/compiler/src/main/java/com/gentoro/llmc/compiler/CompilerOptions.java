package com.gentoro.llmc.compiler;

import com.gentoro.llmc.optimizer.OptimizationOptions;
import com.gentoro.llmc.semantic.AnalysisOptions;
import org.apache.commons.configuration2.Configuration;

/**
 * Per-call switches of {@link ResponseCompiler#compile(String, CompilerOptions)}.
 *
 * @param modelProvider provider recorded in the tree metadata; blank means the compiler's own
 * @param modelName model recorded in the tree metadata; blank means the compiler's own
 * @param stopOnLexicalErrors skip every later phase when the lexer reports an error
 * @param extractSemantics extract file references, questions, commands and model errors
 * @param detectHallucinations run the hallucination detector during validation
 */
public record CompilerOptions(
    String modelProvider,
    String modelName,
    boolean strictMode,
    boolean preserveThoughts,
    boolean enableOptimizations,
    boolean normalizeFilePaths,
    boolean stopOnLexicalErrors,
    boolean extractSemantics,
    boolean detectHallucinations) {

  public CompilerOptions {
    modelProvider = modelProvider == null ? "" : modelProvider;
    modelName = modelName == null ? "" : modelName;
  }

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads the {@code compiler.*} keys; absent keys keep their defaults. */
  public static CompilerOptions fromConfiguration(Configuration config) {
    return builder()
        .modelProvider(config.getString("compiler.modelProvider", ""))
        .modelName(config.getString("compiler.modelName", ""))
        .strictMode(config.getBoolean("compiler.strictMode", false))
        .preserveThoughts(config.getBoolean("compiler.preserveThoughts", false))
        .enableOptimizations(config.getBoolean("compiler.enableOptimizations", true))
        .normalizeFilePaths(config.getBoolean("compiler.normalizeFilePaths", true))
        .stopOnLexicalErrors(config.getBoolean("compiler.stopOnLexicalErrors", false))
        .extractSemantics(config.getBoolean("compiler.extractSemantics", true))
        .detectHallucinations(config.getBoolean("compiler.detectHallucinations", false))
        .build();
  }

  public AnalysisOptions analysisOptions() {
    return new AnalysisOptions(strictMode);
  }

  public OptimizationOptions optimizationOptions() {
    return new OptimizationOptions(normalizeFilePaths);
  }

  public Builder toBuilder() {
    return builder()
        .modelProvider(modelProvider)
        .modelName(modelName)
        .strictMode(strictMode)
        .preserveThoughts(preserveThoughts)
        .enableOptimizations(enableOptimizations)
        .normalizeFilePaths(normalizeFilePaths)
        .stopOnLexicalErrors(stopOnLexicalErrors)
        .extractSemantics(extractSemantics)
        .detectHallucinations(detectHallucinations);
  }

  public static final class Builder {
    private String modelProvider = "";
    private String modelName = "";
    private boolean strictMode = false;
    private boolean preserveThoughts = false;
    private boolean enableOptimizations = true;
    private boolean normalizeFilePaths = true;
    private boolean stopOnLexicalErrors = false;
    private boolean extractSemantics = true;
    private boolean detectHallucinations = false;

    public Builder modelProvider(String modelProvider) {
      this.modelProvider = modelProvider;
      return this;
    }

    public Builder modelName(String modelName) {
      this.modelName = modelName;
      return this;
    }

    public Builder strictMode(boolean strictMode) {
      this.strictMode = strictMode;
      return this;
    }

    public Builder preserveThoughts(boolean preserveThoughts) {
      this.preserveThoughts = preserveThoughts;
      return this;
    }

    public Builder enableOptimizations(boolean enableOptimizations) {
      this.enableOptimizations = enableOptimizations;
      return this;
    }

    public Builder normalizeFilePaths(boolean normalizeFilePaths) {
      this.normalizeFilePaths = normalizeFilePaths;
      return this;
    }

    public Builder stopOnLexicalErrors(boolean stopOnLexicalErrors) {
      this.stopOnLexicalErrors = stopOnLexicalErrors;
      return this;
    }

    public Builder extractSemantics(boolean extractSemantics) {
      this.extractSemantics = extractSemantics;
      return this;
    }

    public Builder detectHallucinations(boolean detectHallucinations) {
      this.detectHallucinations = detectHallucinations;
      return this;
    }

    public CompilerOptions build() {
      return new CompilerOptions(
          modelProvider,
          modelName,
          strictMode,
          preserveThoughts,
          enableOptimizations,
          normalizeFilePaths,
          stopOnLexicalErrors,
          extractSemantics,
          detectHallucinations);
    }
  }
}
