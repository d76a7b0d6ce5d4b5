package com.gentoro.llmc.compiler;

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompilerOptionsTest {

  @Test
  @DisplayName("defaults optimize and extract semantics, everything else is off")
  void defaults() {
    CompilerOptions options = CompilerOptions.defaults();
    assertEquals("", options.modelProvider());
    assertFalse(options.strictMode());
    assertFalse(options.preserveThoughts());
    assertTrue(options.enableOptimizations());
    assertTrue(options.normalizeFilePaths());
    assertFalse(options.stopOnLexicalErrors());
    assertTrue(options.extractSemantics());
    assertFalse(options.detectHallucinations());
  }

  @Test
  @DisplayName("compiler keys are read from configuration")
  void fromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("compiler.modelProvider", "qwen");
    config.addProperty("compiler.strictMode", "true");
    config.addProperty("compiler.normalizeFilePaths", false);

    CompilerOptions options = CompilerOptions.fromConfiguration(config);
    assertEquals("qwen", options.modelProvider());
    assertTrue(options.strictMode());
    assertTrue(options.analysisOptions().strictMode());
    assertFalse(options.optimizationOptions().normalizeFilePaths());
    assertTrue(options.enableOptimizations());
  }

  @Test
  @DisplayName("toBuilder round-trips every field")
  void toBuilder() {
    CompilerOptions options =
        CompilerOptions.builder()
            .modelName("m")
            .preserveThoughts(true)
            .stopOnLexicalErrors(true)
            .detectHallucinations(true)
            .build();
    assertEquals(options, options.toBuilder().build());
    assertNotEquals(options, options.toBuilder().extractSemantics(false).build());
  }

  @Test
  @DisplayName("null model identifiers become empty")
  void nullIdentifiers() {
    CompilerOptions options = CompilerOptions.builder().modelProvider(null).modelName(null).build();
    assertEquals("", options.modelProvider());
    assertEquals("", options.modelName());
  }
}
