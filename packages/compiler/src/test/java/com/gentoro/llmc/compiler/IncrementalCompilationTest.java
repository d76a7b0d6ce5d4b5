package com.gentoro.llmc.compiler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.ToolCallNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IncrementalCompilationTest {

  private final ResponseCompiler compiler = new ResponseCompiler("generic");

  @Test
  @DisplayName("the final result equals a batch compile of the whole text")
  void matchesBatch() {
    List<String> chunks =
        List.of(
            "Let me read it. {\"tool_call\":{\"name\":",
            "\"read_file\",\"arguments\":{\"path\":\"a\"}}}",
            "\nShould I continue?");
    CompilationResult incremental = compiler.compileIncremental(chunks, CompilerOptions.defaults());
    CompilationResult batch = compiler.compile(String.join("", chunks));

    assertEquals(batch.tree(), incremental.tree());
    assertEquals(batch.diagnostics(), incremental.diagnostics());
    assertEquals(batch.tokens(), incremental.tokens());
    assertEquals(1, incremental.tree().childrenOfType(ToolCallNode.class).size());
  }

  @Test
  @DisplayName("each update carries only what is new since the previous chunk")
  void updatesCarryDeltas() {
    List<IncrementalUpdate> updates = new ArrayList<>();
    compiler.compileIncremental(
        Stream.of("Hello", " world"), null, updates::add, CancellationSignal.NEVER);

    assertEquals(2, updates.size());
    assertEquals(0, updates.get(0).chunkIndex());
    assertEquals(5, updates.get(0).bufferLength());
    assertFalse(updates.get(0).newTokens().isEmpty());
    assertEquals(1, updates.get(1).chunkIndex());
    assertEquals(11, updates.get(1).bufferLength());
    assertTrue(updates.get(1).newTokens().isEmpty());
    assertTrue(updates.get(1).success());
  }

  @Test
  @DisplayName("cancellation stops before the next chunk and keeps what was compiled")
  void cancellation() {
    CancellationSignal.Flag flag = CancellationSignal.flag();
    List<IncrementalUpdate> updates = new ArrayList<>();
    CompilationResult result =
        compiler.compileIncremental(
            Stream.of("First part.", " Second part."),
            null,
            update -> {
              updates.add(update);
              flag.cancel();
            },
            flag);

    assertEquals(1, updates.size());
    assertEquals(compiler.compile("First part.").tree(), result.tree());
  }

  @Test
  @DisplayName("null chunks are skipped and a failing listener does not stop the stream")
  void nullChunksAndFailingListener() {
    List<Integer> seen = new ArrayList<>();
    CompilationResult result =
        compiler.compileIncremental(
            Arrays.asList("One.", null, " Two.").iterator(),
            null,
            update -> {
              seen.add(update.chunkIndex());
              throw new IllegalStateException("listener broke");
            },
            null);

    assertEquals(List.of(0, 1), seen);
    assertEquals(compiler.compile("One. Two.").tree(), result.tree());
  }

  @Test
  @DisplayName("an empty stream compiles the empty buffer")
  void emptyStream() {
    CompilationResult result = compiler.compileIncremental(List.of(), CompilerOptions.defaults());
    assertTrue(result.success());
    assertTrue(result.tree().children().isEmpty());
  }
}
