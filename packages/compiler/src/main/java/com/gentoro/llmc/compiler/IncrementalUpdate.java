package com.gentoro.llmc.compiler;

import com.gentoro.llmc.ast.Diagnostic;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.lexer.Token;
import java.util.List;

/**
 * Emitted after each chunk of an incremental compilation.
 *
 * @param chunkIndex 0-based index among the non-null chunks consumed so far
 * @param newTokens tokens beyond the previous update's token count
 * @param newDiagnostics diagnostics beyond the previous update's diagnostic count
 * @param tree the tree compiled from the whole buffer
 */
public record IncrementalUpdate(
    int chunkIndex,
    int bufferLength,
    List<Token> newTokens,
    List<Diagnostic> newDiagnostics,
    ResponseNode tree,
    boolean success) {

  public IncrementalUpdate {
    newTokens = List.copyOf(newTokens);
    newDiagnostics = List.copyOf(newDiagnostics);
  }
}
