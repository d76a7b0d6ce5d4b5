package com.gentoro.llmc.semantic;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CodeHeuristicsTest {

  @Test
  @DisplayName("brackets in literals do not count")
  void literalsAreSkipped() {
    assertTrue(CodeHeuristics.isBalanced("String open = \"{\";"));
    assertTrue(CodeHeuristics.isBalanced("char c = '(';"));
    assertTrue(CodeHeuristics.isBalanced("const s = `[${x}`;"));
    assertTrue(CodeHeuristics.isBalanced("s = \"a\\\"(\""));
  }

  @Test
  @DisplayName("mismatched or unclosed brackets are unbalanced")
  void unbalanced() {
    assertFalse(CodeHeuristics.isBalanced("f(a]"));
    assertFalse(CodeHeuristics.isBalanced("class A {"));
    assertFalse(CodeHeuristics.isBalanced("}"));
    assertTrue(CodeHeuristics.isBalanced("a[0] = f({x: (1)});"));
  }

  @Test
  @DisplayName("an apostrophe in a comment does not hide the next lines")
  void apostropheInComment() {
    assertFalse(CodeHeuristics.isBalanced("# don't do this\nif (x {"));
  }

  @Test
  @DisplayName("trailing ellipses and TODO markers mean incomplete code")
  void incompleteMarkers() {
    assertTrue(CodeHeuristics.hasIncompleteMarker("def f():\n    ...\n"));
    assertTrue(CodeHeuristics.hasIncompleteMarker("int x = 1;\n// TODO finish\n"));
    assertTrue(CodeHeuristics.hasIncompleteMarker("x = 1 …"));
    assertFalse(CodeHeuristics.hasIncompleteMarker("return total;"));
  }
}
