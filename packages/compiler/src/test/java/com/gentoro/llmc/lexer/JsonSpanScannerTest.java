package com.gentoro.llmc.lexer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonSpanScannerTest {

  @Test
  @DisplayName("brackets inside strings and escaped quotes do not end a span")
  void stringAware() {
    String text = "{\"a\":\"}\\\"{\",\"b\":[1,{\"c\":2}]} tail";
    assertEquals(text.indexOf(" tail"), JsonSpanScanner.findClosing(text, 0));
  }

  @Test
  @DisplayName("mismatched or missing closers yield -1")
  void unbalanced() {
    assertEquals(-1, JsonSpanScanner.findClosing("{\"a\":[1}", 0));
    assertEquals(-1, JsonSpanScanner.findClosing("{\"a\":1", 0));
    assertEquals(-1, JsonSpanScanner.findClosing("abc", 0));
  }

  @Test
  @DisplayName("findObjects returns top-level objects left to right")
  void findObjects() {
    String text = "x {\"a\":{\"b\":1}} y {\"c\":2} {broken";
    List<int[]> spans = JsonSpanScanner.findObjects(text);
    assertEquals(2, spans.size());
    assertEquals("{\"a\":{\"b\":1}}", text.substring(spans.get(0)[0], spans.get(0)[1]));
    assertEquals("{\"c\":2}", text.substring(spans.get(1)[0], spans.get(1)[1]));
  }
}
