package com.gentoro.llmc.ast;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.exception.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResponseNodeTest {

  private static final SourceSpan SPAN = new SourceSpan(0, 1);

  @Test
  @DisplayName("children view is read-only and typed lookups keep order")
  void childrenView() {
    ResponseNode root = new ResponseNode(ResponseMetadata.EMPTY, new SourceSpan(0, 10));
    TextNode text = new TextNode("hello", TextFormat.PLAIN, SPAN);
    ToolCallNode call = new ToolCallNode("read_file", Map.of("path", "a"), "call_1", SPAN);
    root.add(call);
    root.add(text);

    assertThrows(UnsupportedOperationException.class, () -> root.children().add(text));
    assertEquals(List.of(call), root.childrenOfType(ToolCallNode.class));
    assertEquals(3, root.totalNodeCount());
  }

  @Test
  @DisplayName("replace swaps the child with the same identity in place")
  void replaceByIdentity() {
    ResponseNode root = new ResponseNode(ResponseMetadata.EMPTY, new SourceSpan(0, 10));
    QuestionNode q = new QuestionNode("Proceed?", QuestionType.YES_NO, List.of(), SPAN);
    TextNode text = new TextNode("x", TextFormat.PLAIN, SPAN);
    root.add(q);
    root.add(text);

    QuestionNode normalized = q.withSuggestedOptions(List.of("Yes", "No"));
    assertTrue(root.replace(q, normalized));
    assertSame(normalized, root.children().get(0));
    assertFalse(root.replace(q, normalized));
  }

  @Test
  @DisplayName("responses cannot be nested and children cannot be null")
  void rejectsInvalidChildren() {
    ResponseNode root = new ResponseNode(ResponseMetadata.EMPTY, SPAN);
    assertThrows(ValidationException.class, () -> root.add(null));
    assertThrows(
        ValidationException.class, () -> root.add(new ResponseNode(ResponseMetadata.EMPTY, SPAN)));
  }

  @Test
  @DisplayName("tool call signature ignores argument order but not values")
  void signatureIsCanonical() {
    ToolCallNode a =
        new ToolCallNode("write_file", Map.of("path", "a", "content", "x"), "call_1", SPAN);
    ToolCallNode b =
        new ToolCallNode(
            "write_file",
            new java.util.LinkedHashMap<>(Map.of("content", "x", "path", "a")),
            "call_2",
            new SourceSpan(5, 9));
    ToolCallNode c =
        new ToolCallNode("write_file", Map.of("path", "a", "content", "y"), "call_3", SPAN);

    assertEquals(a.signature(), b.signature());
    assertNotEquals(a.signature(), c.signature());
  }

  @Test
  @DisplayName("a tool call needs a tool name")
  void toolCallNeedsName() {
    assertThrows(ValidationException.class, () -> new ToolCallNode(" ", Map.of(), "id", SPAN));
  }

  @Test
  @DisplayName("diagnostics carry an optional position")
  void diagnosticPosition() {
    Diagnostic d = Diagnostic.warning(CompilationPhase.SEMANTIC, "careful", null);
    assertFalse(d.hasPosition());
    Diagnostic positioned = d.withPosition(3, 7);
    assertTrue(positioned.hasPosition());
    assertEquals(3, positioned.line());
    assertEquals("[SEMANTIC/WARNING] (3:7) careful", positioned.toString());
  }
}
