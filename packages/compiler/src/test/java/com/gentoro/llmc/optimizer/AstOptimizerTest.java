package com.gentoro.llmc.optimizer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.CodeNode;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.FileReferenceType;
import com.gentoro.llmc.ast.ResponseMetadata;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.SourceSpan;
import com.gentoro.llmc.ast.TextFormat;
import com.gentoro.llmc.ast.TextNode;
import com.gentoro.llmc.ast.ToolCallNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AstOptimizerTest {

  private final AstOptimizer optimizer = new AstOptimizer();

  private static ResponseNode tree(AstNode... children) {
    ResponseNode root = new ResponseNode(ResponseMetadata.EMPTY, new SourceSpan(0, 100));
    for (AstNode child : children) {
      root.add(child);
    }
    return root;
  }

  private static TextNode text(String content, int start, int end) {
    return new TextNode(content, TextFormat.PLAIN, new SourceSpan(start, end));
  }

  private static FileReferenceNode ref(String path, boolean absolute) {
    return new FileReferenceNode(path, FileReferenceType.MENTION, null, absolute, new SourceSpan(0, 1));
  }

  @Test
  @DisplayName("the first of several identical tool calls is kept")
  void duplicateCalls() {
    ToolCallNode first = new ToolCallNode("read_file", Map.of("path", "a"), "call_1", new SourceSpan(0, 5));
    ToolCallNode other = new ToolCallNode("read_file", Map.of("path", "b"), "call_2", new SourceSpan(6, 9));
    ToolCallNode repeat = new ToolCallNode("read_file", Map.of("path", "a"), "call_3", new SourceSpan(10, 15));
    ResponseNode tree = tree(first, other, repeat);

    OptimizationReport report = optimizer.optimize(tree, OptimizationOptions.DEFAULT);
    assertEquals(1, report.removedDuplicateCalls());
    assertEquals(List.of(first, other), tree.children());
  }

  @Test
  @DisplayName("blank text is dropped and adjacent text merges with a covering span")
  void textCleanup() {
    CodeNode code = new CodeNode("sh", "ls", null, true, true, new SourceSpan(20, 30));
    ResponseNode tree =
        tree(text("A", 0, 1), text("  ", 2, 4), text("B", 5, 6), text("C", 7, 8), code, text("D", 31, 32));

    OptimizationReport report = optimizer.optimize(tree, null);
    assertEquals(1, report.droppedBlankText());
    assertEquals(2, report.mergedText());
    assertEquals(3, tree.children().size());
    TextNode merged = (TextNode) tree.children().get(0);
    assertEquals("A B C", merged.content());
    assertEquals(new SourceSpan(0, 8), merged.span());
    assertSame(code, tree.children().get(1));
  }

  @Test
  @DisplayName("bare relative paths gain ./ and backslashes become slashes")
  void pathNormalization() {
    ResponseNode tree =
        tree(ref("src\\main\\App.java", false), ref("./ok.txt", false), ref("/etc/hosts", true));
    OptimizationReport report = optimizer.optimize(tree, OptimizationOptions.DEFAULT);
    assertEquals(1, report.normalizedPaths());
    List<String> paths =
        tree.childrenOfType(FileReferenceNode.class).stream().map(FileReferenceNode::path).toList();
    assertEquals(List.of("./src/main/App.java", "./ok.txt", "/etc/hosts"), paths);
  }

  @Test
  @DisplayName("path normalization can be switched off")
  void normalizationOff() {
    ResponseNode tree = tree(ref("src/App.java", false));
    OptimizationReport report = optimizer.optimize(tree, new OptimizationOptions(false));
    assertFalse(report.changed());
    assertEquals("src/App.java", tree.childrenOfType(FileReferenceNode.class).get(0).path());
  }

  @Test
  @DisplayName("rooted, home, drive and URI paths keep their form")
  void rootedPaths() {
    assertEquals("C:/work/a.txt", AstOptimizer.normalizePath("C:\\work\\a.txt", true));
    assertEquals("../up.txt", AstOptimizer.normalizePath("..\\up.txt", false));
    assertEquals("~/notes.md", AstOptimizer.normalizePath("~/notes.md", false));
    assertEquals("file:///tmp/x", AstOptimizer.normalizePath("file:///tmp/x", false));
    assertEquals("./docs/a.md", AstOptimizer.normalizePath("docs/a.md", false));
  }

  @Test
  @DisplayName("a second run changes nothing")
  void idempotent() {
    ResponseNode tree = tree(text("A", 0, 1), text("B", 2, 3), ref("a/b.txt", false));
    optimizer.optimize(tree, null);
    List<AstNode> once = List.copyOf(tree.children());
    assertFalse(optimizer.optimize(tree, null).changed());
    assertEquals(once, tree.children());
  }
}
