package com.gentoro.llmc.optimizer;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.ResponseNode;
import com.gentoro.llmc.ast.TextNode;
import com.gentoro.llmc.ast.ToolCallNode;
import com.gentoro.llmc.ast.ToolCallSignature;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic clean-up of a response tree.
 *
 * <p>The optimizer mutates the tree it is given and returns a report. It runs after analysis and
 * before rendering, while the compiler still owns the tree exclusively.
 */
public class AstOptimizer {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(AstOptimizer.class);

  private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:/");
  private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

  public OptimizationReport optimize(ResponseNode tree, OptimizationOptions options) {
    OptimizationOptions opts = options == null ? OptimizationOptions.DEFAULT : options;
    List<AstNode> nodes = new ArrayList<>(tree.children());

    int duplicates = removeDuplicateCalls(nodes);
    int blank = nodes.size();
    nodes.removeIf(n -> n instanceof TextNode t && t.isBlank());
    blank -= nodes.size();
    int merged = mergeAdjacentText(nodes);
    int normalized = opts.normalizeFilePaths() ? normalizePaths(nodes) : 0;

    tree.setChildren(nodes);
    OptimizationReport report = new OptimizationReport(duplicates, blank, merged, normalized);
    if (report.changed()) {
      log.debug("Optimized tree: {}", report);
    }
    return report;
  }

  /** First occurrence of each signature wins. */
  private static int removeDuplicateCalls(List<AstNode> nodes) {
    Set<ToolCallSignature> seen = new HashSet<>();
    int before = nodes.size();
    nodes.removeIf(n -> n instanceof ToolCallNode call && !seen.add(call.signature()));
    return before - nodes.size();
  }

  private static int mergeAdjacentText(List<AstNode> nodes) {
    int merged = 0;
    for (int i = nodes.size() - 1; i > 0; i--) {
      if (nodes.get(i) instanceof TextNode right && nodes.get(i - 1) instanceof TextNode left) {
        nodes.set(
            i - 1,
            new TextNode(
                left.content() + " " + right.content(),
                left.format(),
                left.span().cover(right.span())));
        nodes.remove(i);
        merged++;
      }
    }
    return merged;
  }

  private static int normalizePaths(List<AstNode> nodes) {
    int changed = 0;
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i) instanceof FileReferenceNode ref) {
        String normalized = normalizePath(ref.path(), ref.absolute());
        if (!normalized.equals(ref.path())) {
          nodes.set(i, ref.withPath(normalized));
          changed++;
        }
      }
    }
    return changed;
  }

  static String normalizePath(String path, boolean absolute) {
    String p = path.replace('\\', '/');
    if (absolute
        || p.isEmpty()
        || p.startsWith("/")
        || p.startsWith("./")
        || p.startsWith("../")
        || p.startsWith("~")
        || WINDOWS_DRIVE.matcher(p).find()
        || URI_SCHEME.matcher(p).find()) {
      return p;
    }
    return "./" + p;
  }
}
