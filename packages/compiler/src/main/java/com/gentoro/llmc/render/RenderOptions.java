package com.gentoro.llmc.render;

import com.gentoro.llmc.ast.NodeKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Per-kind visibility and formatting switches for {@link AstRenderer}. Immutable; use {@link
 * #builder()} or {@link #fromConfiguration(Configuration)}.
 */
public final class RenderOptions {
  private static final Map<NodeKind, Visibility> DEFAULT_VISIBILITY = new EnumMap<>(NodeKind.class);

  static {
    DEFAULT_VISIBILITY.put(NodeKind.TEXT, Visibility.FULL);
    DEFAULT_VISIBILITY.put(NodeKind.CODE, Visibility.FULL);
    DEFAULT_VISIBILITY.put(NodeKind.ERROR, Visibility.FULL);
    DEFAULT_VISIBILITY.put(NodeKind.COMMAND, Visibility.FULL);
    DEFAULT_VISIBILITY.put(NodeKind.QUESTION, Visibility.SUMMARY);
    // Consumed structurally or already visible through the text node.
    DEFAULT_VISIBILITY.put(NodeKind.TOOL_CALL, Visibility.HIDDEN);
    DEFAULT_VISIBILITY.put(NodeKind.TOOL_RESULT, Visibility.HIDDEN);
    DEFAULT_VISIBILITY.put(NodeKind.THOUGHT, Visibility.HIDDEN);
    DEFAULT_VISIBILITY.put(NodeKind.FILE_REFERENCE, Visibility.HIDDEN);
    DEFAULT_VISIBILITY.put(NodeKind.MARKDOWN, Visibility.HIDDEN);
  }

  private final Map<NodeKind, Visibility> visibility;
  private final boolean useEmoji;
  private final boolean useCodeBlockMarkers;
  private final boolean formatJson;
  private final String nodeSeparator;

  private RenderOptions(Builder b) {
    this.visibility = Collections.unmodifiableMap(new EnumMap<>(b.visibility));
    this.useEmoji = b.useEmoji;
    this.useCodeBlockMarkers = b.useCodeBlockMarkers;
    this.formatJson = b.formatJson;
    this.nodeSeparator = b.nodeSeparator == null ? "\n" : b.nodeSeparator;
  }

  public static RenderOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the {@code renderer.*} keys. Visibility keys use the camel-case node kind, e.g. {@code
   * renderer.visibility.toolCall: summary}.
   */
  public static RenderOptions fromConfiguration(Configuration config) {
    Builder b = builder();
    for (NodeKind kind : NodeKind.values()) {
      String value = config.getString("renderer.visibility." + configKey(kind), null);
      if (value != null) {
        b.visibility(kind, Visibility.fromName(value));
      }
    }
    return b.useEmoji(config.getBoolean("renderer.useEmoji", false))
        .useCodeBlockMarkers(config.getBoolean("renderer.useCodeBlockMarkers", true))
        .formatJson(config.getBoolean("renderer.formatJson", true))
        .nodeSeparator(config.getString("renderer.nodeSeparator", "\n"))
        .build();
  }

  static String configKey(NodeKind kind) {
    StringBuilder sb = new StringBuilder();
    boolean upper = false;
    for (char c : kind.name().toLowerCase(java.util.Locale.ROOT).toCharArray()) {
      if (c == '_') {
        upper = true;
      } else {
        sb.append(upper ? Character.toUpperCase(c) : c);
        upper = false;
      }
    }
    return sb.toString();
  }

  public Visibility visibility(NodeKind kind) {
    return visibility.getOrDefault(kind, Visibility.FULL);
  }

  public boolean useEmoji() {
    return useEmoji;
  }

  public boolean useCodeBlockMarkers() {
    return useCodeBlockMarkers;
  }

  public boolean formatJson() {
    return formatJson;
  }

  public String nodeSeparator() {
    return nodeSeparator;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.visibility.putAll(visibility);
    return b.useEmoji(useEmoji)
        .useCodeBlockMarkers(useCodeBlockMarkers)
        .formatJson(formatJson)
        .nodeSeparator(nodeSeparator);
  }

  public static final class Builder {
    private final Map<NodeKind, Visibility> visibility = new EnumMap<>(DEFAULT_VISIBILITY);
    private boolean useEmoji = false;
    private boolean useCodeBlockMarkers = true;
    private boolean formatJson = true;
    private String nodeSeparator = "\n";

    public Builder visibility(NodeKind kind, Visibility value) {
      visibility.put(kind, value);
      return this;
    }

    public Builder useEmoji(boolean useEmoji) {
      this.useEmoji = useEmoji;
      return this;
    }

    public Builder useCodeBlockMarkers(boolean useCodeBlockMarkers) {
      this.useCodeBlockMarkers = useCodeBlockMarkers;
      return this;
    }

    public Builder formatJson(boolean formatJson) {
      this.formatJson = formatJson;
      return this;
    }

    public Builder nodeSeparator(String nodeSeparator) {
      this.nodeSeparator = nodeSeparator;
      return this;
    }

    public RenderOptions build() {
      return new RenderOptions(this);
    }
  }
}
