package com.gentoro.llmc.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.llmc.exception.SerializationException;
import com.gentoro.llmc.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Required-parameter schemas the semantic analyzer checks tool calls against.
 *
 * <p>The built-in catalog only covers common file and shell tools; the host application's real
 * tool catalog should be injected with {@link #builder()} or {@link #fromYaml(InputStream)}.
 * Tools absent from the registry are reported, not rejected.
 *
 * <p>YAML layout:
 *
 * <pre>
 * tools:
 *   read_file:
 *     parameters:
 *       path: { type: string, required: true, aliases: [file_path] }
 * </pre>
 */
public final class ToolSchemaRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(ToolSchemaRegistry.class);

  public static final String BUILT_IN_RESOURCE = "tool-schemas.yaml";

  private static volatile ToolSchemaRegistry builtIn;

  private final Map<String, ToolSchema> schemas;

  private ToolSchemaRegistry(Map<String, ToolSchema> schemas) {
    this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
  }

  public static ToolSchemaRegistry empty() {
    return new ToolSchemaRegistry(Map.of());
  }

  /** The catalog bundled as {@value #BUILT_IN_RESOURCE}. */
  public static ToolSchemaRegistry builtIn() {
    if (builtIn == null) {
      synchronized (ToolSchemaRegistry.class) {
        if (builtIn == null) {
          try (InputStream in =
              ToolSchemaRegistry.class.getClassLoader().getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (in == null) {
              throw new SerializationException("Missing resource " + BUILT_IN_RESOURCE);
            }
            builtIn = fromYaml(in);
          } catch (IOException e) {
            throw new SerializationException("Failed to read " + BUILT_IN_RESOURCE, e);
          }
        }
      }
    }
    return builtIn;
  }

  public static ToolSchemaRegistry fromYaml(InputStream in) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(in);
    } catch (IOException e) {
      throw new SerializationException("Failed to parse tool schema catalog", e);
    }
    Builder builder = builder();
    JsonNode tools = root == null ? null : root.path("tools");
    if (tools == null || !tools.isObject()) {
      return builder.build();
    }
    Iterator<Map.Entry<String, JsonNode>> it = tools.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> tool = it.next();
      List<ParameterSchema> parameters = new ArrayList<>();
      Iterator<Map.Entry<String, JsonNode>> params = tool.getValue().path("parameters").fields();
      while (params.hasNext()) {
        Map.Entry<String, JsonNode> p = params.next();
        List<String> aliases = new ArrayList<>();
        p.getValue().path("aliases").forEach(a -> aliases.add(a.asText()));
        parameters.add(
            new ParameterSchema(
                p.getKey(),
                ParameterType.fromName(p.getValue().path("type").asText(null)),
                p.getValue().path("required").asBoolean(false),
                aliases));
      }
      builder.tool(new ToolSchema(tool.getKey(), parameters));
    }
    ToolSchemaRegistry registry = builder.build();
    log.debug("Loaded {} tool schemas", registry.size());
    return registry;
  }

  public Optional<ToolSchema> find(String toolName) {
    return Optional.ofNullable(schemas.get(toolName));
  }

  public Collection<ToolSchema> schemas() {
    return schemas.values();
  }

  public int size() {
    return schemas.size();
  }

  /** A registry holding these schemas plus {@code other}'s; {@code other} wins on name clashes. */
  public ToolSchemaRegistry merge(ToolSchemaRegistry other) {
    Map<String, ToolSchema> merged = new LinkedHashMap<>(schemas);
    merged.putAll(other.schemas);
    return new ToolSchemaRegistry(merged);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    public Builder tool(ToolSchema schema) {
      schemas.put(schema.name(), schema);
      return this;
    }

    public ToolSchemaRegistry build() {
      return new ToolSchemaRegistry(schemas);
    }
  }
}
