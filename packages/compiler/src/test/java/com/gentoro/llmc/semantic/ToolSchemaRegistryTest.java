package com.gentoro.llmc.semantic;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.exception.ConfigException;
import com.gentoro.llmc.exception.SerializationException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolSchemaRegistryTest {

  private static InputStream yaml(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("the bundled catalog covers the common file and shell tools")
  void builtIn() {
    ToolSchemaRegistry registry = ToolSchemaRegistry.builtIn();
    assertEquals(6, registry.size());
    ToolSchema write = registry.find("write_file").orElseThrow();
    assertEquals(
        List.of("path", "content"),
        write.requiredParameters().stream().map(ParameterSchema::name).toList());
    assertEquals("path", write.parameterFor("file_path").orElseThrow().name());
    assertEquals(
        ParameterType.BOOLEAN,
        registry.find("list_directory").orElseThrow().parameterFor("recursive").orElseThrow().type());
    assertTrue(registry.find("deploy").isEmpty());
    assertSame(registry, ToolSchemaRegistry.builtIn());
  }

  @Test
  @DisplayName("a catalog is read from YAML")
  void fromYaml() {
    ToolSchemaRegistry registry =
        ToolSchemaRegistry.fromYaml(
            yaml(
                "tools:\n"
                    + "  deploy:\n"
                    + "    parameters:\n"
                    + "      service: { type: string, required: true, aliases: [name] }\n"
                    + "      replicas: { type: integer }\n"
                    + "      labels: {}\n"));
    ToolSchema deploy = registry.find("deploy").orElseThrow();
    assertEquals(3, deploy.parameters().size());
    assertTrue(deploy.parameterFor("name").orElseThrow().required());
    assertEquals(ParameterType.INTEGER, deploy.parameterFor("replicas").orElseThrow().type());
    assertEquals(ParameterType.ANY, deploy.parameterFor("labels").orElseThrow().type());
  }

  @Test
  @DisplayName("a document without tools gives an empty registry")
  void noTools() {
    assertEquals(0, ToolSchemaRegistry.fromYaml(yaml("other: 1\n")).size());
  }

  @Test
  @DisplayName("unknown parameter types and broken YAML are rejected")
  void badCatalogs() {
    assertThrows(
        ConfigException.class,
        () ->
            ToolSchemaRegistry.fromYaml(
                yaml("tools:\n  t:\n    parameters:\n      p: { type: decimal }\n")));
    assertThrows(SerializationException.class, () -> ToolSchemaRegistry.fromYaml(yaml("tools: [a")));
  }

  @Test
  @DisplayName("merging lets the other registry win on name clashes")
  void merge() {
    ToolSchemaRegistry custom =
        ToolSchemaRegistry.builder()
            .tool(ToolSchema.of("read_file", ParameterSchema.optional("path", ParameterType.STRING)))
            .tool(ToolSchema.of("deploy"))
            .build();
    ToolSchemaRegistry merged = ToolSchemaRegistry.builtIn().merge(custom);
    assertEquals(7, merged.size());
    assertTrue(merged.find("read_file").orElseThrow().requiredParameters().isEmpty());
    assertEquals(6, ToolSchemaRegistry.builtIn().size());
  }

  @Test
  @DisplayName("parameter types match JSON values")
  void parameterTypes() {
    assertTrue(ParameterType.INTEGER.matches(3));
    assertFalse(ParameterType.INTEGER.matches(3.5));
    assertTrue(ParameterType.NUMBER.matches(3.5));
    assertTrue(ParameterType.ARRAY.matches(List.of()));
    assertTrue(ParameterType.OBJECT.matches(Map.of()));
    assertFalse(ParameterType.STRING.matches(1));
    assertEquals(ParameterType.ANY, ParameterType.fromName(null));
    assertEquals(ParameterType.STRING, ParameterType.fromName(" String "));
    assertThrows(ConfigException.class, () -> ParameterType.fromName("decimal"));
  }
}
