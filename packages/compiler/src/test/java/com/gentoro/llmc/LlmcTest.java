package com.gentoro.llmc;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.NodeKind;
import com.gentoro.llmc.exception.ConfigException;
import com.gentoro.llmc.parser.GenericResponseParser;
import com.gentoro.llmc.parser.QwenResponseParser;
import com.gentoro.llmc.render.RenderResult;
import com.gentoro.llmc.render.ToolInvocation;
import com.gentoro.llmc.render.Visibility;
import com.gentoro.llmc.semantic.ToolSchemaRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LlmcTest {

  @Test
  @DisplayName("the bundled configuration wires the plain-text dialect and built-in schemas")
  void defaults() {
    Llmc llmc = new Llmc();
    assertEquals("generic", llmc.compilerOptions().modelProvider());
    assertInstanceOf(GenericResponseParser.class, llmc.compiler().parser());
    assertSame(ToolSchemaRegistry.builtIn(), llmc.toolSchemas());
    assertEquals(Visibility.HIDDEN, llmc.renderOptions().visibility(NodeKind.TOOL_CALL));
    assertEquals("generic", llmc.configuration().getString("compiler.modelProvider"));
  }

  @Test
  @DisplayName("a custom configuration selects dialect, options, renderer and tool catalog")
  void customConfiguration() {
    Llmc llmc = new Llmc("classpath:llmc-test.yaml");
    assertTrue(llmc.compilerOptions().strictMode());
    assertTrue(llmc.compilerOptions().preserveThoughts());
    assertInstanceOf(QwenResponseParser.class, llmc.compiler().parser());
    assertEquals(1, llmc.toolSchemas().size());
    assertTrue(llmc.toolSchemas().find("deploy").isPresent());
    assertTrue(llmc.renderOptions().useEmoji());
    assertEquals(Visibility.SUMMARY, llmc.renderOptions().visibility(NodeKind.TOOL_CALL));
    assertSame(llmc.renderOptions(), llmc.renderer().options());
  }

  @Test
  @DisplayName("process compiles with the configured options and renders the tree")
  void process() {
    Llmc llmc = new Llmc("classpath:llmc-test.yaml");
    Llmc.Output output =
        llmc.process(
            "<tool_call>{\"name\":\"deploy\",\"arguments\":{\"service\":\"api\"}}</tool_call>\n"
                + "Deployment started.");

    assertTrue(output.compilation().success(), () -> output.compilation().diagnostics().toString());
    RenderResult rendered = output.rendered();
    assertEquals("[Calling deploy]\nDeployment started.", rendered.text());
    assertEquals(
        List.of(new ToolInvocation("deploy", Map.of("service", "api"), "call_1")),
        rendered.toolInvocations());
  }

  @Test
  @DisplayName("strict schemas from the catalog reject incomplete calls")
  void catalogIsEnforced() {
    Llmc llmc = new Llmc("classpath:llmc-test.yaml");
    Llmc.Output output =
        llmc.process("<tool_call>{\"name\":\"deploy\",\"arguments\":{\"replicas\":\"two\"}}</tool_call>");
    assertFalse(output.compilation().success());
    assertEquals(2, output.compilation().errors().size());
  }

  @Test
  @DisplayName("bad configuration values fail fast")
  void badConfiguration() {
    assertThrows(ConfigException.class, () -> new Llmc("classpath:bad-visibility.yaml"));
    assertThrows(ConfigException.class, () -> Llmc.loadToolSchemas("classpath:missing-catalog.yaml"));
    assertSame(ToolSchemaRegistry.builtIn(), Llmc.loadToolSchemas(null));
  }
}
