package com.gentoro.llmc;

import com.gentoro.llmc.compiler.CompilationResult;
import com.gentoro.llmc.compiler.CompilerOptions;
import com.gentoro.llmc.compiler.ResponseCompiler;
import com.gentoro.llmc.exception.ConfigException;
import com.gentoro.llmc.json.LenientJsonRepair;
import com.gentoro.llmc.render.AstRenderer;
import com.gentoro.llmc.render.RenderOptions;
import com.gentoro.llmc.render.RenderResult;
import com.gentoro.llmc.semantic.ToolSchemaRegistry;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, applies log levels and wires a compiler and a
 * renderer from it.
 *
 * <p>Like {@link ResponseCompiler}, an instance is meant for one conversation at a time.
 */
public class Llmc {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(Llmc.class);

  static final String DEFAULT_TOOL_CATALOG = "classpath:" + ToolSchemaRegistry.BUILT_IN_RESOURCE;

  private final ConfigurationProvider configurationProvider;
  private final CompilerOptions compilerOptions;
  private final RenderOptions renderOptions;
  private final ToolSchemaRegistry toolSchemas;
  private final ResponseCompiler compiler;
  private final AstRenderer renderer;

  public Llmc() {
    this(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public Llmc(String configLocation) {
    this(new ConfigurationProvider(configLocation));
  }

  public Llmc(ConfigurationProvider configurationProvider) {
    this.configurationProvider = configurationProvider;
    Configuration config = configurationProvider.config();
    com.gentoro.llmc.logging.LoggingService.applyConfiguration(config);

    this.compilerOptions = CompilerOptions.fromConfiguration(config);
    this.renderOptions = RenderOptions.fromConfiguration(config);
    this.toolSchemas = loadToolSchemas(config.getString("tools.catalog", DEFAULT_TOOL_CATALOG));
    this.compiler =
        new ResponseCompiler(
            compilerOptions.modelProvider(),
            compilerOptions.modelName(),
            new LenientJsonRepair(),
            toolSchemas);
    this.renderer = new AstRenderer(renderOptions);
    log.info(
        "Response compiler ready: provider '{}', parser {}, {} tool schemas",
        compilerOptions.modelProvider(),
        compiler.parser().capabilities().dialect(),
        toolSchemas.size());
  }

  static ToolSchemaRegistry loadToolSchemas(String location) {
    if (location == null || location.isBlank() || DEFAULT_TOOL_CATALOG.equals(location.trim())) {
      return ToolSchemaRegistry.builtIn();
    }
    log.info("Loading tool schema catalog from {}", location);
    try (InputStream in = ConfigurationProvider.openLocation(location)) {
      return ToolSchemaRegistry.fromYaml(in);
    } catch (IOException e) {
      throw new ConfigException("Failed to read tool schema catalog: " + location, e);
    }
  }

  /** Compiles with the configured options and renders the resulting tree. */
  public Output process(String responseText) {
    CompilationResult result = compiler.compile(responseText, compilerOptions);
    return new Output(result, renderer.render(result.tree()));
  }

  public record Output(CompilationResult compilation, RenderResult rendered) {}

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public CompilerOptions compilerOptions() {
    return compilerOptions;
  }

  public RenderOptions renderOptions() {
    return renderOptions;
  }

  public ToolSchemaRegistry toolSchemas() {
    return toolSchemas;
  }

  public ResponseCompiler compiler() {
    return compiler;
  }

  public AstRenderer renderer() {
    return renderer;
  }
}
