package com.gentoro.llmc;

import com.gentoro.llmc.exception.ConfigException;
import com.gentoro.llmc.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: {@code classpath:some/path.yaml} (loaded from the application
 * classpath), a {@code file:} URI, or an absolute or relative filesystem path. A blank location
 * means {@code classpath:application.yaml}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.llmc.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider() {
    this(DEFAULT_LOCATION);
  }

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /**
   * Open a resource named by the same location syntax as configuration files. Used for catalogs
   * referenced from the configuration (for example the tool schema catalog).
   */
  public static InputStream openLocation(String location) {
    String loc = location == null ? "" : location.trim();
    try {
      if (loc.startsWith("classpath:")) {
        String resource = loc.substring("classpath:".length());
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
          throw new ConfigException("Resource not found: %s".formatted(resource));
        }
        return in;
      }
      return Files.newInputStream(toFile(loc).toPath());
    } catch (IOException e) {
      throw new ConfigException("Failed to open location: " + loc, e);
    }
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl.getResource(resourceName) == null) {
      log.debug("Classpath resource {} not found, using empty configuration", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = cl.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new ConfigException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file);
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromLocation(DEFAULT_LOCATION);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    return loadYamlFromFile(toFile(loc));
  }

  private static File toFile(String loc) {
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      return new File(URI.create(loc));
    }
    return new File(loc);
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  /** Resolves {@code ${env:NAME}} from the process environment, then from {@code .env.local}. */
  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = findEnvFile();
            fallback = path == null ? new HashMap<>() : readKeyValueFile(path);
          }
        }
      }
      return fallback.get(key);
    }

    private Path findEnvFile() {
      for (Path candidate :
          new Path[] {Paths.get(".env.local"), Paths.get("packages/compiler/.env.local")}) {
        if (Files.exists(candidate)) {
          return candidate;
        }
      }
      log.debug("No .env.local found, skipping environment fallback");
      return null;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        throw new ConfigException("Failed to read " + path, e);
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
