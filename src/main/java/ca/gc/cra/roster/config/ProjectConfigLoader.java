package ca.gc.cra.roster.config;

import static ca.gc.cra.roster.config.ConfigTrees.asMap;
import static ca.gc.cra.roster.config.ConfigTrees.isScalar;
import static ca.gc.cra.roster.config.ConfigTrees.toStringList;

import ca.gc.cra.roster.application.port.EnvironmentPort;
import ca.gc.cra.roster.application.substitution.ExpansionScope;
import ca.gc.cra.roster.application.substitution.VariableExpander;
import ca.gc.cra.roster.domain.error.ConfigLoadException;
import ca.gc.cra.roster.domain.error.UnresolvedVariableException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads a project descriptor from YAML, resolving {@code imports} and metadata paths.
 * <p><strong>Why:</strong> Produces the single base tree every roster resolution and amendment activation
 * starts from.</p>
 * <p><strong>Role:</strong> Configuration adapter between the filesystem and {@link ProjectConfig}.</p>
 * <p><strong>Thread-safety:</strong> Stateless per call; safe to share.</p>
 *
 * <p>Imports are loaded recursively in declaration order and shallow-merged beneath the importing file, so
 * the importing file wins and later imports win over earlier ones. Relative metadata paths resolve against
 * the directory of the file declaring them; templated paths are expanded against project and environment
 * scope and then resolved against the main descriptor's directory.</p>
 *
 * @since 0.1.0
 */
public final class ProjectConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ProjectConfigLoader.class);
  private static final List<String> PATH_KEYS = List.of(
      MetadataSettings.SAMPLE_ANNOTATION, MetadataSettings.SAMPLE_SUBANNOTATION, MetadataSettings.OUTPUT_DIR);

  private final EnvironmentPort environment;

  /**
   * Creates a loader.
   *
   * @param environment environment scope for templated metadata paths
   */
  public ProjectConfigLoader(EnvironmentPort environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  /**
   * Loads and validates a project descriptor.
   *
   * @param path descriptor location
   * @return base configuration with no amendment active
   * @throws ConfigLoadException when the file is missing or unreadable, the YAML is malformed, an import
   *     cycle exists, or required sections are missing or malformed
   */
  public ProjectConfig load(Path path) {
    Objects.requireNonNull(path, "path");
    Path file = path.toAbsolutePath().normalize();
    Map<String, Object> tree = loadTree(file, new ArrayDeque<>());
    expandTemplatedPaths(tree, file.getParent(), environment.snapshot());
    ProjectConfig config = ProjectConfig.fromTree(file, tree);
    log.info("Loaded project '{}' from {} (amendments={})", config.name(), file, config.amendmentNames());
    return config;
  }

  private Map<String, Object> loadTree(Path file, Deque<Path> stack) {
    Path real = realPath(file);
    if (stack.contains(real)) {
      List<String> chain = new ArrayList<>();
      stack.descendingIterator().forEachRemaining(p -> chain.add(p.toString()));
      chain.add(real.toString());
      throw new ConfigLoadException("Import cycle detected: " + String.join(" -> ", chain));
    }
    stack.push(real);
    try {
      Map<String, Object> own = parse(real);
      Path dir = real.getParent();
      resolveMetadataPaths(own, dir);
      overlayBodies(own).forEach(body -> resolveMetadataPaths(body, dir));

      Map<String, Object> merged = new LinkedHashMap<>();
      for (String entry : toStringList(own.get(ProjectConfig.IMPORTS), ProjectConfig.IMPORTS)) {
        if (entry.isBlank()) {
          continue;
        }
        Path imported = dir.resolve(entry).normalize();
        log.debug("Importing {} into {}", imported, real);
        merged = ConfigTrees.shallowMerge(merged, loadTree(imported, stack));
      }
      return ConfigTrees.shallowMerge(merged, own);
    } finally {
      stack.pop();
    }
  }

  private static Path realPath(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigLoadException("Project config file not found: " + file);
    }
    try {
      return file.toRealPath();
    } catch (IOException ex) {
      throw new ConfigLoadException("Unable to resolve project config path " + file, ex);
    }
  }

  private static Map<String, Object> parse(Path file) {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return new LinkedHashMap<>();
      }
      return asMap(document, "Root of " + file);
    } catch (YAMLException ex) {
      throw new ConfigLoadException("Failed to parse YAML config at " + file, ex);
    } catch (IOException ex) {
      throw new ConfigLoadException("Unable to read project config " + file, ex);
    }
  }

  private static List<Map<String, Object>> overlayBodies(Map<String, Object> tree) {
    List<Map<String, Object>> bodies = new ArrayList<>();
    for (String key : List.of(ProjectConfig.AMENDMENTS, ProjectConfig.SUBPROJECTS)) {
      Object section = tree.get(key);
      if (section == null) {
        continue;
      }
      Map<String, Object> overlays = asMap(section, key);
      overlays.forEach((name, body) -> {
        if (body != null) {
          Map<String, Object> copy = asMap(body, key + "." + name);
          overlays.put(name, copy);
          bodies.add(copy);
        }
      });
      tree.put(key, overlays);
    }
    return bodies;
  }

  /**
   * Rewrites relative, non-templated metadata paths of {@code tree} to absolute paths under {@code dir}.
   */
  private static void resolveMetadataPaths(Map<String, Object> tree, Path dir) {
    Object section = tree.get(MetadataSettings.SECTION);
    if (section == null) {
      return;
    }
    Map<String, Object> metadata = asMap(section, MetadataSettings.SECTION);
    for (String key : PATH_KEYS) {
      rewritePaths(metadata, key, value -> VariableExpander.hasPlaceholders(value)
          ? value
          : dir.resolve(value).normalize().toString());
    }
    tree.put(MetadataSettings.SECTION, metadata);
  }

  /**
   * Applies {@code rewrite} to the non-blank scalar value of {@code key}, or to each non-blank scalar
   * element when the value is a list. Other shapes are left for {@link ProjectConfig} to reject.
   */
  private static void rewritePaths(Map<String, Object> metadata, String key, UnaryOperator<String> rewrite) {
    Object value = metadata.get(key);
    if (isScalar(value)) {
      String path = value.toString();
      metadata.put(key, path.isBlank() ? path : rewrite.apply(path));
    } else if (value instanceof List<?> entries) {
      List<Object> rewritten = new ArrayList<>(entries.size());
      for (Object entry : entries) {
        rewritten.add(isScalar(entry) && !entry.toString().isBlank() ? rewrite.apply(entry.toString()) : entry);
      }
      metadata.put(key, rewritten);
    }
  }

  private static void expandTemplatedPaths(Map<String, Object> tree, Path configDir, Map<String, String> env) {
    Map<String, String> baseScope = ConfigTrees.scalars(tree);
    expandMetadata(tree, configDir, ExpansionScope.projectOnly(baseScope, env));
    for (Map<String, Object> body : overlayBodies(tree)) {
      Map<String, String> scope = new LinkedHashMap<>(baseScope);
      scope.putAll(ConfigTrees.scalars(body));
      expandMetadata(body, configDir, ExpansionScope.projectOnly(scope, env));
    }
  }

  private static void expandMetadata(Map<String, Object> tree, Path configDir, ExpansionScope scope) {
    Object section = tree.get(MetadataSettings.SECTION);
    if (section == null) {
      return;
    }
    Map<String, Object> metadata = asMap(section, MetadataSettings.SECTION);
    for (String key : PATH_KEYS) {
      rewritePaths(metadata, key, value -> {
        if (!VariableExpander.hasPlaceholders(value)) {
          return value;
        }
        try {
          return configDir.resolve(VariableExpander.substitute(value, scope)).normalize().toString();
        } catch (UnresolvedVariableException ex) {
          throw new ConfigLoadException(MetadataSettings.SECTION + "." + key
              + " references undefined variable '" + ex.variable() + "'", ex);
        }
      });
    }
    tree.put(MetadataSettings.SECTION, metadata);
  }
}
