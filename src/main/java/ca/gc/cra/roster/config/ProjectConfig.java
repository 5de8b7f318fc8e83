package ca.gc.cra.roster.config;

import static ca.gc.cra.roster.config.ConfigTrees.asMap;
import static ca.gc.cra.roster.config.ConfigTrees.asMapOrEmpty;
import static ca.gc.cra.roster.config.ConfigTrees.isScalar;
import static ca.gc.cra.roster.config.ConfigTrees.toStringList;

import ca.gc.cra.roster.domain.error.ConfigLoadException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable project descriptor: the untouched base tree, the active amendment (if any),
 * and the effective tree obtained by overlaying that amendment on the base.
 * <p><strong>Why:</strong> Keeping the base alongside the effective tree lets every activation start from the
 * original configuration, so overlays never stack.</p>
 * <p><strong>Role:</strong> Produced by {@link ProjectConfigLoader}; consumed by the roster builder.</p>
 * <p><strong>Thread-safety:</strong> Immutable; trees are deep-frozen at construction.</p>
 *
 * @since 0.1.0
 */
public final class ProjectConfig {
  static final String NAME = "name";
  static final String DESCRIPTION = "description";
  static final String DATA_SOURCES = "data_sources";
  static final String AMENDMENTS = "amendments";
  static final String SUBPROJECTS = "subprojects";
  static final String IMPORTS = "imports";
  private static final String METADATA_DIRECTORY = "metadata";

  private final Path configFile;
  private final Map<String, Object> base;
  private final String activeAmendment;
  private final Map<String, Object> effective;
  private final Map<String, Map<String, Object>> overlays;
  private final MetadataSettings metadata;
  private final Map<String, String> dataSources;
  private final SampleModifiers sampleModifiers;

  ProjectConfig(Path configFile, Map<String, Object> base, String activeAmendment, Map<String, Object> effective) {
    this.configFile = Objects.requireNonNull(configFile, "configFile");
    this.base = ConfigTrees.freeze(Objects.requireNonNull(base, "base"));
    this.activeAmendment = activeAmendment;
    this.effective = ConfigTrees.freeze(Objects.requireNonNull(effective, "effective"));
    this.overlays = collectOverlays(this.base);
    this.metadata = parseMetadata(this.effective);
    this.dataSources = parseDataSources(this.effective.get(DATA_SOURCES));
    this.sampleModifiers = SampleModifiers.parse(this.effective.get(SampleModifiers.SECTION), dataSources);
    validateName(this.effective.get(NAME));
  }

  /**
   * Builds a base configuration (no amendment active) from an already loaded tree.
   *
   * @param configFile descriptor the tree came from; its directory anchors relative paths
   * @param tree configuration tree with imports merged and metadata paths resolved
   * @return validated configuration
   * @throws ConfigLoadException when required sections are missing or malformed
   */
  public static ProjectConfig fromTree(Path configFile, Map<String, Object> tree) {
    return new ProjectConfig(configFile.toAbsolutePath().normalize(), tree, null, tree);
  }

  public Path configFile() {
    return configFile;
  }

  public Path configDirectory() {
    return configFile.getParent();
  }

  /**
   * Returns the effective tree (base plus active amendment).
   *
   * @return deep-frozen tree
   */
  public Map<String, Object> tree() {
    return effective;
  }

  public Map<String, Object> baseTree() {
    return base;
  }

  public Optional<String> activeAmendment() {
    return Optional.ofNullable(activeAmendment);
  }

  /**
   * Lists declared amendment names; {@code amendments} entries first, then {@code subprojects} entries that
   * do not clash.
   *
   * @return names in declaration order
   */
  public List<String> amendmentNames() {
    return List.copyOf(overlays.keySet());
  }

  Optional<Map<String, Object>> overlay(String name) {
    return Optional.ofNullable(overlays.get(name));
  }

  public MetadataSettings metadata() {
    return metadata;
  }

  public SampleModifiers sampleModifiers() {
    return sampleModifiers;
  }

  public Map<String, String> dataSources() {
    return dataSources;
  }

  /**
   * Returns the project scope for placeholder expansion: every top-level scalar of the effective tree.
   *
   * @return ordered, unmodifiable map
   */
  public Map<String, String> projectScope() {
    return Collections.unmodifiableMap(ConfigTrees.scalars(effective));
  }

  /**
   * Returns the project name: the {@code name} key, else the config directory name (or its parent's when the
   * directory is called {@code metadata}).
   *
   * @return project name
   */
  public String name() {
    Object declared = effective.get(NAME);
    if (declared != null) {
      return declared.toString();
    }
    Path dir = configDirectory();
    if (dir.getFileName() != null && METADATA_DIRECTORY.equals(dir.getFileName().toString())
        && dir.getParent() != null && dir.getParent().getFileName() != null) {
      dir = dir.getParent();
    }
    return dir.getFileName() == null ? dir.toString() : dir.getFileName().toString();
  }

  public Optional<String> description() {
    Object description = effective.get(DESCRIPTION);
    return description == null ? Optional.empty() : Optional.of(description.toString());
  }

  /**
   * Activates a named amendment on top of the base configuration.
   *
   * @param amendment declared amendment name
   * @return new configuration
   * @see AmendmentOverlay#activate(ProjectConfig, String)
   */
  public ProjectConfig activate(String amendment) {
    return AmendmentOverlay.activate(this, amendment);
  }

  public ProjectConfig deactivate() {
    return AmendmentOverlay.deactivate(this);
  }

  private static Map<String, Map<String, Object>> collectOverlays(Map<String, Object> tree) {
    Map<String, Map<String, Object>> overlays = new LinkedHashMap<>();
    asMapOrEmpty(tree.get(AMENDMENTS), AMENDMENTS).forEach((name, body) ->
        overlays.put(name, asMapOrEmpty(body, AMENDMENTS + "." + name)));
    asMapOrEmpty(tree.get(SUBPROJECTS), SUBPROJECTS).forEach((name, body) ->
        overlays.putIfAbsent(name, asMapOrEmpty(body, SUBPROJECTS + "." + name)));
    return Collections.unmodifiableMap(overlays);
  }

  private static MetadataSettings parseMetadata(Map<String, Object> tree) {
    Map<String, Object> section = asMap(tree.get(MetadataSettings.SECTION), MetadataSettings.SECTION);
    Object annotation = section.get(MetadataSettings.SAMPLE_ANNOTATION);
    if (!isScalar(annotation) || annotation.toString().isBlank()) {
      throw new ConfigLoadException(
          MetadataSettings.SECTION + "." + MetadataSettings.SAMPLE_ANNOTATION + " is required");
    }
    Object index = section.get(MetadataSettings.SAMPLE_TABLE_INDEX);
    return new MetadataSettings(
        Path.of(annotation.toString()),
        subannotationPaths(section.get(MetadataSettings.SAMPLE_SUBANNOTATION)),
        optionalPath(section.get(MetadataSettings.OUTPUT_DIR), MetadataSettings.OUTPUT_DIR),
        index == null ? "sample_name" : index.toString());
  }

  private static List<Path> subannotationPaths(Object node) {
    List<Path> paths = new ArrayList<>();
    for (String entry : toStringList(node, MetadataSettings.SECTION + "." + MetadataSettings.SAMPLE_SUBANNOTATION)) {
      if (!entry.isBlank()) {
        paths.add(Path.of(entry));
      }
    }
    return paths;
  }

  private static Path optionalPath(Object node, String key) {
    if (node == null) {
      return null;
    }
    if (!isScalar(node)) {
      throw new ConfigLoadException(MetadataSettings.SECTION + "." + key + " must be a path");
    }
    return node.toString().isBlank() ? null : Path.of(node.toString());
  }

  private static Map<String, String> parseDataSources(Object node) {
    Map<String, String> sources = new LinkedHashMap<>();
    asMapOrEmpty(node, DATA_SOURCES).forEach((key, template) -> {
      if (!isScalar(template)) {
        throw new ConfigLoadException(DATA_SOURCES + "." + key + " must be a path template");
      }
      sources.put(key, template.toString());
    });
    return Collections.unmodifiableMap(sources);
  }

  private static void validateName(Object name) {
    if (name == null) {
      return;
    }
    String value = name.toString();
    if (value.isBlank() || value.chars().anyMatch(Character::isWhitespace)) {
      throw new ConfigLoadException("Project name must not contain whitespace: '" + value + "'");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProjectConfig other)) {
      return false;
    }
    return configFile.equals(other.configFile)
        && base.equals(other.base)
        && Objects.equals(activeAmendment, other.activeAmendment)
        && effective.equals(other.effective);
  }

  @Override
  public int hashCode() {
    return Objects.hash(configFile, base, activeAmendment, effective);
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    parts.add("file=" + configFile);
    parts.add("name=" + name());
    activeAmendment().ifPresent(a -> parts.add("amendment=" + a));
    return "ProjectConfig" + parts;
  }
}
