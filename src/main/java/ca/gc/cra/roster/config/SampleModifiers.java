package ca.gc.cra.roster.config;

import static ca.gc.cra.roster.config.ConfigTrees.asMap;
import static ca.gc.cra.roster.config.ConfigTrees.asMapOrEmpty;
import static ca.gc.cra.roster.config.ConfigTrees.isScalar;
import static ca.gc.cra.roster.config.ConfigTrees.toStringList;

import ca.gc.cra.roster.domain.error.ConfigLoadException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed {@code sample_modifiers} section.
 *
 * @param append attribute to value tokens added to samples lacking the attribute
 * @param duplicate source attribute to target attribute
 * @param derive attributes derived from data sources, in declaration order
 * @param imply implication rules, in declaration order
 * @param remove attributes deleted after every other stage
 *
 * @since 0.1.0
 */
public record SampleModifiers(
    Map<String, List<String>> append,
    Map<String, String> duplicate,
    List<DerivedAttributeSpec> derive,
    List<ImpliedAttributeSpec> imply,
    List<String> remove) {
  private static final Logger log = LoggerFactory.getLogger(SampleModifiers.class);

  static final String SECTION = "sample_modifiers";
  static final String APPEND = "append";
  static final String DUPLICATE = "duplicate";
  static final String DERIVE = "derive";
  static final String IMPLY = "imply";
  static final String REMOVE = "remove";
  private static final Set<String> KNOWN = Set.of(APPEND, DUPLICATE, DERIVE, IMPLY, REMOVE);

  public SampleModifiers {
    append = Collections.unmodifiableMap(new LinkedHashMap<>(append));
    duplicate = Collections.unmodifiableMap(new LinkedHashMap<>(duplicate));
    derive = List.copyOf(derive);
    imply = List.copyOf(imply);
    remove = List.copyOf(remove);
  }

  /**
   * Returns modifiers that leave every sample untouched.
   *
   * @return empty modifiers
   */
  public static SampleModifiers none() {
    return new SampleModifiers(Map.of(), Map.of(), List.of(), List.of(), List.of());
  }

  public boolean isEmpty() {
    return append.isEmpty() && duplicate.isEmpty() && derive.isEmpty() && imply.isEmpty() && remove.isEmpty();
  }

  /**
   * Parses the section.
   *
   * @param node raw {@code sample_modifiers} node; {@code null} yields {@link #none()}
   * @param dataSources declared {@code data_sources}
   * @return parsed modifiers
   * @throws ConfigLoadException when a subsection has the wrong shape
   */
  static SampleModifiers parse(Object node, Map<String, String> dataSources) {
    if (node == null) {
      return none();
    }
    Map<String, Object> section = asMap(node, SECTION);
    for (String key : section.keySet()) {
      if (!KNOWN.contains(key)) {
        log.warn("Config '{}' section contains unrecognized subsection '{}'; ignoring", SECTION, key);
      }
    }
    return new SampleModifiers(
        parseAppend(section.get(APPEND)),
        parseDuplicate(section.get(DUPLICATE)),
        parseDerive(section.get(DERIVE), dataSources),
        parseImply(section.get(IMPLY)),
        toStringList(section.get(REMOVE), SECTION + "." + REMOVE));
  }

  private static Map<String, List<String>> parseAppend(Object node) {
    Map<String, List<String>> append = new LinkedHashMap<>();
    asMapOrEmpty(node, SECTION + "." + APPEND).forEach((attribute, value) ->
        append.put(attribute, toStringList(value, SECTION + "." + APPEND + "." + attribute)));
    return append;
  }

  private static Map<String, String> parseDuplicate(Object node) {
    Map<String, String> duplicate = new LinkedHashMap<>();
    asMapOrEmpty(node, SECTION + "." + DUPLICATE).forEach((source, target) -> {
      if (!isScalar(target)) {
        throw new ConfigLoadException(
            SECTION + "." + DUPLICATE + "." + source + " must name a single target attribute");
      }
      duplicate.put(source, target.toString());
    });
    return duplicate;
  }

  private static List<DerivedAttributeSpec> parseDerive(Object node, Map<String, String> dataSources) {
    if (node == null) {
      return List.of();
    }
    Object attributesNode = node;
    Map<String, String> sources = new LinkedHashMap<>(dataSources);
    if (node instanceof Map<?, ?>) {
      Map<String, Object> section = asMap(node, SECTION + "." + DERIVE);
      attributesNode = section.get("attributes");
      asMapOrEmpty(section.get("sources"), SECTION + "." + DERIVE + ".sources")
          .forEach((key, template) -> sources.put(key, ConfigTrees.toString(template)));
    }
    List<DerivedAttributeSpec> specs = new ArrayList<>();
    for (String attribute : toStringList(attributesNode, SECTION + "." + DERIVE)) {
      specs.add(new DerivedAttributeSpec(attribute, sources));
    }
    return specs;
  }

  private static List<ImpliedAttributeSpec> parseImply(Object node) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> rules)) {
      throw new ConfigLoadException(SECTION + "." + IMPLY + " has to be a list of if/then mappings");
    }
    List<ImpliedAttributeSpec> specs = new ArrayList<>();
    for (Object ruleNode : rules) {
      Map<String, Object> rule = asMap(ruleNode, SECTION + "." + IMPLY + " rule");
      if (!rule.containsKey("if") || !rule.containsKey("then")) {
        throw new ConfigLoadException(SECTION + "." + IMPLY + " section is invalid: " + rule);
      }
      specs.add(new ImpliedAttributeSpec(
          parseValueLists(rule.get("if"), SECTION + "." + IMPLY + ".if"),
          parseValueLists(rule.get("then"), SECTION + "." + IMPLY + ".then")));
    }
    return specs;
  }

  private static Map<String, List<String>> parseValueLists(Object node, String context) {
    Map<String, List<String>> values = new LinkedHashMap<>();
    asMap(node, context).forEach((attribute, value) ->
        values.put(attribute, toStringList(value, context + "." + attribute)));
    return values;
  }
}
