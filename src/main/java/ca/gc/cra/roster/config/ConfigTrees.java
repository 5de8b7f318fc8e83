package ca.gc.cra.roster.config;

import ca.gc.cra.roster.domain.error.ConfigLoadException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for walking, copying and merging the {@code Map}/{@code List} trees SnakeYAML produces.
 */
final class ConfigTrees {

  private ConfigTrees() {}

  static Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new ConfigLoadException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigLoadException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new ConfigLoadException(context + " contains non-string key: " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static Map<String, Object> asMapOrEmpty(Object node, String context) {
    return node == null ? new LinkedHashMap<>() : asMap(node, context);
  }

  static boolean isScalar(Object node) {
    return node instanceof String || node instanceof Number || node instanceof Boolean;
  }

  /**
   * Collects the top-level scalar entries of a tree as strings; this is the project scope used when
   * expanding placeholders.
   */
  static Map<String, String> scalars(Map<String, Object> tree) {
    Map<String, String> scalars = new LinkedHashMap<>();
    tree.forEach((key, value) -> {
      if (isScalar(value)) {
        scalars.put(key, value.toString());
      }
    });
    return scalars;
  }

  static String toString(Object value) {
    return value == null ? "" : value.toString();
  }

  /**
   * Reads a node that may be a single scalar or a list of scalars.
   */
  static List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (isScalar(node)) {
      return List.of(node.toString());
    }
    if (node instanceof Iterable<?> iterable) {
      List<String> values = new ArrayList<>();
      for (Object element : iterable) {
        if (element != null && !isScalar(element)) {
          throw new ConfigLoadException(context + " must contain only scalar values");
        }
        values.add(toString(element));
      }
      return List.copyOf(values);
    }
    throw new ConfigLoadException(context + " must be a scalar or a list");
  }

  static Map<String, Object> deepCopy(Map<String, Object> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> copy.put(key, deepCopyValue(value, key)));
    return copy;
  }

  private static Object deepCopyValue(Object value, String context) {
    if (value instanceof Map<?, ?>) {
      return deepCopy(asMap(value, context));
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(deepCopyValue(element, context));
      }
      return copy;
    }
    return value;
  }

  /**
   * Returns an unmodifiable deep copy; nested maps and lists are wrapped as well.
   */
  static Map<String, Object> freeze(Map<String, Object> source) {
    Map<String, Object> frozen = new LinkedHashMap<>();
    source.forEach((key, value) -> frozen.put(key, freezeValue(value, key)));
    return Collections.unmodifiableMap(frozen);
  }

  private static Object freezeValue(Object value, String context) {
    if (value instanceof Map<?, ?>) {
      return freeze(asMap(value, context));
    }
    if (value instanceof List<?> list) {
      List<Object> frozen = new ArrayList<>(list.size());
      for (Object element : list) {
        frozen.add(freezeValue(element, context));
      }
      return Collections.unmodifiableList(frozen);
    }
    return value;
  }

  /**
   * Top-level merge: each key of {@code overlay} replaces the same key of {@code base} wholesale.
   */
  static Map<String, Object> shallowMerge(Map<String, Object> base, Map<String, Object> overlay) {
    Map<String, Object> merged = new LinkedHashMap<>(base);
    merged.putAll(overlay);
    return merged;
  }

  /**
   * Key-path merge: mappings merge recursively, scalars and lists from {@code overlay} replace.
   * Neither argument is modified.
   */
  static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
    Map<String, Object> merged = deepCopy(base);
    for (Map.Entry<String, Object> entry : overlay.entrySet()) {
      String key = entry.getKey();
      Object current = merged.get(key);
      Object incoming = entry.getValue();
      if (current instanceof Map<?, ?> && incoming instanceof Map<?, ?>) {
        merged.put(key, deepMerge(asMap(current, key), asMap(incoming, key)));
      } else {
        merged.put(key, deepCopyValue(incoming, key));
      }
    }
    return merged;
  }
}
