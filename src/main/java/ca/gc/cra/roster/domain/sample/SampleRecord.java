package ca.gc.cra.roster.domain.sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, fully resolved sample: an ordered attribute map plus the subsample rows merged into it.
 *
 * <p>Attribute values are ordered token lists. Multi-valued attributes (merged file lists, wildcard
 * matches) keep one token per value; {@link #get(String)} and {@link #asMap()} join tokens with a
 * single space, which is the representation collaborators consume. An empty token list is an
 * attribute whose value is the empty string.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param sampleName unique sample identifier; never {@code null}
 * @param attributes attribute name to value tokens, in attribute order; includes {@code sample_name}
 * @param subsamples subsample rows merged into this sample, in file order
 *
 * @since 0.1.0
 */
public record SampleRecord(String sampleName, Map<String, List<String>> attributes, List<SubsampleRow> subsamples) {
  /** Attribute holding the sample identifier. */
  public static final String SAMPLE_NAME = "sample_name";
  /** Prefix of the attribute that keeps a derived attribute's value as it was before derivation. */
  public static final String SOURCE_KEY_PREFIX = "_key_";

  public SampleRecord {
    sampleName = Objects.requireNonNull(sampleName, "sampleName");
    Objects.requireNonNull(attributes, "attributes");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : attributes.entrySet()) {
      copy.put(entry.getKey(), List.copyOf(entry.getValue()));
    }
    attributes = Collections.unmodifiableMap(copy);
    subsamples = subsamples == null ? List.of() : List.copyOf(subsamples);
  }

  /**
   * Returns the joined value of an attribute.
   *
   * @param attribute attribute name
   * @return space-joined value, empty when the attribute is absent
   */
  public Optional<String> get(String attribute) {
    List<String> tokens = attributes.get(attribute);
    return tokens == null ? Optional.empty() : Optional.of(join(tokens));
  }

  /**
   * Returns the value tokens of an attribute.
   *
   * @param attribute attribute name
   * @return ordered tokens; empty list when the attribute is absent or empty
   */
  public List<String> values(String attribute) {
    return attributes.getOrDefault(attribute, List.of());
  }

  public boolean has(String attribute) {
    return attributes.containsKey(attribute);
  }

  /**
   * Returns the data-source key a derived attribute was expanded from.
   *
   * @param attribute derived attribute name
   * @return joined pre-derive value, empty when {@code attribute} was not derived
   */
  public Optional<String> sourceKey(String attribute) {
    return get(SOURCE_KEY_PREFIX + attribute);
  }

  public Set<String> attributeNames() {
    return attributes.keySet();
  }

  /**
   * Returns the attributes with values joined for external consumers.
   *
   * @return unmodifiable ordered map of attribute name to joined value
   */
  public Map<String, String> asMap() {
    Map<String, String> joined = new LinkedHashMap<>();
    attributes.forEach((name, tokens) -> joined.put(name, join(tokens)));
    return Collections.unmodifiableMap(joined);
  }

  /**
   * Looks up a merged subsample by name.
   *
   * @param subsampleName value of the subsample's {@code subsample_name}
   * @return the matching row, if any
   */
  public Optional<SubsampleRow> subsample(String subsampleName) {
    for (SubsampleRow row : subsamples) {
      if (row.subsampleName().equals(subsampleName)) {
        return Optional.of(row);
      }
    }
    return Optional.empty();
  }

  /**
   * Joins value tokens using the external single-space convention.
   *
   * @param tokens ordered tokens
   * @return joined string; empty for an empty list
   */
  public static String join(List<String> tokens) {
    return String.join(" ", tokens);
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    asMap().forEach((k, v) -> parts.add(k + "=" + v));
    return "Sample '" + sampleName + "' " + parts;
  }
}
