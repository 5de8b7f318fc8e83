package ca.gc.cra.roster.domain.sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable working copy of a sample while a roster is being resolved.
 *
 * <p>A draft is created per annotation row, edited by the subsample merger and modifier stages, and
 * frozen into a {@link SampleRecord}. Drafts never outlive a single resolution.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the resolving thread.</p>
 *
 * @since 0.1.0
 */
public final class SampleDraft {
  private final Map<String, List<String>> attributes = new LinkedHashMap<>();
  private final List<SubsampleRow> subsamples = new ArrayList<>();
  private final Set<String> mergedAttributes = new LinkedHashSet<>();

  /**
   * Seeds a draft from one annotation row.
   *
   * @param row column name to cell value; {@code null} and empty cells are treated as absent
   * @return new draft holding one token per present cell
   */
  public static SampleDraft fromRow(Map<String, String> row) {
    SampleDraft draft = new SampleDraft();
    Objects.requireNonNull(row, "row").forEach((column, value) -> {
      if (value != null && !value.isEmpty()) {
        draft.set(column, value);
      }
    });
    return draft;
  }

  /**
   * Returns the current joined {@code sample_name}, or {@code null} when unset.
   *
   * @return sample name
   */
  public String sampleName() {
    return value(SampleRecord.SAMPLE_NAME);
  }

  public boolean has(String attribute) {
    return attributes.containsKey(attribute);
  }

  /**
   * Returns the tokens of an attribute.
   *
   * @param attribute attribute name
   * @return unmodifiable token list; empty when absent
   */
  public List<String> values(String attribute) {
    List<String> tokens = attributes.get(attribute);
    return tokens == null ? List.of() : Collections.unmodifiableList(tokens);
  }

  /**
   * Returns the joined value of an attribute.
   *
   * @param attribute attribute name
   * @return joined value or {@code null} when absent
   */
  public String value(String attribute) {
    List<String> tokens = attributes.get(attribute);
    return tokens == null ? null : SampleRecord.join(tokens);
  }

  public void set(String attribute, String value) {
    set(attribute, List.of(Objects.requireNonNull(value, "value")));
  }

  public void set(String attribute, List<String> tokens) {
    Objects.requireNonNull(attribute, "attribute");
    attributes.put(attribute, new ArrayList<>(tokens));
  }

  public boolean remove(String attribute) {
    mergedAttributes.remove(attribute);
    return attributes.remove(attribute) != null;
  }

  public Set<String> attributeNames() {
    return Collections.unmodifiableSet(attributes.keySet());
  }

  /**
   * Returns a snapshot of the joined attribute values, used as the sample scope during expansion.
   *
   * @return ordered copy of attribute name to joined value
   */
  public Map<String, String> scope() {
    Map<String, String> scope = new LinkedHashMap<>();
    attributes.forEach((name, tokens) -> scope.put(name, SampleRecord.join(tokens)));
    return scope;
  }

  public void addSubsample(SubsampleRow row) {
    subsamples.add(Objects.requireNonNull(row, "row"));
  }

  public List<SubsampleRow> subsamples() {
    return Collections.unmodifiableList(subsamples);
  }

  /**
   * Marks an attribute whose tokens were contributed by subsample rows.
   *
   * @param attribute merged attribute
   */
  public void markMerged(String attribute) {
    mergedAttributes.add(attribute);
  }

  public boolean isMerged(String attribute) {
    return mergedAttributes.contains(attribute);
  }

  /**
   * Freezes the draft.
   *
   * @return immutable record
   * @throws IllegalStateException when the draft has no {@code sample_name}
   */
  public SampleRecord freeze() {
    String name = sampleName();
    if (name == null) {
      throw new IllegalStateException("sample draft has no " + SampleRecord.SAMPLE_NAME);
    }
    return new SampleRecord(name, attributes, subsamples);
  }
}
