package ca.gc.cra.roster.config;

import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule assigning attributes to every sample whose attributes match all trigger conditions.
 *
 * @param conditions trigger attribute to accepted values; a sample matches when each attribute is present
 *     and its joined value is one of the accepted values
 * @param assignments attribute to value tokens written on a match
 *
 * @since 0.1.0
 */
public record ImpliedAttributeSpec(Map<String, List<String>> conditions, Map<String, List<String>> assignments) {

  public ImpliedAttributeSpec {
    conditions = copy(conditions);
    assignments = copy(assignments);
  }

  /**
   * Evaluates the trigger conditions against a sample's current values.
   *
   * @param sample sample under resolution
   * @return {@code true} when every condition holds
   */
  public boolean matches(SampleDraft sample) {
    for (Map.Entry<String, List<String>> condition : conditions.entrySet()) {
      String value = sample.value(condition.getKey());
      if (value == null || !condition.getValue().contains(value)) {
        return false;
      }
    }
    return true;
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> source) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (source != null) {
      source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
    }
    return Collections.unmodifiableMap(copy);
  }
}
