package ca.gc.cra.roster.api;

import ca.gc.cra.roster.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException when an argument is not {@code key=value} or a key or value is malformed
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
    }
    return map;
  }

  /**
   * Removes and returns a required argument.
   *
   * @param args parsed arguments; the key is removed
   * @param key argument name
   * @return value
   * @throws IllegalArgumentException when the argument is absent
   */
  static String require(Map<String, String> args, String key) {
    String value = args.remove(key);
    if (value == null) {
      throw new IllegalArgumentException("missing required argument " + key + "=...");
    }
    return value;
  }

  /**
   * Fails when arguments remain that no command option consumed.
   *
   * @param args remaining arguments
   * @throws IllegalArgumentException when {@code args} is not empty
   */
  static void rejectUnknown(Map<String, String> args) {
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", args.keySet()));
    }
  }
}
