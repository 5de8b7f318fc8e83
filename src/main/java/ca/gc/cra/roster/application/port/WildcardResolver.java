package ca.gc.cra.roster.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Port expanding a path whose trailing segment contains a wildcard into matching files.
 *
 * @since 0.1.0
 */
public interface WildcardResolver {
  /**
   * Expands a wildcard path.
   *
   * @param path path whose final segment may contain {@code *}, {@code ?} or {@code [...]}
   * @return matching paths in lexical order; empty when nothing matches or the parent is missing
   * @throws IOException when the parent directory cannot be listed
   */
  List<String> expand(String path) throws IOException;

  /**
   * Reports whether the trailing segment of a path contains wildcard characters.
   *
   * @param path candidate path
   * @return {@code true} when expansion applies
   */
  static boolean hasTrailingWildcard(String path) {
    if (path == null || path.isEmpty()) {
      return false;
    }
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    String last = path.substring(slash + 1);
    return last.indexOf('*') >= 0 || last.indexOf('?') >= 0 || last.indexOf('[') >= 0;
  }
}
