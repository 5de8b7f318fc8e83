package ca.gc.cra.roster.infrastructure.fs;

import ca.gc.cra.roster.application.port.WildcardResolver;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WildcardResolver} listing the parent directory with a {@code glob:} filter on the trailing segment.
 *
 * <p>Only the final path segment is matched; wildcards in parent directories are taken literally. Hidden
 * entries (names starting with {@code .}) match only a pattern that itself starts with {@code .}.</p>
 *
 * @since 0.1.0
 */
public final class GlobWildcardResolver implements WildcardResolver {
  private static final Logger log = LoggerFactory.getLogger(GlobWildcardResolver.class);

  @Override
  public List<String> expand(String path) throws IOException {
    Objects.requireNonNull(path, "path");
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    String parentText = slash < 0 ? "." : (slash == 0 ? path.substring(0, 1) : path.substring(0, slash));
    String pattern = path.substring(slash + 1);
    Path parent = Path.of(parentText);
    if (!Files.isDirectory(parent)) {
      log.debug("Wildcard parent {} does not exist; '{}' matches nothing", parent, path);
      return List.of();
    }
    boolean includeHidden = pattern.startsWith(".");
    List<String> matches = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, pattern)) {
      for (Path match : stream) {
        if (!includeHidden && match.getFileName().toString().startsWith(".")) {
          continue;
        }
        matches.add(slash < 0 ? match.getFileName().toString() : match.toString());
      }
    } catch (PatternSyntaxException ex) {
      throw new IOException("Invalid wildcard pattern '" + pattern + "'", ex);
    }
    Collections.sort(matches);
    log.debug("Wildcard '{}' matched {} paths", path, matches.size());
    return matches;
  }
}
