package ca.gc.cra.roster.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for roster export destinations.
 * <p><strong>Why:</strong> An export must not silently replace an existing table or fail halfway because its
 * directory is missing or read-only.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked destination is reported
 * rather than followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates (and optionally creates) a writable directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory and its parents when absent
   * @return absolute, normalized directory path
   * @throws IllegalArgumentException if the path is malformed, missing (and not created), not a directory,
   *     or not writable
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output file location; its parent directory is created when missing.
   *
   * @param file destination file; must not be {@code null}
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute, normalized file path
   * @throws IllegalArgumentException if the file exists and overwriting is not allowed, the path names a
   *     directory, or the parent cannot be used
   */
  public static Path validateOutputFile(Path file, boolean allowOverwrite) {
    Path normalized = normalize(file);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("output path has no parent directory: " + normalized);
    }
    validateWritableDir(parent, true);
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
