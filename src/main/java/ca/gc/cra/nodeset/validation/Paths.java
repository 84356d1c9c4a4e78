package ca.gc.cra.nodeset.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the expander CLI.
 * <p><strong>Why:</strong> Record documents are read and written at operator-supplied paths; problems should be
 * reported before any record is expanded.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param path candidate input file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file can be created or replaced at {@code path}.
   *
   * @param path candidate output file; must not be {@code null}
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the parent is missing or not writable, or the file exists without
   *     {@code allowOverwrite}
   */
  public static Path validateWritableFile(Path path, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output file " + normalized + " exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
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
