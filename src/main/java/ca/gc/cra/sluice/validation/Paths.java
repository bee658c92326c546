package ca.gc.cra.sluice.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for SLUICE CLI and configuration flows.
 * <p><strong>Why:</strong> Run directories and run logs must be writable before any stage process is spawned.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} to avoid symlink traversal.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureWritableDirectory(real);
        return real;
      }
      if (!createIfMissing) {
        Path ancestor = nearestExistingAncestor(normalized);
        ensureWritableDirectory(ancestor);
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      ensureWritableDirectory(real);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a file can be created or appended to.
   *
   * @param path candidate file; must not be {@code null}
   * @param createParents whether missing parent directories may be created
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the path is a directory or its parent is not writable
   */
  public static Path validateWritableFile(Path path, boolean createParents) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("file is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    validateWritableDir(parent, createParents);
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

  private static void ensureWritableDirectory(Path dir) {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
