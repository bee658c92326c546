package ca.gc.cra.sluice.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void createsMissingDirectoryWhenAsked() {
    Path target = tempDir.resolve("runs").resolve("r1");

    Path validated = Paths.validateWritableDir(target, true);

    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void leavesMissingDirectoryAloneOtherwise() {
    Path target = tempDir.resolve("later");

    Path validated = Paths.validateWritableDir(target, false);

    assertEquals(target.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(target));
  }

  @Test
  void rejectsRegularFileAsDirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("plain.txt"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void rejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(Path.of("runs\u0001"), false));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(null, false));
  }

  @Test
  void writableFileMayCreateParents() {
    Path file = tempDir.resolve("logs").resolve("run.jsonl");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateWritableFile(file, true));
    assertTrue(Files.isDirectory(file.getParent()));
  }

  @Test
  void writableFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(tempDir, true));
  }
}
