package ca.gc.cra.nodeset.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateReadableFileAcceptsExistingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("hosts.yaml"), "[]");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableFile(file));
  }

  @Test
  void validateReadableFileRejectsMissingFileAndDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("missing")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir));
  }

  @Test
  void validateWritableFileRejectsExistingFileWithoutOverwrite() throws IOException {
    Path file = Files.writeString(tempDir.resolve("out.yaml"), "[]");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(file, false));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateWritableFile(file, true));
  }

  @Test
  void validateWritableFileRequiresExistingParent() {
    Path file = tempDir.resolve("missing").resolve("out.yaml");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(file, true));
  }

  @Test
  void validateWritableFileAcceptsNewFile() {
    Path file = tempDir.resolve("new.yaml");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateWritableFile(file, false));
  }
}
