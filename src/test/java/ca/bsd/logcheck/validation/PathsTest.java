package ca.bsd.logcheck.validation;

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
    Path target = tempDir.resolve("reports/nested");

    Path result = Paths.validateWritableDir(target, null, true, false);

    assertTrue(Files.isDirectory(result));
  }

  @Test
  void leavesMissingDirectoryAloneWhenNotCreating() {
    Path target = tempDir.resolve("reports");

    Path result = Paths.validateWritableDir(target, null, false, false);

    assertEquals(target.toAbsolutePath().normalize(), result);
    assertFalse(Files.exists(target));
  }

  @Test
  void populatedDirectoryNeedsReuse() throws IOException {
    Path target = Files.createDirectories(tempDir.resolve("reports"));
    Files.writeString(target.resolve("comparison.json"), "{}");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(target, null, true, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertTrue(Files.isDirectory(Paths.validateWritableDir(target, null, true, true)));
  }

  @Test
  void rejectsFilesAndPathsOutsideBase() throws IOException {
    Path file = Files.writeString(tempDir.resolve("plain.txt"), "x");
    Path base = Files.createDirectories(tempDir.resolve("base"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, null, true, true));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir.resolve("elsewhere"), base, true, false));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(null, null, true, false));
  }
}
