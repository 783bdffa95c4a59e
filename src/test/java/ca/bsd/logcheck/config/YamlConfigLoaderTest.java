package ca.bsd.logcheck.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonSection() throws IOException {
    Path yaml = tempDir.resolve("logcheck.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          sort: true
        analyze:
          in: ./radar-logs
          sort: false
        other:
          in: ignored
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("./radar-logs", map.get("in"));
    assertEquals("false", map.get("sort"));
  }

  @Test
  void nestedMappingsFlattenToDottedKeys() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        analyze:
          otel:
            endpoint: http://collector:4317
          pattern:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("http://collector:4317", map.get("otel.endpoint"));
    assertEquals("", map.get("pattern"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "analyze").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "analyze").orElseThrow());
  }

  @Test
  void listsAndScalarsAtRootAreRejected() throws IOException {
    Path list = Files.writeString(tempDir.resolve("list.yaml"), "analyze:\n  in: [a, b]\n");
    Path scalar = Files.writeString(tempDir.resolve("scalar.yaml"), "just text\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "analyze: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "analyze"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "analyze"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "analyze"));
  }
}
