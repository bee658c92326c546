package ca.gc.cra.sluice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndRunSections() throws IOException {
    Path yaml = tempDir.resolve("sluice.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          bufferSize: 1024
        run:
          bufferSize: 4096
          traceStdout: true
          stages:
            - id: tap
              role: extractor
              command: [echo, hi]
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "run");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("4096", map.get("bufferSize"));
    assertEquals("true", map.get("traceStdout"));
    assertFalse(map.containsKey("stages"), "stage definitions are not flat settings");
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        RUN:
          otel:
            endpoint: http://collector:4317
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();

    assertEquals("http://collector:4317", map.get("otel.endpoint"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "run").isEmpty());
  }

  @Test
  void emptyDocumentYieldsNoSettings() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "run").orElseThrow());
  }

  @Test
  void listsOutsideStagesAreRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("list.yaml"), """
        run:
          runId: [a, b]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void malformedYamlIsReportedAsInvalidArgument() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "run: [unclosed\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "run"));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config"));
  }
}
