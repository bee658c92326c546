package ca.gc.cra.sluice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of("bufferSize", "4096", "traceStdout", "true");
    Map<String, String> cli = Map.of("bufferSize", "8192");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml),
        cli,
        RunDefaults.asFlatMap(),
        warnings::add);

    assertEquals("8192", merged.get("bufferSize"));
    assertEquals("true", merged.get("traceStdout"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: bufferSize"), warnings);
  }

  @Test
  void defaultsApplyWhenNothingElseIsSet() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of(), RunDefaults.asFlatMap(), msg -> {});

    assertEquals(RunDefaults.asFlatMap(), merged);
  }

  @Test
  void unknownKeysAreRejectedBySource() {
    IllegalArgumentException yaml = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.of(Map.of("iface", "en0")), Map.of(), RunDefaults.asFlatMap(), msg -> {}));
    IllegalArgumentException cli = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.empty(), Map.of("bufsize", "1"), RunDefaults.asFlatMap(), msg -> {}));

    assertEquals("Unknown YAML setting: iface", yaml.getMessage());
    assertTrue(cli.getMessage().contains("Unknown CLI setting: bufsize"));
  }
}
