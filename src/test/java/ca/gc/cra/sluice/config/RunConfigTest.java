package ca.gc.cra.sluice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RunConfigTest {

  @Test
  void defaultsGenerateRunIdAndTempRunDirectory() {
    RunConfig config = RunConfig.defaults();

    assertEquals(10 * 1024 * 1024, config.bufferSize());
    assertFalse(config.runId().isBlank());
    assertEquals(config.runId(), config.jobName());
    assertEquals(Path.of(System.getProperty("java.io.tmpdir"), "sluice", config.runId()), config.runDirectory());
    assertEquals(Optional.empty(), config.runLog());
    assertFalse(config.traceStdout());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void fromMapParsesEverySetting() {
    Map<String, String> options = new HashMap<>(RunDefaults.asFlatMap());
    options.put(RunConfig.BUFFER_SIZE, "64");
    options.put(RunConfig.RUN_ID, "nightly-42");
    options.put(RunConfig.JOB_NAME, "nightly csv load");
    options.put(RunConfig.RUN_DIR, "/var/tmp/sluice/nightly-42");
    options.put(RunConfig.RUN_LOG, "/var/log/sluice/run.jsonl");
    options.put(RunConfig.TRACE_STDOUT, "true");
    options.put(RunConfig.METRICS_EXPORTER, "OTLP");

    RunConfig config = RunConfig.fromMap(options);

    assertEquals(64, config.bufferSize());
    assertEquals("nightly-42", config.runId());
    assertEquals("nightly csv load", config.jobName());
    assertEquals(Path.of("/var/tmp/sluice/nightly-42"), config.runDirectory());
    assertEquals(Optional.of(Path.of("/var/log/sluice/run.jsonl")), config.runLog());
    assertTrue(config.traceStdout());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void bufferSizeOutOfRangeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> RunConfig.fromMap(Map.of(RunConfig.BUFFER_SIZE, "1")));
    assertThrows(IllegalArgumentException.class, () -> RunConfig.fromMap(Map.of(RunConfig.BUFFER_SIZE, "big")));
  }

  @Test
  void runIdMustBeAnIdentifier() {
    assertThrows(IllegalArgumentException.class, () -> RunConfig.fromMap(Map.of(RunConfig.RUN_ID, "../escape")));
  }
}
