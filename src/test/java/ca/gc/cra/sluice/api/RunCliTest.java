package ca.gc.cra.sluice.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  private static ExitCode run(String... args) {
    return RunCli.run(CliInput.parse(args));
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  private Path pipeline(String tapScript, String targetScript) throws IOException {
    Path yaml = tempDir.resolve("pipeline.yaml");
    Files.writeString(yaml, """
        run:
          runDir: %s
          stages:
            - id: tap
              role: extractor
              command: [sh, -c, "%s"]
            - id: target
              role: loader
              command: [sh, -c, "%s"]
        """.formatted(tempDir.resolve("run"), tapScript, targetScript));
    return yaml;
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, run("--help"));
    assertTrue(buffer.toString().contains("config=PATH"));
  }

  @Test
  void missingConfigReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("bufferSize=64"));

    assertTrue(buffer.toString().contains("usage: run"));
    assertTrue(loggedError("Missing required config=PATH"));
  }

  @Test
  void unexpectedPositionalArgumentsAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS, run("extra", "config=x.yaml"));
  }

  @Test
  void missingConfigFileIsIoError() {
    assertEquals(ExitCode.IO_ERROR, run("config=" + tempDir.resolve("absent.yaml")));
  }

  @Test
  void invalidDefinitionIsConfigError() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "run:\n  stages: nope\n");

    assertEquals(ExitCode.CONFIG_ERROR, run("config=" + yaml));
    assertTrue(loggedError("Invalid pipeline definition"));
  }

  @Test
  void unknownSettingIsInvalidArgs() throws IOException {
    Path yaml = pipeline("echo a", "cat > /dev/null");

    assertEquals(ExitCode.INVALID_ARGS, run("config=" + yaml, "bufsize=12"));
    assertTrue(loggedError("Unknown CLI setting: bufsize"));
  }

  @Test
  void invalidEndpointIsInvalidArgs() throws IOException {
    Path yaml = pipeline("echo a", "cat > /dev/null");

    assertEquals(ExitCode.INVALID_ARGS, run("config=" + yaml, "otelEndpoint=ftp://collector"));
    assertTrue(loggedError("otelEndpoint must use http or https scheme"));
  }

  @Test
  void dryRunPrintsPlanWithoutStartingStages() throws IOException {
    Path output = tempDir.resolve("never.txt");
    Path yaml = pipeline("echo a", "cat > " + output);

    ExitCode code = run("config=" + yaml, "bufferSize=64", "runId=plan-1", "--dry-run");

    assertEquals(ExitCode.SUCCESS, code);
    String printed = buffer.toString();
    assertTrue(printed.contains("Run dry-run: no stages will be started."), printed);
    assertTrue(printed.contains("plan-1"));
    assertTrue(printed.contains("line limit 32"));
    assertTrue(printed.contains("tap"));
    assertTrue(printed.contains("loader"));
    assertFalse(Files.exists(output));
  }

  @Test
  void dryRunRejectsInvalidTopology() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("backwards.yaml"), """
        run:
          stages:
            - {id: target, role: loader, command: [cat]}
            - {id: tap, role: extractor, command: [echo]}
        """);

    assertEquals(ExitCode.CONFIG_ERROR, run("config=" + yaml, "--dry-run"));
    assertTrue(loggedError("First stage in pipeline should not be a consumer"));
  }

  @Test
  @Timeout(30)
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void runsPipelineToCompletion() throws IOException {
    Path output = tempDir.resolve("out.txt");
    Path yaml = pipeline("echo a; echo b", "cat > " + output);

    ExitCode code = run("config=" + yaml, "runId=it-1");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("a\nb\n", Files.readString(output));
    assertTrue(buffer.toString().contains("Run completed (run it-1)"));
  }

  @Test
  @Timeout(30)
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void extractorFailureMapsToExtractLoadFailure() throws IOException {
    Path yaml = pipeline("echo a; exit 3", "cat > /dev/null");

    assertEquals(ExitCode.EXTRACT_LOAD_FAILURE, run("config=" + yaml));
    assertTrue(buffer.toString().contains("Extractor failed"));
  }

  @Test
  @Timeout(30)
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void runLogCapturesStderrAsJsonLines() throws IOException {
    Path runLog = tempDir.resolve("logs").resolve("run.jsonl");
    Path yaml = pipeline("echo extracting >&2; echo a", "cat > /dev/null");

    assertEquals(ExitCode.SUCCESS, run("config=" + yaml, "runId=it-2", "runLog=" + runLog));

    String log = Files.readString(runLog);
    assertTrue(log.contains("\"run\":\"it-2\""), log);
    assertTrue(log.contains("\"line\":\"extracting\""), log);
  }

  @Test
  @Timeout(30)
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void oversizedLineIsRuntimeFailure() throws IOException {
    Path yaml = pipeline("printf '%0100d' 7; echo; exec sleep 30", "cat > /dev/null");

    assertEquals(ExitCode.RUNTIME_FAILURE, run("config=" + yaml, "bufferSize=64"));
    assertTrue(loggedError("Output line length limit exceeded"));
  }
}
