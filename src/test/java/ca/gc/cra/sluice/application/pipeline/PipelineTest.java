package ca.gc.cra.sluice.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.run.TopologyException;
import ca.gc.cra.sluice.domain.stage.StageRole;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PipelineTest {

  @Test
  void validPipelinesPassValidation() {
    assertDoesNotThrow(() -> Pipeline.of(List.of(
        new FakeStage("tap", StageRole.EXTRACTOR),
        new FakeStage("target", StageRole.LOADER))).validate());
    assertDoesNotThrow(() -> Pipeline.of(List.of(
        new FakeStage("tap", StageRole.EXTRACTOR),
        new FakeStage("map-1", StageRole.MAPPER),
        new FakeStage("map-2", StageRole.MAPPER),
        new FakeStage("target", StageRole.LOADER))).validate());
  }

  @Test
  void singleProducerIsAllowed() {
    assertDoesNotThrow(() -> Pipeline.of(List.of(new FakeStage("tap", StageRole.EXTRACTOR))).validate());
    assertDoesNotThrow(() -> Pipeline.of(List.of(new FakeStage("cmd", StageRole.COMMAND))).validate());
  }

  @Test
  void emptyPipelineIsRejected() {
    TopologyException ex = assertThrows(TopologyException.class, () -> Pipeline.of(List.of()).validate());
    assertEquals(TopologyException.Rule.EMPTY, ex.rule());
  }

  @Test
  void consumingHeadIsRejected() {
    TopologyException ex = assertThrows(TopologyException.class, () -> Pipeline.of(List.of(
        new FakeStage("map", StageRole.MAPPER),
        new FakeStage("target", StageRole.LOADER))).validate());
    assertEquals(TopologyException.Rule.HEAD_CONSUMES, ex.rule());
    assertTrue(ex.getMessage().contains("map"));
  }

  @Test
  void producingTailIsRejected() {
    TopologyException ex = assertThrows(TopologyException.class, () -> Pipeline.of(List.of(
        new FakeStage("tap", StageRole.EXTRACTOR),
        new FakeStage("map", StageRole.MAPPER))).validate());
    assertEquals(TopologyException.Rule.TAIL_PRODUCES, ex.rule());
  }

  @Test
  void intermediateMustProduceAndConsume() {
    TopologyException ex = assertThrows(TopologyException.class, () -> Pipeline.of(List.of(
        new FakeStage("tap", StageRole.EXTRACTOR),
        new FakeStage("load-early", StageRole.LOADER),
        new FakeStage("target", StageRole.LOADER))).validate());
    assertEquals(TopologyException.Rule.INTERMEDIATE_ROLE, ex.rule());
    assertTrue(ex.getMessage().contains("load-early"));
  }

  @Test
  void linkRejectsConsumerWithoutUpstreamProducer() throws Exception {
    FakeStage command = new FakeStage("cmd", StageRole.COMMAND);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(command, target));
    pipeline.validate();
    command.start();
    target.start();

    TopologyException ex = assertThrows(TopologyException.class, () -> pipeline.link(StageLogSink.NO_OP, false));
    assertEquals(TopologyException.Rule.MISSING_UPSTREAM, ex.rule());
  }

  @Test
  void linkConnectsStdoutToNextStdinAndLogsStderr() throws Exception {
    FakeStage tap = new FakeStage("tap", StageRole.EXTRACTOR);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(tap, target));
    tap.start();
    target.start();
    List<String> logged = new ArrayList<>();

    pipeline.link((stageId, stream, line) -> logged.add(stageId + "/" + stream.label() + ":" + line), false);

    assertEquals(1, tap.stdoutSinks.size(), "stdout is only wired downstream without tracing");
    assertEquals(1, tap.stderrSinks.size());
    assertEquals(0, target.stdoutSinks.size());
    assertEquals(1, target.stderrSinks.size());

    tap.stdoutSinks.get(0).write("{\"id\":1}\n".getBytes(StandardCharsets.UTF_8));
    tap.stderrSinks.get(0).write("starting\r\n".getBytes(StandardCharsets.UTF_8));
    assertEquals("{\"id\":1}\n", target.received.toString(StandardCharsets.UTF_8));
    assertEquals(List.of("tap/stderr:starting"), logged);
  }

  @Test
  void traceStdoutAddsLogSinkBeforeDownstream() throws Exception {
    FakeStage tap = new FakeStage("tap", StageRole.EXTRACTOR);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(tap, target));
    tap.start();
    target.start();
    List<String> logged = new ArrayList<>();

    pipeline.link((stageId, stream, line) -> {
      if (stream == StreamKind.STDOUT) {
        logged.add(stageId + ":" + line);
      }
    }, true);

    assertEquals(2, tap.stdoutSinks.size());
    assertEquals(1, target.stdoutSinks.size());
    tap.stdoutSinks.get(0).write("row\n".getBytes(StandardCharsets.UTF_8));
    assertEquals(List.of("tap:row"), logged);
  }

  @Test
  void derivedViews() {
    FakeStage tap = new FakeStage("tap", StageRole.EXTRACTOR);
    FakeStage map = new FakeStage("map", StageRole.MAPPER);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(tap, map, target));

    assertSame(tap, pipeline.head());
    assertSame(target, pipeline.tail());
    assertEquals(List.of(map), pipeline.intermediate());
    assertEquals(List.of(map, target), pipeline.from(1));
    assertEquals(2, pipeline.indexOf(target));
    assertThrows(IllegalArgumentException.class, () -> pipeline.indexOf(new FakeStage("x", StageRole.COMMAND)));
  }

  @Test
  void upstreamCompleteTracksExitsBeforeIndex() {
    FakeStage tap = new FakeStage("tap", StageRole.EXTRACTOR);
    FakeStage map = new FakeStage("map", StageRole.MAPPER);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(tap, map, target));

    tap.exitWith(0);
    assertTrue(pipeline.upstreamComplete(1));
    assertEquals(false, pipeline.upstreamComplete(2));
    map.exitWith(0);
    assertTrue(pipeline.upstreamComplete(2));
  }

  @Test
  void gracefulTerminateIsUnsupported() {
    Pipeline pipeline = Pipeline.of(List.of(new FakeStage("tap", StageRole.EXTRACTOR)));
    assertThrows(UnsupportedOperationException.class, () -> pipeline.terminate(true));
  }

  @Test
  void terminateStopsOnlyStartedStages() throws Exception {
    FakeStage tap = new FakeStage("tap", StageRole.EXTRACTOR);
    FakeStage target = new FakeStage("target", StageRole.LOADER);
    Pipeline pipeline = Pipeline.of(List.of(tap, target));
    tap.start();

    pipeline.terminate(false);

    assertEquals(1, tap.stopCalls);
    assertEquals(0, target.stopCalls);
  }
}
