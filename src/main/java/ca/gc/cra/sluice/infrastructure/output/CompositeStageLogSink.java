package ca.gc.cra.sluice.infrastructure.output;

import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans each stage line out to several sinks in order.
 *
 * <p>A delegate that throws is logged once at WARN and skipped for the rest of the run; the remaining
 * delegates keep receiving lines.</p>
 */
public final class CompositeStageLogSink implements StageLogSink {
  private static final Logger log = LoggerFactory.getLogger(CompositeStageLogSink.class);

  private final List<StageLogSink> delegates;
  private final AtomicReferenceArray<RuntimeException> failures;

  private CompositeStageLogSink(List<StageLogSink> delegates) {
    this.delegates = delegates;
    this.failures = new AtomicReferenceArray<>(delegates.size());
  }

  /**
   * Combines sinks; a single sink is returned unchanged and an empty list yields {@link StageLogSink#NO_OP}.
   */
  public static StageLogSink of(List<StageLogSink> sinks) {
    List<StageLogSink> copy = List.copyOf(sinks);
    if (copy.isEmpty()) {
      return StageLogSink.NO_OP;
    }
    if (copy.size() == 1) {
      return copy.get(0);
    }
    return new CompositeStageLogSink(copy);
  }

  @Override
  public void accept(String stageId, StreamKind stream, String line) {
    for (int i = 0; i < delegates.size(); i++) {
      if (failures.get(i) != null) {
        continue;
      }
      StageLogSink delegate = delegates.get(i);
      try {
        delegate.accept(stageId, stream, line);
      } catch (RuntimeException ex) {
        if (failures.compareAndSet(i, null, ex)) {
          log.warn("Stage log sink {} failed on {} of stage {}; skipping it for the rest of the run",
              delegate.getClass().getSimpleName(), stream.label(), stageId, ex);
        }
      }
    }
  }
}
