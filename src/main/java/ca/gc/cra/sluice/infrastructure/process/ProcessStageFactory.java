package ca.gc.cra.sluice.infrastructure.process;

import ca.gc.cra.sluice.application.port.StageHooks;
import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import ca.gc.cra.sluice.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link ProcessStage}s that share one daemon pool for their stream proxies.
 *
 * <p>Close the factory once the run has finished to release idle proxy threads.</p>
 */
public final class ProcessStageFactory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ProcessStageFactory.class);

  private final ExecutorService proxyPool;
  private final Function<StageDescriptor, StageHooks> hooksFactory;

  public ProcessStageFactory(Function<StageDescriptor, StageHooks> hooksFactory) {
    this.hooksFactory = Objects.requireNonNull(hooksFactory, "hooksFactory");
    this.proxyPool = ExecutorFactories.newStreamPool("sluice-io",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
  }

  /** Factory whose stages have no hooks. */
  public static ProcessStageFactory withoutHooks() {
    return new ProcessStageFactory(descriptor -> StageHooks.NONE);
  }

  public ProcessStage create(StageDescriptor descriptor) {
    return new ProcessStage(descriptor, hooksFactory.apply(descriptor), proxyPool);
  }

  @Override
  public void close() {
    proxyPool.shutdownNow();
  }
}
