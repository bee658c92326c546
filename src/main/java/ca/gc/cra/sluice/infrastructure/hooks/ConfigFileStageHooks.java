package ca.gc.cra.sluice.infrastructure.hooks;

import ca.gc.cra.sluice.application.port.StageHooks;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a stage's key/value settings to {@code <runDir>/<stageId>.config.json} and passes
 * {@code --config <path>} to the stage.
 * <p><strong>Lifecycle:</strong> The file is written in {@link #prepare(ExecutionContext)} and deleted in
 * {@link #cleanup()}. A stage without settings gets no file and no extra arguments.</p>
 * <p><strong>Thread-safety:</strong> Confined to the control thread.</p>
 *
 * @since 0.1.0
 */
public final class ConfigFileStageHooks implements StageHooks {
  private static final Logger log = LoggerFactory.getLogger(ConfigFileStageHooks.class);
  private static final JsonFactory FACTORY = new JsonFactory();
  static final String CONFIG_FLAG = "--config";

  private final StageDescriptor descriptor;
  private Path configFile;

  public ConfigFileStageHooks(StageDescriptor descriptor) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }

  @Override
  public void prepare(ExecutionContext context) throws IOException {
    Map<String, String> settings = descriptor.config();
    if (settings.isEmpty()) {
      return;
    }
    Path runDirectory = context.runDirectory();
    Files.createDirectories(runDirectory);
    Path target = runDirectory.resolve(descriptor.id() + ".config.json");
    try (JsonGenerator generator = FACTORY.createGenerator(target.toFile(), JsonEncoding.UTF8)) {
      generator.useDefaultPrettyPrinter();
      generator.writeStartObject();
      for (Map.Entry<String, String> entry : settings.entrySet()) {
        generator.writeStringField(entry.getKey(), entry.getValue());
      }
      generator.writeEndObject();
    }
    configFile = target;
    log.debug("Wrote {} settings for stage {} to {}", settings.size(), descriptor.id(), target);
  }

  @Override
  public List<String> arguments() {
    if (configFile == null) {
      return List.of();
    }
    return List.of(CONFIG_FLAG, configFile.toString());
  }

  @Override
  public void cleanup() throws IOException {
    Path file = configFile;
    if (file == null) {
      return;
    }
    configFile = null;
    Files.deleteIfExists(file);
    log.debug("Removed settings file {} of stage {}", file, descriptor.id());
  }

  Path configFile() {
    return configFile;
  }
}
