package github.sarthakdev143.pixel_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

@Component
@Order(0)
@ConditionalOnProperty(name = "pixel-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final PixelFactoryProperties properties;

    public StartupPreflightChecks(PixelFactoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkArtifactDirectory();
        checkStreamDefinitions();
        logger.info("Preflight checks done for {} configured stream(s)", properties.streams().definitions().size());
    }

    private void checkArtifactDirectory() {
        Path baseDir = properties.streams().baseDir();
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Artifact directory " + baseDir.toAbsolutePath()
                            + " cannot be created. Set pixel-factory.streams.base-dir to a writable location.",
                    e);
        }

        if (!Files.isWritable(baseDir)) {
            throw new IllegalStateException(
                    "Artifact directory " + baseDir.toAbsolutePath() + " is not writable.");
        }
    }

    private void checkStreamDefinitions() {
        Set<String> routes = new HashSet<>();
        for (PixelFactoryProperties.StreamDefinition definition : properties.streams().definitions()) {
            if (definition.route() != null && !routes.add(definition.route().strip())) {
                logger.warn("Stream route '{}' is configured more than once; only the first definition is served.",
                        definition.route());
            }

            Path scriptFile = definition.scriptFile();
            if (scriptFile == null) {
                logger.warn("Stream '{}' has no script-file configured and will not start.", definition.name());
            } else if (!Files.isRegularFile(scriptFile) || !Files.isReadable(scriptFile)) {
                logger.warn("Script file for stream '{}' not found or not readable at {}; renders fail until it appears.",
                        definition.name(), scriptFile.toAbsolutePath());
            }
        }
    }
}
