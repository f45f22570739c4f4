package github.sarthakdev143.pixel_factory.stream;

import github.sarthakdev143.pixel_factory.config.PixelFactoryProperties;
import github.sarthakdev143.pixel_factory.factory.StreamFactory;
import github.sarthakdev143.pixel_factory.model.StreamStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every snapshot stream, keyed by route.
 * <p>
 * Streams defined in configuration read their script file on every tick, so edits
 * show up on the next render without a restart.
 */
@Component
public class StreamManager {

    private static final Logger logger = LoggerFactory.getLogger(StreamManager.class);

    private final StreamFactory streamFactory;
    private final Map<String, SnapshotStream> streams = new LinkedHashMap<>();

    public StreamManager(PixelFactoryProperties properties, StreamFactory streamFactory) {
        this.streamFactory = streamFactory;
        for (PixelFactoryProperties.StreamDefinition definition : properties.streams().definitions()) {
            try {
                add(new StreamConfig(
                        definition.name(),
                        definition.route(),
                        definition.interval(),
                        fileScript(definition.scriptFile())));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping stream definition {} on route {}: {}",
                        definition.name(), definition.route(), e.getMessage());
            }
        }
    }

    public synchronized SnapshotStream add(StreamConfig config) {
        if (streams.containsKey(config.route())) {
            throw new IllegalArgumentException("A stream is already registered for route '" + config.route() + "'.");
        }
        SnapshotStream stream = streamFactory.create(config);
        streams.put(config.route(), stream);
        return stream;
    }

    public synchronized Optional<SnapshotStream> find(String route) {
        return Optional.ofNullable(streams.get(route));
    }

    public synchronized List<StreamStatus> statuses() {
        List<StreamStatus> statuses = new ArrayList<>(streams.size());
        for (SnapshotStream stream : streams.values()) {
            statuses.add(stream.status());
        }
        return statuses;
    }

    public Optional<StreamStatus> start(String route) throws IOException {
        Optional<SnapshotStream> stream = find(route);
        if (stream.isPresent()) {
            stream.get().start();
        }
        return stream.map(SnapshotStream::status);
    }

    public Optional<StreamStatus> stop(String route) {
        Optional<SnapshotStream> stream = find(route);
        stream.ifPresent(SnapshotStream::stop);
        return stream.map(SnapshotStream::status);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        for (SnapshotStream stream : snapshot()) {
            try {
                stream.start();
            } catch (IOException | IllegalStateException e) {
                logger.error("Could not start stream {}: {}", stream.config().name(), e.getMessage(), e);
            }
        }
    }

    @PreDestroy
    public void stopAll() {
        for (SnapshotStream stream : snapshot()) {
            stream.stop();
        }
    }

    private synchronized List<SnapshotStream> snapshot() {
        return List.copyOf(streams.values());
    }

    private static ScriptSource fileScript(Path scriptFile) {
        if (scriptFile == null) {
            return null;
        }
        return tickTime -> Files.readString(scriptFile, StandardCharsets.UTF_8);
    }
}
