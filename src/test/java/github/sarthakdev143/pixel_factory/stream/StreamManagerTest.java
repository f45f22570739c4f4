package github.sarthakdev143.pixel_factory.stream;

import github.sarthakdev143.pixel_factory.config.PixelFactoryProperties;
import github.sarthakdev143.pixel_factory.factory.StreamFactory;
import github.sarthakdev143.pixel_factory.model.StreamState;
import github.sarthakdev143.pixel_factory.model.StreamStatus;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@ExtendWith(MockitoExtension.class)
class StreamManagerTest {

    @Mock
    private ScriptRenderService renderService;

    @TempDir
    Path tempDir;

    private final List<Runnable> dispatched = new CopyOnWriteArrayList<>();
    private StreamManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stopAll();
        }
    }

    @Test
    void configuredStreamsAreKeyedByRouteAndReadScriptFileEachTick() throws Exception {
        Path script = tempDir.resolve("dashboard.pipe");
        Files.writeString(script, "solid(1 1 0 0 0)");
        manager = manager(definition("Dashboard", "dashboard", Duration.ofSeconds(5), script));

        SnapshotStream stream = manager.find("dashboard").orElseThrow();
        ScriptSource source = stream.config().scriptSource();
        assertThat(source.scriptAt(Instant.EPOCH)).isEqualTo("solid(1 1 0 0 0)");

        Files.writeString(script, "solid(2 2 0 0 0)");
        assertThat(source.scriptAt(Instant.EPOCH)).isEqualTo("solid(2 2 0 0 0)");
        assertThat(manager.find("unknown")).isEmpty();
    }

    @Test
    void invalidDefinitionsAreSkippedWithoutFailingConstruction() throws Exception {
        Path script = Files.writeString(tempDir.resolve("a.pipe"), "solid(1 1 0 0 0)");

        manager = manager(
                definition(" ", "blank-name", Duration.ofSeconds(5), script),
                definition("No route", "", Duration.ofSeconds(5), script),
                definition("Nested", "a/b", Duration.ofSeconds(5), script),
                definition("First", "shared", Duration.ofSeconds(5), script),
                definition("Second", "shared", Duration.ofSeconds(5), script),
                definition("No script", "no-script", Duration.ofSeconds(5), null));

        assertThat(manager.statuses())
                .extracting(StreamStatus::name, StreamStatus::route)
                .containsExactly(tuple("First", "shared"), tuple("No script", "no-script"));

        manager.startAll();

        assertThat(manager.find("no-script")).map(SnapshotStream::isRunning).contains(false);
        assertThat(manager.find("shared")).map(SnapshotStream::isRunning).contains(true);
    }

    @Test
    void duplicateRoutesAreRejected() {
        manager = manager();
        manager.add(new StreamConfig("One", "shared", Duration.ofSeconds(1), tick -> ""));

        assertThatThrownBy(() -> manager.add(new StreamConfig("Two", "shared", Duration.ofSeconds(1), tick -> "")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shared");
    }

    @Test
    void startAndStopByRoute() throws Exception {
        manager = manager();
        manager.add(new StreamConfig("One", "one", Duration.ofHours(1), tick -> "solid(1 1 0 0 0)"));

        assertThat(manager.start("one")).map(StreamStatus::state).contains(StreamState.RUNNING);
        assertThat(manager.stop("one")).map(StreamStatus::state).contains(StreamState.STOPPED);
        assertThat(manager.start("missing")).isEmpty();
        assertThat(manager.stop("missing")).isEmpty();
    }

    @Test
    void startAllKeepsGoingWhenOneStreamIsMisconfigured() {
        manager = manager();
        manager.add(new StreamConfig("Broken", "broken", Duration.ZERO, tick -> "solid(1 1 0 0 0)"));
        manager.add(new StreamConfig("Good", "good", Duration.ofHours(1), tick -> "solid(1 1 0 0 0)"));

        manager.startAll();

        assertThat(manager.statuses())
                .extracting(StreamStatus::route, StreamStatus::state)
                .containsExactly(
                        tuple("broken", StreamState.STOPPED),
                        tuple("good", StreamState.RUNNING));

        manager.stopAll();

        assertThat(manager.statuses()).allMatch(status -> status.state() == StreamState.STOPPED);
    }

    private StreamManager manager(PixelFactoryProperties.StreamDefinition... definitions) {
        PixelFactoryProperties properties = new PixelFactoryProperties(
                new PixelFactoryProperties.Processor(1),
                new PixelFactoryProperties.Admission(1),
                new PixelFactoryProperties.Cache(true, Duration.ofMinutes(2), Duration.ofMinutes(1)),
                new PixelFactoryProperties.Sources(Path.of("."), false),
                new PixelFactoryProperties.Streams(tempDir.resolve("artifacts"), List.of(definitions)));
        StreamFactory factory = config -> new SnapshotStream(
                config,
                properties.streams().baseDir(),
                renderService,
                dispatched::add,
                Clock.systemUTC(),
                new SimpleMeterRegistry());
        return new StreamManager(properties, factory);
    }

    private static PixelFactoryProperties.StreamDefinition definition(
            String name, String route, Duration interval, Path scriptFile) {
        return new PixelFactoryProperties.StreamDefinition(name, route, interval, scriptFile);
    }
}
