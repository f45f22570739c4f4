package github.sarthakdev143.pixel_factory.stream;

import github.sarthakdev143.pixel_factory.model.StreamState;
import github.sarthakdev143.pixel_factory.model.StreamStatus;
import github.sarthakdev143.pixel_factory.service.ScriptNormalizer;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically renders a script into {@code <base-dir>/<sha256(name)>/latest.png}.
 * <p>
 * The ticker thread only dispatches; renders run on the render executor. At most one
 * render per stream is in flight, ticks arriving while it runs are dropped. A failed
 * render leaves the previous artifact in place.
 */
public class SnapshotStream {

    public static final String ARTIFACT_FILE_NAME = "latest.png";

    private static final Logger logger = LoggerFactory.getLogger(SnapshotStream.class);

    private final StreamConfig config;
    private final Path artifactDirectory;
    private final Path artifactPath;
    private final ScriptRenderService renderService;
    private final TaskExecutor renderExecutor;
    private final Clock clock;
    private final AtomicBoolean renderInFlight = new AtomicBoolean();
    private final AtomicLong renders = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter skippedTickCounter;
    private volatile Instant lastRenderAt;
    private ScheduledExecutorService ticker;

    public SnapshotStream(
            StreamConfig config,
            Path baseDirectory,
            ScriptRenderService renderService,
            TaskExecutor renderExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.artifactDirectory = artifactDirectory(baseDirectory, config.name());
        this.artifactPath = artifactDirectory.resolve(ARTIFACT_FILE_NAME);
        this.renderService = renderService;
        this.renderExecutor = renderExecutor;
        this.clock = clock;
        this.successCounter = meterRegistry.counter(
                "pixel_factory.stream.renders", "stream", config.name(), "outcome", "success");
        this.failureCounter = meterRegistry.counter(
                "pixel_factory.stream.renders", "stream", config.name(), "outcome", "failure");
        this.skippedTickCounter = meterRegistry.counter(
                "pixel_factory.stream.skipped_ticks", "stream", config.name());
    }

    public static Path artifactDirectory(Path baseDirectory, String streamName) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(streamName.getBytes(StandardCharsets.UTF_8));
            return baseDirectory.resolve(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public synchronized void start() throws IOException {
        if (ticker != null) {
            return;
        }
        if (config.scriptSource() == null) {
            throw new IllegalStateException("Stream '" + config.name() + "': script source must be provided.");
        }
        Duration interval = config.interval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("Stream '" + config.name() + "': interval must be greater than zero.");
        }

        Files.createDirectories(artifactDirectory);

        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stream-ticker-" + config.route());
            thread.setDaemon(true);
            return thread;
        });
        ticker.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Started stream {} on /streams/{} every {}", config.name(), config.route(), interval);
    }

    public synchronized void stop() {
        if (ticker == null) {
            return;
        }
        ticker.shutdownNow();
        ticker = null;
        logger.info("Stopped stream {}", config.name());
    }

    public synchronized boolean isRunning() {
        return ticker != null;
    }

    public StreamConfig config() {
        return config;
    }

    public Path artifactPath() {
        return artifactPath;
    }

    public Optional<byte[]> readArtifact() throws IOException {
        try {
            return Optional.of(Files.readAllBytes(artifactPath));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    public StreamStatus status() {
        return new StreamStatus(
                config.name(),
                config.route(),
                isRunning() ? StreamState.RUNNING : StreamState.STOPPED,
                config.interval(),
                renders.get(),
                failures.get(),
                skippedTicks.get(),
                lastRenderAt,
                Files.isRegularFile(artifactPath));
    }

    boolean tick() {
        if (!renderInFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            skippedTickCounter.increment();
            logger.debug("Stream {} still rendering, skipping tick", config.name());
            return false;
        }

        try {
            renderExecutor.execute(this::renderOnce);
            return true;
        } catch (RejectedExecutionException e) {
            renderInFlight.set(false);
            logger.warn("Render executor rejected stream {} tick", config.name(), e);
            return false;
        }
    }

    void renderOnce() {
        try {
            String script = config.scriptSource().scriptAt(clock.instant());
            if (script == null || script.isBlank()) {
                logger.debug("Stream {} produced an empty script, nothing to render", config.name());
                return;
            }

            renderService.renderToFile(ScriptNormalizer.designateOutput(script), artifactPath);
            lastRenderAt = clock.instant();
            renders.incrementAndGet();
            successCounter.increment();
            notifyListener();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Stream {} render interrupted", config.name());
        } catch (Exception e) {
            failures.incrementAndGet();
            failureCounter.increment();
            logger.warn("Stream {} render failed, keeping previous artifact: {}", config.name(), e.getMessage());
            logger.debug("Stream {} render failure", config.name(), e);
        } finally {
            renderInFlight.set(false);
        }
    }

    private void notifyListener() {
        ArtifactListener listener = config.onArtifact();
        if (listener == null) {
            return;
        }
        try {
            listener.onArtifact(config.name(), artifactPath);
        } catch (RuntimeException e) {
            logger.error("Artifact listener for stream {} failed", config.name(), e);
        }
    }
}
