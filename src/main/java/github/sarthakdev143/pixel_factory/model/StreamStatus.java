package github.sarthakdev143.pixel_factory.model;

import java.time.Duration;
import java.time.Instant;

public record StreamStatus(
        String name,
        String route,
        StreamState state,
        Duration interval,
        long renders,
        long failures,
        long skippedTicks,
        Instant lastRenderAt,
        boolean artifactAvailable) {
}
