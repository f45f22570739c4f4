package github.sarthakdev143.pixel_factory.stream;

import java.time.Duration;

public record StreamConfig(
        String name,
        String route,
        Duration interval,
        ScriptSource scriptSource,
        ArtifactListener onArtifact) {

    public StreamConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stream name is required.");
        }
        if (route == null || route.isBlank()) {
            throw new IllegalArgumentException("Stream route is required.");
        }
        route = route.strip();
        if (route.contains("/")) {
            throw new IllegalArgumentException("Stream route must be a single path segment but was '" + route + "'.");
        }
    }

    public StreamConfig(String name, String route, Duration interval, ScriptSource scriptSource) {
        this(name, route, interval, scriptSource, null);
    }
}
