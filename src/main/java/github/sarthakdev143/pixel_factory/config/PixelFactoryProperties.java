package github.sarthakdev143.pixel_factory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "pixel-factory")
public record PixelFactoryProperties(
        @DefaultValue Processor processor,
        @DefaultValue Admission admission,
        @DefaultValue Cache cache,
        @DefaultValue Sources sources,
        @DefaultValue Streams streams) {

    // 0 workers or slots means derive from the CPU count
    public record Processor(@DefaultValue("0") int workers) {
    }

    public record Admission(@DefaultValue("0") int maxConcurrent) {
    }

    public record Cache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("2m") Duration ttl,
            @DefaultValue("1m") Duration sweepInterval) {
    }

    public record Sources(
            @DefaultValue(".") Path root,
            @DefaultValue("false") boolean allowRemote) {
    }

    public record Streams(
            @DefaultValue("artifacts") Path baseDir,
            List<StreamDefinition> definitions) {

        public Streams {
            definitions = definitions == null ? List.of() : List.copyOf(definitions);
        }
    }

    public record StreamDefinition(
            String name,
            String route,
            Duration interval,
            Path scriptFile) {
    }
}
