package github.sarthakdev143.pixel_factory.factory.impl;

import github.sarthakdev143.pixel_factory.config.PixelFactoryProperties;
import github.sarthakdev143.pixel_factory.factory.StreamFactory;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import github.sarthakdev143.pixel_factory.stream.SnapshotStream;
import github.sarthakdev143.pixel_factory.stream.StreamConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class DefaultStreamFactory implements StreamFactory {

    private final PixelFactoryProperties properties;
    private final ScriptRenderService renderService;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public DefaultStreamFactory(
            PixelFactoryProperties properties,
            ScriptRenderService renderService,
            TaskExecutor taskExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.renderService = renderService;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public SnapshotStream create(StreamConfig config) {
        return new SnapshotStream(
                config,
                properties.streams().baseDir(),
                renderService,
                taskExecutor,
                clock,
                meterRegistry);
    }
}
