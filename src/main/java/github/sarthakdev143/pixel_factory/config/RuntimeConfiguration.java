package github.sarthakdev143.pixel_factory.config;

import github.sarthakdev143.pixel_factory.admission.RenderAdmissionController;
import github.sarthakdev143.pixel_factory.blend.BlendRegistry;
import github.sarthakdev143.pixel_factory.cache.DecodeCache;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PixelFactoryProperties.class)
public class RuntimeConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public PixelProcessor pixelProcessor(PixelFactoryProperties properties) {
        int workers = properties.processor().workers();
        PixelProcessor processor = new PixelProcessor(workers > 0 ? workers : PixelProcessor.defaultWorkerCount());
        logger.info("Pixel processor using {} workers", processor.workers());
        return processor;
    }

    @Bean
    public BlendRegistry blendRegistry(PixelProcessor pixelProcessor) {
        return BlendRegistry.withDefaults(pixelProcessor);
    }

    @Bean(destroyMethod = "close")
    public DecodeCache decodeCache(PixelFactoryProperties properties, Clock clock, MeterRegistry meterRegistry) {
        PixelFactoryProperties.Cache settings = properties.cache();
        DecodeCache cache = new DecodeCache(settings.ttl(), clock, meterRegistry);
        if (!settings.enabled()) {
            cache.disable();
        }
        cache.startSweeper(settings.sweepInterval());
        return cache;
    }

    @Bean
    public RenderAdmissionController renderAdmissionController(PixelFactoryProperties properties) {
        int configured = properties.admission().maxConcurrent();
        int maxConcurrent = configured > 0 ? configured : RenderAdmissionController.defaultMaxConcurrent();
        logger.info("Allowing {} concurrent script renders", maxConcurrent);
        return new RenderAdmissionController(maxConcurrent);
    }
}
