package github.sarthakdev143.pixel_factory.stream;

import github.sarthakdev143.pixel_factory.admission.RenderAdmissionController;
import github.sarthakdev143.pixel_factory.blend.BlendRegistry;
import github.sarthakdev143.pixel_factory.cache.DecodeCache;
import github.sarthakdev143.pixel_factory.config.PixelFactoryProperties;
import github.sarthakdev143.pixel_factory.controller.SnapshotController;
import github.sarthakdev143.pixel_factory.integration.script.PipelineScriptEngine;
import github.sarthakdev143.pixel_factory.integration.source.DefaultImageLoader;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;
import github.sarthakdev143.pixel_factory.service.impl.DefaultScriptRenderService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SnapshotServingTest {

    @TempDir
    Path tempDir;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private PixelProcessor processor;
    private DecodeCache decodeCache;
    private StreamManager manager;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        processor = new PixelProcessor(2);
        decodeCache = new DecodeCache(DecodeCache.DEFAULT_TTL, Clock.systemUTC(), meterRegistry);
        PixelFactoryProperties properties = new PixelFactoryProperties(
                new PixelFactoryProperties.Processor(2),
                new PixelFactoryProperties.Admission(1),
                new PixelFactoryProperties.Cache(true, Duration.ofMinutes(2), Duration.ofMinutes(1)),
                new PixelFactoryProperties.Sources(tempDir, false),
                new PixelFactoryProperties.Streams(tempDir.resolve("artifacts"), List.of()));

        PipelineScriptEngine engine = new PipelineScriptEngine(
                new DefaultImageLoader(decodeCache, properties),
                BlendRegistry.withDefaults(processor),
                processor);
        DefaultScriptRenderService renderService =
                new DefaultScriptRenderService(engine, new RenderAdmissionController(1), meterRegistry);

        manager = new StreamManager(properties, config -> new SnapshotStream(
                config,
                properties.streams().baseDir(),
                renderService,
                new SyncTaskExecutor(),
                Clock.systemUTC(),
                meterRegistry));
        mockMvc = MockMvcBuilders.standaloneSetup(new SnapshotController(manager)).build();
    }

    @AfterEach
    void tearDown() {
        manager.stopAll();
        decodeCache.close();
        processor.close();
    }

    @Test
    void servesRenderedArtifactOnceTheFirstRenderCompletes() throws Exception {
        SnapshotStream stream = manager.add(new StreamConfig(
                "Status board", "board", Duration.ofHours(1), tick -> "solid(3 2 0 255 0)"));

        mockMvc.perform(get("/streams/board"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("no image available"));

        stream.renderOnce();

        MvcResult result = mockMvc.perform(get("/streams/board"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"))
                .andReturn();

        BufferedImage png = ImageIO.read(new ByteArrayInputStream(result.getResponse().getContentAsByteArray()));
        assertThat(png).isNotNull();
        assertThat(png.getWidth()).isEqualTo(3);
        assertThat(png.getHeight()).isEqualTo(2);
        assertThat(png.getRGB(2, 1)).isEqualTo(0xff00ff00);
        assertThat(stream.status().renders()).isEqualTo(1);
        assertThat(stream.artifactPath()).isRegularFile();
    }

    @Test
    void failedRenderKeepsServingThePreviousArtifact() throws Exception {
        String[] script = {"solid(1 1 255 0 0)"};
        SnapshotStream stream = manager.add(new StreamConfig(
                "Flaky", "flaky", Duration.ofHours(1), tick -> script[0]));

        stream.renderOnce();
        byte[] first = mockMvc.perform(get("/streams/flaky"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsByteArray();

        script[0] = "invert(nothing)";
        stream.renderOnce();

        mockMvc.perform(get("/streams/flaky"))
                .andExpect(status().isOk())
                .andExpect(content().bytes(first));
        assertThat(stream.status().failures()).isEqualTo(1);
    }
}
