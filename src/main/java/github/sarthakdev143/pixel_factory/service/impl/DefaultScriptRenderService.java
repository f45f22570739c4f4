package github.sarthakdev143.pixel_factory.service.impl;

import github.sarthakdev143.pixel_factory.admission.AdmissionPermit;
import github.sarthakdev143.pixel_factory.admission.RenderAdmissionController;
import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.service.ScriptEngine;
import github.sarthakdev143.pixel_factory.service.ScriptExecutionException;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Service
public class DefaultScriptRenderService implements ScriptRenderService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultScriptRenderService.class);

    private final ScriptEngine scriptEngine;
    private final RenderAdmissionController admissionController;
    private final Counter renderFailureCounter;

    public DefaultScriptRenderService(
            ScriptEngine scriptEngine,
            RenderAdmissionController admissionController,
            MeterRegistry meterRegistry) {
        this.scriptEngine = scriptEngine;
        this.admissionController = admissionController;
        this.renderFailureCounter = meterRegistry.counter("pixel_factory.render.failures");
    }

    @Override
    public PixelImage render(String script) throws ScriptExecutionException, InterruptedException {
        if (script == null || script.isBlank()) {
            throw new ScriptExecutionException("Script must not be empty.");
        }

        long startedAt = System.nanoTime();
        try (AdmissionPermit permit = admissionController.acquire()) {
            PixelImage image = scriptEngine.execute(script);
            if (image == null) {
                throw new ScriptExecutionException("Script produced no image.");
            }
            logger.debug(
                    "Rendered {} in {} ms ({} of {} render slots in use)",
                    image,
                    (System.nanoTime() - startedAt) / 1_000_000,
                    admissionController.running(),
                    admissionController.maxConcurrent());
            return image;
        } catch (ScriptExecutionException | RuntimeException e) {
            renderFailureCounter.increment();
            throw e;
        }
    }

    @Override
    public byte[] renderPng(String script) throws ScriptExecutionException, IOException, InterruptedException {
        return encodePng(render(script));
    }

    @Override
    public void renderToFile(String script, Path target) throws ScriptExecutionException, IOException, InterruptedException {
        byte[] png = renderPng(script);

        Path absoluteTarget = target.toAbsolutePath();
        Path directory = absoluteTarget.getParent();
        Files.createDirectories(directory);

        Path tempFile = Files.createTempFile(directory, "." + absoluteTarget.getFileName(), ".tmp");
        try {
            Files.write(tempFile, png);
            moveIntoPlace(tempFile, absoluteTarget);
        } finally {
            deleteTempFile(tempFile);
        }
    }

    static byte[] encodePng(PixelImage image) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        if (!ImageIO.write(image.toBufferedImage(), "png", output)) {
            throw new IOException("No PNG writer available.");
        }
        return output.toByteArray();
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTempFile(Path filePath) {
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
