package github.sarthakdev143.pixel_factory.controller;

import github.sarthakdev143.pixel_factory.blend.BlendRegistry;
import github.sarthakdev143.pixel_factory.service.ScriptExecutionException;
import github.sarthakdev143.pixel_factory.service.ScriptNormalizer;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);
    private static final int MAX_SCRIPT_LENGTH = 64 * 1024;

    private final ScriptRenderService renderService;
    private final BlendRegistry blendRegistry;

    public RenderController(ScriptRenderService renderService, BlendRegistry blendRegistry) {
        this.renderService = renderService;
        this.blendRegistry = blendRegistry;
    }

    @PostMapping(value = "/render", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> render(@RequestBody(required = false) String script) {
        try {
            validateScript(script);
            byte[] png = renderService.renderPng(ScriptNormalizer.designateOutput(script));
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .body(png);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (ScriptExecutionException e) {
            return ResponseEntity.badRequest().body("Script failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Render was interrupted.");
        } catch (Exception e) {
            logger.error("Script render failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to render script. Please try again.");
        }
    }

    @GetMapping("/blend-modes")
    public List<String> blendModes() {
        return blendRegistry.names();
    }

    private void validateScript(String script) {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("Script body is required.");
        }
        if (script.length() > MAX_SCRIPT_LENGTH) {
            throw new IllegalArgumentException("Script must be at most " + MAX_SCRIPT_LENGTH + " characters.");
        }
    }
}
