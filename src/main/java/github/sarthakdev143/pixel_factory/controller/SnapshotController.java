package github.sarthakdev143.pixel_factory.controller;

import github.sarthakdev143.pixel_factory.dto.StreamCommandResponse;
import github.sarthakdev143.pixel_factory.model.StreamStatus;
import github.sarthakdev143.pixel_factory.stream.SnapshotStream;
import github.sarthakdev143.pixel_factory.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

@RestController
public class SnapshotController {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotController.class);
    private static final String NO_IMAGE = "no image available";

    private final StreamManager streamManager;

    public SnapshotController(StreamManager streamManager) {
        this.streamManager = streamManager;
    }

    @GetMapping("/streams/{route}")
    public ResponseEntity<?> snapshot(@PathVariable String route) {
        Optional<SnapshotStream> stream = streamManager.find(route);
        if (stream.isEmpty()) {
            return notFound();
        }

        try {
            Optional<byte[]> artifact = stream.get().readArtifact();
            if (artifact.isEmpty()) {
                return notFound();
            }
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                    .header(HttpHeaders.PRAGMA, "no-cache")
                    .header(HttpHeaders.EXPIRES, "0")
                    .body(artifact.get());
        } catch (IOException e) {
            logger.error("Failed to read artifact for stream route {}", route, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Failed to read snapshot. Please try again.");
        }
    }

    @GetMapping("/api/streams")
    public List<StreamStatus> streams() {
        return streamManager.statuses();
    }

    @PostMapping("/api/streams/{route}/start")
    public ResponseEntity<?> start(@PathVariable String route) {
        try {
            return streamManager.start(route)
                    .<ResponseEntity<?>>map(status -> ResponseEntity.ok(
                            new StreamCommandResponse(route, status.state(), "Stream started.")))
                    .orElseGet(() -> streamNotFound(route));
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to start stream route {}", route, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start stream. Please try again.");
        }
    }

    @PostMapping("/api/streams/{route}/stop")
    public ResponseEntity<?> stop(@PathVariable String route) {
        return streamManager.stop(route)
                .<ResponseEntity<?>>map(status -> ResponseEntity.ok(
                        new StreamCommandResponse(route, status.state(), "Stream stopped.")))
                .orElseGet(() -> streamNotFound(route));
    }

    private static ResponseEntity<?> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.TEXT_PLAIN)
                .body(NO_IMAGE);
    }

    private static ResponseEntity<?> streamNotFound(String route) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Stream not found for route: " + route);
    }
}
