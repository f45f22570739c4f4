package github.sarthakdev143.pixel_factory.integration.source;

import github.sarthakdev143.pixel_factory.cache.DecodeCache;
import github.sarthakdev143.pixel_factory.config.PixelFactoryProperties;
import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.service.ImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

@Component
public class DefaultImageLoader implements ImageLoader {

    private static final Logger logger = LoggerFactory.getLogger(DefaultImageLoader.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final DecodeCache decodeCache;
    private final Path sourceRoot;
    private final boolean allowRemote;
    private final HttpClient httpClient;

    @Autowired
    public DefaultImageLoader(DecodeCache decodeCache, PixelFactoryProperties properties) {
        this(decodeCache, properties.sources(), HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    DefaultImageLoader(DecodeCache decodeCache, PixelFactoryProperties.Sources sources, HttpClient httpClient) {
        this.decodeCache = decodeCache;
        this.sourceRoot = sources.root().toAbsolutePath().normalize();
        this.allowRemote = sources.allowRemote();
        this.httpClient = httpClient;
    }

    @Override
    public PixelImage load(String source) throws IOException, InterruptedException {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Image source is required.");
        }

        String key = source.strip();
        boolean remote = isRemote(key);
        Path localPath = null;
        if (remote) {
            if (!allowRemote) {
                throw new IllegalArgumentException("Remote image sources are disabled: " + key);
            }
        } else {
            localPath = resolveLocal(key);
        }

        Optional<PixelImage> cached = decodeCache.get(key);
        if (cached.isPresent()) {
            decodeCache.updateTimestamp(key);
            return cached.get();
        }

        byte[] data = remote ? download(key) : Files.readAllBytes(localPath);
        PixelImage image = decode(key, data);
        decodeCache.put(key, image);
        logger.debug("Decoded {} from {}", image, key);
        return image;
    }

    static boolean isRemote(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private Path resolveLocal(String source) throws IOException {
        Path path = sourceRoot.resolve(source).toAbsolutePath().normalize();
        if (!path.startsWith(sourceRoot)) {
            throw new IllegalArgumentException("Image source is outside the allowed root: " + source);
        }
        // symlinks must not lead out of the root either
        if (Files.exists(path) && !path.toRealPath().startsWith(sourceRoot.toRealPath())) {
            throw new IllegalArgumentException("Image source is outside the allowed root: " + source);
        }
        return path;
    }

    private byte[] download(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() != 200) {
            throw new IOException("Failed to download image '" + url + "': status " + response.statusCode());
        }
        return response.body();
    }

    private PixelImage decode(String source, byte[] data) throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(data));
        if (decoded == null) {
            throw new IOException("Unsupported image format or corrupted file: " + source);
        }
        return PixelImage.fromBufferedImage(decoded);
    }
}
