package github.sarthakdev143.pixel_factory.stream;

import java.nio.file.Path;

@FunctionalInterface
public interface ArtifactListener {

    void onArtifact(String streamName, Path artifact);
}
