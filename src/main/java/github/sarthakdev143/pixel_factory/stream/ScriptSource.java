package github.sarthakdev143.pixel_factory.stream;

import java.io.IOException;
import java.time.Instant;

@FunctionalInterface
public interface ScriptSource {

    String scriptAt(Instant tickTime) throws IOException;
}
