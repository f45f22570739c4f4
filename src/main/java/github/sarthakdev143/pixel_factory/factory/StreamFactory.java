package github.sarthakdev143.pixel_factory.factory;

import github.sarthakdev143.pixel_factory.stream.SnapshotStream;
import github.sarthakdev143.pixel_factory.stream.StreamConfig;

public interface StreamFactory {

    SnapshotStream create(StreamConfig config);
}
