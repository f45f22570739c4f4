package github.sarthakdev143.pixel_factory.model;

public enum StreamState {
    STOPPED,
    RUNNING
}
