package github.sarthakdev143.pixel_factory.blend;

public class UnknownBlendModeException extends IllegalArgumentException {

    private final String modeName;

    public UnknownBlendModeException(String modeName) {
        super("Unknown blend mode: " + modeName);
        this.modeName = modeName;
    }

    public String modeName() {
        return modeName;
    }
}
