package github.sarthakdev143.pixel_factory.blend;

public class DuplicateBlendModeException extends IllegalStateException {

    public DuplicateBlendModeException(String modeName) {
        super(modeName + " is already registered");
    }
}
