package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.model.Rgba;
import github.sarthakdev143.pixel_factory.processing.PixelBlendFunction;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;

public class Blender {

    private final String name;
    private final PixelBlendFunction function;
    private final PixelProcessor processor;

    public Blender(String name, PixelBlendFunction function, PixelProcessor processor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Blend mode name is required.");
        }
        if (function == null) {
            throw new IllegalArgumentException("Blend function is required for " + name + ".");
        }
        this.name = name;
        this.function = function;
        this.processor = processor;
    }

    public String name() {
        return name;
    }

    public Rgba color(Rgba bottom, Rgba top) {
        return function.blend(bottom, top);
    }

    public PixelImage pixel(int x, int y, PixelImage bottom, PixelImage top) {
        Rgba topColor = top.contains(x, y) ? top.get(x, y) : Rgba.TRANSPARENT;
        bottom.set(x, y, function.blend(bottom.get(x, y), topColor));
        return bottom;
    }

    public PixelImage images(PixelImage bottom, PixelImage top) {
        return processor.applyInto(bottom, top, function);
    }
}
