package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.model.Rgba;
import github.sarthakdev143.pixel_factory.processing.PixelBlendFunction;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class BlendRegistry {

    private final PixelProcessor processor;
    private final Map<String, Blender> blenders = new ConcurrentHashMap<>();

    public BlendRegistry(PixelProcessor processor) {
        this.processor = processor;
    }

    public static BlendRegistry withDefaults(PixelProcessor processor) {
        BlendRegistry registry = new BlendRegistry(processor);
        BlendModes.registerAll(registry);
        return registry;
    }

    public Blender register(String name, PixelBlendFunction function) {
        Blender blender = new Blender(name, function, processor);
        if (blenders.putIfAbsent(name, blender) != null) {
            throw new DuplicateBlendModeException(name);
        }
        return blender;
    }

    public Blender lookup(String name) {
        Blender blender = name == null ? null : blenders.get(name);
        if (blender == null) {
            throw new UnknownBlendModeException(name);
        }
        return blender;
    }

    public boolean contains(String name) {
        return name != null && blenders.containsKey(name);
    }

    public List<String> names() {
        return blenders.keySet().stream().sorted().toList();
    }

    public Rgba blendColor(String name, Rgba bottom, Rgba top) {
        return lookup(name).color(bottom, top);
    }

    public PixelImage blendPixel(String name, int x, int y, PixelImage bottom, PixelImage top) {
        return lookup(name).pixel(x, y, bottom, top);
    }

    public PixelImage blendImages(String name, PixelImage bottom, PixelImage top) {
        Blender blender = lookup(name);
        return blender.images(bottom.copy(), top);
    }
}
