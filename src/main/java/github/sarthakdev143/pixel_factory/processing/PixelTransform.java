package github.sarthakdev143.pixel_factory.processing;

import github.sarthakdev143.pixel_factory.model.Rgba;

// Called from several worker threads at once, so it must not share mutable state.
@FunctionalInterface
public interface PixelTransform {

    Rgba apply(Rgba color);
}
