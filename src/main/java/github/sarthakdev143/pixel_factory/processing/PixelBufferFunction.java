package github.sarthakdev143.pixel_factory.processing;

import github.sarthakdev143.pixel_factory.model.Rgba;

@FunctionalInterface
public interface PixelBufferFunction {

    double apply(Rgba color);
}
