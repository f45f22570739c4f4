package github.sarthakdev143.pixel_factory.service;

import github.sarthakdev143.pixel_factory.model.PixelImage;

import java.io.IOException;

public interface ImageLoader {

    PixelImage load(String source) throws IOException, InterruptedException;
}
