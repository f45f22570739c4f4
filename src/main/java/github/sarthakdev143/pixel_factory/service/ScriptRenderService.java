package github.sarthakdev143.pixel_factory.service;

import github.sarthakdev143.pixel_factory.model.PixelImage;

import java.io.IOException;
import java.nio.file.Path;

public interface ScriptRenderService {

    PixelImage render(String script) throws ScriptExecutionException, InterruptedException;

    byte[] renderPng(String script) throws ScriptExecutionException, IOException, InterruptedException;

    // Replaces target atomically: readers see either the previous PNG or the new one.
    void renderToFile(String script, Path target) throws ScriptExecutionException, IOException, InterruptedException;
}
