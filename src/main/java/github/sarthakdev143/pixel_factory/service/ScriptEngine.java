package github.sarthakdev143.pixel_factory.service;

import github.sarthakdev143.pixel_factory.model.PixelImage;

public interface ScriptEngine {

    PixelImage execute(String script) throws ScriptExecutionException;
}
