package github.sarthakdev143.pixel_factory.config;

import github.sarthakdev143.pixel_factory.service.ScriptNormalizer;
import github.sarthakdev143.pixel_factory.service.ScriptRenderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
@Order(1)
public class CommandLineRenderRunner implements ApplicationRunner {

    static final String SCRIPT_OPTION = "script";
    static final String OUTPUT_OPTION = "output";

    private static final Logger logger = LoggerFactory.getLogger(CommandLineRenderRunner.class);

    private final ScriptRenderService renderService;

    public CommandLineRenderRunner(ScriptRenderService renderService) {
        this.renderService = renderService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption(SCRIPT_OPTION)) {
            return;
        }

        Path scriptFile = Path.of(singleValue(args, SCRIPT_OPTION));
        Path output = Path.of(singleValue(args, OUTPUT_OPTION));
        String script = Files.readString(scriptFile, StandardCharsets.UTF_8);

        long startedAt = System.nanoTime();
        renderService.renderToFile(ScriptNormalizer.designateOutput(script), output);
        logger.info(
                "Rendered {} to {} in {} ms",
                scriptFile,
                output.toAbsolutePath(),
                (System.nanoTime() - startedAt) / 1_000_000);
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Exactly one --" + option + "=<file> value is required.");
        }
        return values.get(0);
    }
}
