package github.sarthakdev143.pixel_factory.service;

import java.util.Arrays;
import java.util.List;

public final class ScriptNormalizer {

    public static final String OUTPUT_VARIABLE = "img";
    private static final String OUTPUT_PREFIX = OUTPUT_VARIABLE + ":";

    private ScriptNormalizer() {
    }

    public static String designateOutput(String script) {
        if (script == null) {
            return "";
        }

        List<String> lines = Arrays.asList(script.strip().split("\\R", -1));
        int index = lines.size() - 1;
        while (index >= 0 && lines.get(index).isBlank()) {
            index--;
        }
        if (index >= 0) {
            String last = lines.get(index).strip();
            if (!last.startsWith(OUTPUT_PREFIX)) {
                lines.set(index, OUTPUT_PREFIX + last);
            }
        }
        return String.join("\n", lines);
    }
}
