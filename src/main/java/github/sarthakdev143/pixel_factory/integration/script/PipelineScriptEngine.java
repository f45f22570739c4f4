package github.sarthakdev143.pixel_factory.integration.script;

import github.sarthakdev143.pixel_factory.blend.BlendRegistry;
import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.model.Rgba;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;
import github.sarthakdev143.pixel_factory.service.ImageLoader;
import github.sarthakdev143.pixel_factory.service.ScriptEngine;
import github.sarthakdev143.pixel_factory.service.ScriptExecutionException;
import github.sarthakdev143.pixel_factory.service.ScriptNormalizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small line-oriented interpreter for pipeline scripts.
 * <p>
 * Each line is either {@code name: expression} or a bare expression. Expressions are
 * string literals, numbers, variable names or calls {@code fn(arg arg ...)} with
 * whitespace-separated arguments. The script result is the {@code img} variable.
 * Lines starting with {@code #} are comments.
 */
@Component
public class PipelineScriptEngine implements ScriptEngine {

    private static final int MAX_SOLID_SIDE = 16_384;
    private static final long MAX_SOLID_PIXELS = 16_777_216L;
    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_-]*)\\s*:(.*)$");

    private final ImageLoader imageLoader;
    private final BlendRegistry blendRegistry;
    private final PixelProcessor pixelProcessor;

    public PipelineScriptEngine(ImageLoader imageLoader, BlendRegistry blendRegistry, PixelProcessor pixelProcessor) {
        this.imageLoader = imageLoader;
        this.blendRegistry = blendRegistry;
        this.pixelProcessor = pixelProcessor;
    }

    @Override
    public PixelImage execute(String script) throws ScriptExecutionException {
        Map<String, Object> variables = new HashMap<>();
        String[] lines = script == null ? new String[0] : script.split("\\R");

        for (int index = 0; index < lines.length; index++) {
            String line = lines[index].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            int lineNumber = index + 1;
            Matcher assignment = ASSIGNMENT.matcher(line);
            if (assignment.matches()) {
                variables.put(assignment.group(1), evaluate(assignment.group(2), variables, lineNumber));
            } else {
                evaluate(line, variables, lineNumber);
            }
        }

        Object result = variables.get(ScriptNormalizer.OUTPUT_VARIABLE);
        if (result == null) {
            throw new ScriptExecutionException("Script did not assign the '" + ScriptNormalizer.OUTPUT_VARIABLE + "' variable.");
        }
        if (!(result instanceof PixelImage image)) {
            throw new ScriptExecutionException("'" + ScriptNormalizer.OUTPUT_VARIABLE + "' must hold an image but holds "
                    + describe(result) + ".");
        }
        return image;
    }

    private Object evaluate(String expression, Map<String, Object> variables, int lineNumber)
            throws ScriptExecutionException {
        Parser parser = new Parser(expression, lineNumber);
        Node node = parser.parseExpression();
        parser.expectEnd();
        return node.evaluate(this, variables, lineNumber);
    }

    Object call(String function, List<Object> args, int lineNumber) throws ScriptExecutionException {
        try {
            return switch (function) {
                case "load" -> {
                    requireArity(function, args, 1, lineNumber);
                    yield imageLoader.load(string(args, 0, function, lineNumber));
                }
                case "solid" -> solid(args, lineNumber);
                case "blend" -> {
                    requireArity(function, args, 3, lineNumber);
                    yield blendRegistry.blendImages(
                            string(args, 0, function, lineNumber),
                            image(args, 1, function, lineNumber),
                            image(args, 2, function, lineNumber));
                }
                case "invert" -> {
                    requireArity(function, args, 1, lineNumber);
                    yield pixelProcessor.process(image(args, 0, function, lineNumber), color -> new Rgba(
                            Rgba.MAX - color.red(),
                            Rgba.MAX - color.green(),
                            Rgba.MAX - color.blue(),
                            color.alpha()));
                }
                case "grayscale" -> {
                    requireArity(function, args, 1, lineNumber);
                    yield pixelProcessor.process(image(args, 0, function, lineNumber), color -> {
                        int gray = Rgba.clamp(Math.round(0.299 * color.red() + 0.587 * color.green() + 0.114 * color.blue()));
                        return new Rgba(gray, gray, gray, color.alpha());
                    });
                }
                case "opacity" -> {
                    requireArity(function, args, 2, lineNumber);
                    double factor = number(args, 1, function, lineNumber);
                    yield pixelProcessor.process(image(args, 0, function, lineNumber), color -> new Rgba(
                            color.red(),
                            color.green(),
                            color.blue(),
                            Rgba.clamp(Math.round(color.alpha() * factor))));
                }
                default -> throw new ScriptExecutionException(at(lineNumber) + "unknown function '" + function + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new ScriptExecutionException(at(lineNumber) + e.getMessage(), e);
        } catch (IOException e) {
            throw new ScriptExecutionException(at(lineNumber) + "failed to load image: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScriptExecutionException(at(lineNumber) + "interrupted while loading image", e);
        }
    }

    private PixelImage solid(List<Object> args, int lineNumber) throws ScriptExecutionException {
        if (args.size() != 5 && args.size() != 6) {
            throw new ScriptExecutionException(at(lineNumber) + "solid expects 5 or 6 arguments but got " + args.size());
        }
        int width = (int) number(args, 0, "solid", lineNumber);
        int height = (int) number(args, 1, "solid", lineNumber);
        if (width < 0 || height < 0 || width > MAX_SOLID_SIDE || height > MAX_SOLID_SIDE) {
            throw new ScriptExecutionException(
                    at(lineNumber) + "solid dimensions must be between 0 and " + MAX_SOLID_SIDE);
        }
        if ((long) width * height > MAX_SOLID_PIXELS) {
            throw new ScriptExecutionException(
                    at(lineNumber) + "solid area " + width + "x" + height + " exceeds " + MAX_SOLID_PIXELS + " pixels");
        }
        int alpha = args.size() == 6 ? (int) number(args, 5, "solid", lineNumber) : 255;
        Rgba color = Rgba.of8Bit(
                (int) number(args, 2, "solid", lineNumber),
                (int) number(args, 3, "solid", lineNumber),
                (int) number(args, 4, "solid", lineNumber),
                alpha);
        return PixelImage.filled(width, height, color);
    }

    private static void requireArity(String function, List<Object> args, int expected, int lineNumber)
            throws ScriptExecutionException {
        if (args.size() != expected) {
            throw new ScriptExecutionException(
                    at(lineNumber) + function + " expects " + expected + " argument(s) but got " + args.size());
        }
    }

    private static String string(List<Object> args, int index, String function, int lineNumber)
            throws ScriptExecutionException {
        if (args.get(index) instanceof String value) {
            return value;
        }
        throw argumentError(function, index, "a string", args.get(index), lineNumber);
    }

    private static double number(List<Object> args, int index, String function, int lineNumber)
            throws ScriptExecutionException {
        if (args.get(index) instanceof Double value) {
            return value;
        }
        throw argumentError(function, index, "a number", args.get(index), lineNumber);
    }

    private static PixelImage image(List<Object> args, int index, String function, int lineNumber)
            throws ScriptExecutionException {
        if (args.get(index) instanceof PixelImage value) {
            return value;
        }
        throw argumentError(function, index, "an image", args.get(index), lineNumber);
    }

    private static ScriptExecutionException argumentError(
            String function, int index, String expected, Object actual, int lineNumber) {
        return new ScriptExecutionException(
                at(lineNumber) + function + " argument " + (index + 1) + " must be " + expected + " but was " + describe(actual));
    }

    private static String describe(Object value) {
        if (value instanceof PixelImage) {
            return "an image";
        }
        if (value instanceof Double) {
            return "a number";
        }
        return "a string";
    }

    private static String at(int lineNumber) {
        return "line " + lineNumber + ": ";
    }

    private interface Node {
        Object evaluate(PipelineScriptEngine engine, Map<String, Object> variables, int lineNumber)
                throws ScriptExecutionException;
    }

    private record Literal(Object value) implements Node {
        @Override
        public Object evaluate(PipelineScriptEngine engine, Map<String, Object> variables, int lineNumber) {
            return value;
        }
    }

    private record Variable(String name) implements Node {
        @Override
        public Object evaluate(PipelineScriptEngine engine, Map<String, Object> variables, int lineNumber)
                throws ScriptExecutionException {
            Object value = variables.get(name);
            if (value == null) {
                throw new ScriptExecutionException(at(lineNumber) + "undefined variable '" + name + "'");
            }
            return value;
        }
    }

    private record Call(String function, List<Node> arguments) implements Node {
        @Override
        public Object evaluate(PipelineScriptEngine engine, Map<String, Object> variables, int lineNumber)
                throws ScriptExecutionException {
            List<Object> values = new ArrayList<>(arguments.size());
            for (Node argument : arguments) {
                values.add(argument.evaluate(engine, variables, lineNumber));
            }
            return engine.call(function, values, lineNumber);
        }
    }

    private static final class Parser {

        private final String text;
        private final int lineNumber;
        private int position;

        Parser(String text, int lineNumber) {
            this.text = text;
            this.lineNumber = lineNumber;
        }

        Node parseExpression() throws ScriptExecutionException {
            skipWhitespace();
            if (atEnd()) {
                throw error("expected an expression");
            }

            char current = text.charAt(position);
            if (current == '"') {
                return new Literal(parseString());
            }
            if (Character.isDigit(current) || current == '-' || current == '.') {
                return new Literal(parseNumber());
            }
            if (Character.isLetter(current) || current == '_') {
                String identifier = parseIdentifier();
                skipWhitespace();
                if (!atEnd() && text.charAt(position) == '(') {
                    position++;
                    return new Call(identifier, parseArguments());
                }
                return new Variable(identifier);
            }
            throw error("unexpected character '" + current + "'");
        }

        void expectEnd() throws ScriptExecutionException {
            skipWhitespace();
            if (!atEnd()) {
                throw error("unexpected trailing input '" + text.substring(position) + "'");
            }
        }

        private List<Node> parseArguments() throws ScriptExecutionException {
            List<Node> arguments = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    throw error("missing ')'");
                }
                if (text.charAt(position) == ')') {
                    position++;
                    return arguments;
                }
                arguments.add(parseExpression());
            }
        }

        private String parseString() throws ScriptExecutionException {
            StringBuilder value = new StringBuilder();
            position++;
            while (!atEnd()) {
                char current = text.charAt(position++);
                if (current == '"') {
                    return value.toString();
                }
                if (current == '\\' && !atEnd()) {
                    value.append(text.charAt(position++));
                } else {
                    value.append(current);
                }
            }
            throw error("unterminated string");
        }

        private double parseNumber() throws ScriptExecutionException {
            int start = position;
            if (text.charAt(position) == '-') {
                position++;
            }
            while (!atEnd() && (Character.isDigit(text.charAt(position)) || text.charAt(position) == '.')) {
                position++;
            }
            String literal = text.substring(start, position);
            try {
                return Double.parseDouble(literal);
            } catch (NumberFormatException e) {
                throw error("invalid number '" + literal + "'");
            }
        }

        private String parseIdentifier() {
            int start = position;
            while (!atEnd()) {
                char current = text.charAt(position);
                if (!Character.isLetterOrDigit(current) && current != '_' && current != '-') {
                    break;
                }
                position++;
            }
            return text.substring(start, position);
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
                position++;
            }
        }

        private boolean atEnd() {
            return position >= text.length();
        }

        private ScriptExecutionException error(String message) {
            return new ScriptExecutionException(at(lineNumber) + message);
        }
    }
}
