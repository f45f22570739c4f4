package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.Rgba;
import github.sarthakdev143.pixel_factory.processing.PixelBlendFunction;

import static github.sarthakdev143.pixel_factory.blend.AlphaCompositing.blendWithAlpha;
import static github.sarthakdev143.pixel_factory.blend.AlphaCompositing.perChannel;
import static github.sarthakdev143.pixel_factory.blend.AlphaCompositing.porterDuffAlpha;

public final class BlendModes {

    public static final String NORMAL = "normal";
    public static final String ERASE = "erase";
    public static final String MULTIPLY = "multiply";
    public static final String SCREEN = "screen";
    public static final String EXCLUSION = "exclusion";
    public static final String OVERLAY = "overlay";
    public static final String COLOR_BURN = "color-burn";
    public static final String COLOR_DODGE = "color-dodge";
    public static final String SOFT_LIGHT = "soft-light";
    public static final String HARD_LIGHT = "hard-light";
    public static final String DIFFERENCE = "difference";
    public static final String SUBTRACT = "subtract";
    public static final String DIVIDE = "divide";
    public static final String HUE = "hue";
    public static final String SATURATION = "saturation";
    public static final String COLOR = "color";
    public static final String LUMINOSITY = "luminosity";
    public static final String AVERAGE = "average";
    public static final String NEGATION = "negation";
    public static final String REFLECT = "reflect";
    public static final String GLOW = "glow";
    public static final String CONTRAST_NEGATE = "contrast-negate";
    public static final String VIVID_LIGHT = "vivid-light";
    public static final String LINEAR_LIGHT = "linear-light";
    public static final String PIN_LIGHT = "pin-light";
    public static final String DARKEN = "darken";
    public static final String DARKER_COLOR = "darker-color";
    public static final String LIGHTEN = "lighten";
    public static final String LIGHTER_COLOR = "lighter-color";
    public static final String HARD_MIX = "hard-mix";

    private static final long MAX = Rgba.MAX;
    private static final long HALF = 0x8000;

    private BlendModes() {
    }

    static void registerAll(BlendRegistry registry) {
        registry.register(NORMAL, BlendModes::normal);
        registry.register(ERASE, BlendModes::erase);
        registry.register(MULTIPLY, channelMode((b, t) -> b * t / MAX));
        registry.register(SCREEN, channelMode((b, t) -> MAX - (MAX - b) * (MAX - t) / MAX));
        registry.register(EXCLUSION, channelMode((b, t) -> b + t - ((b * t) >> 15)));
        registry.register(OVERLAY, channelMode((b, t) -> b < HALF
                ? 2 * b * t / MAX
                : MAX - 2 * (MAX - b) * (MAX - t) / MAX));
        registry.register(COLOR_BURN, channelMode(BlendModes::colorBurn));
        registry.register(COLOR_DODGE, channelMode(BlendModes::colorDodge));
        registry.register(SOFT_LIGHT, channelMode(BlendModes::softLight));
        registry.register(HARD_LIGHT, channelMode((b, t) -> t < HALF
                ? 2 * b * t / MAX
                : MAX - 2 * (MAX - b) * (MAX - t) / MAX));
        registry.register(DIFFERENCE, channelMode((b, t) -> Math.abs(b - t)));
        registry.register(SUBTRACT, channelMode((b, t) -> Math.max(b - t, 0)));
        registry.register(DIVIDE, channelMode((b, t) -> t > 0 ? Math.min(b * MAX / t, MAX) : 0));
        registry.register(HUE, hslMode((bottom, top) -> new Hsl(top.hue(), bottom.saturation(), bottom.lightness())));
        registry.register(SATURATION, hslMode((bottom, top) -> new Hsl(bottom.hue(), top.saturation(), bottom.lightness())));
        registry.register(COLOR, hslMode((bottom, top) -> new Hsl(top.hue(), top.saturation(), bottom.lightness())));
        registry.register(LUMINOSITY, hslMode((bottom, top) -> new Hsl(bottom.hue(), bottom.saturation(), top.lightness())));
        registry.register(AVERAGE, channelMode((b, t) -> (b + t) / 2));
        registry.register(NEGATION, channelMode((b, t) -> MAX - Math.abs(MAX - b - t)));
        registry.register(REFLECT, channelMode((b, t) -> t == MAX ? MAX : Math.min(b * b / (MAX - t), MAX)));
        registry.register(GLOW, channelMode((b, t) -> b == MAX ? MAX : Math.min(t * t / (MAX - b), MAX)));
        registry.register(CONTRAST_NEGATE, colorMode(BlendModes::contrastNegate));
        registry.register(VIVID_LIGHT, channelMode(BlendModes::vividLight));
        registry.register(LINEAR_LIGHT, channelMode((b, t) -> b + 2 * t - MAX));
        registry.register(PIN_LIGHT, channelMode((b, t) -> t < HALF
                ? Math.min(b, 2 * t)
                : Math.max(b, 2 * (t - HALF))));
        registry.register(DARKEN, channelMode(Math::min));
        registry.register(DARKER_COLOR, colorMode((bottom, top) -> luminance(bottom) < luminance(top)
                ? rgb(bottom)
                : rgb(top)));
        registry.register(LIGHTEN, channelMode(Math::max));
        registry.register(LIGHTER_COLOR, colorMode((bottom, top) -> luminance(bottom) > luminance(top)
                ? rgb(bottom)
                : rgb(top)));
        registry.register(HARD_MIX, channelMode((b, t) -> vividLight(b, t) >= HALF ? MAX : 0));
    }

    private static Rgba normal(Rgba bottom, Rgba top) {
        long inverseTopAlpha = MAX - top.alpha();
        long topAlpha = top.alpha();
        return Rgba.clamped(
                (top.red() * topAlpha + bottom.red() * inverseTopAlpha) / MAX,
                (top.green() * topAlpha + bottom.green() * inverseTopAlpha) / MAX,
                (top.blue() * topAlpha + bottom.blue() * inverseTopAlpha) / MAX,
                porterDuffAlpha(bottom.alpha(), top.alpha()));
    }

    private static Rgba erase(Rgba bottom, Rgba top) {
        long inverseTopAlpha = MAX - top.alpha();
        return Rgba.clamped(
                bottom.red() * inverseTopAlpha / MAX,
                bottom.green() * inverseTopAlpha / MAX,
                bottom.blue() * inverseTopAlpha / MAX,
                bottom.alpha() * inverseTopAlpha / MAX);
    }

    private static long colorBurn(long b, long t) {
        if (t == MAX) {
            return b;
        }
        if (t == 0) {
            return 0;
        }
        return Math.max(MAX - (MAX - b) * MAX / t, 0);
    }

    private static long colorDodge(long b, long t) {
        if (t == 0) {
            return b;
        }
        if (t == MAX) {
            return MAX;
        }
        return Math.min(b * MAX / (MAX - t), MAX);
    }

    private static long softLight(long bottom, long top) {
        double b = bottom / (double) MAX;
        double t = top / (double) MAX;
        double result = t < 0.5
                ? b - (1 - 2 * t) * b * (1 - b)
                : b + (2 * t - 1) * (Math.sqrt(b) - b);
        return (long) (result * MAX);
    }

    private static long vividLight(long b, long t) {
        if (t < HALF) {
            if (t == 0) {
                return 0;
            }
            return Math.max(MAX - (MAX - b) * HALF / t, 0);
        }
        if (t == MAX) {
            return MAX;
        }
        return Math.min(b * HALF / (MAX - t), MAX);
    }

    private static int[] contrastNegate(Rgba bottom, Rgba top) {
        long topLuminance = ((long) top.red() + top.green() + top.blue()) / 3;
        long bottomLuminance = ((long) bottom.red() + bottom.green() + bottom.blue()) / 3;

        boolean keepTop = topLuminance > HALF ? bottomLuminance < HALF : bottomLuminance > HALF;
        if (keepTop) {
            return rgb(top);
        }
        return new int[]{Rgba.MAX - top.red(), Rgba.MAX - top.green(), Rgba.MAX - top.blue()};
    }

    private static long luminance(Rgba color) {
        return (color.red() * 299L + color.green() * 587L + color.blue() * 114L) / 1000;
    }

    private static int[] rgb(Rgba color) {
        return new int[]{color.red(), color.green(), color.blue()};
    }

    private static PixelBlendFunction channelMode(AlphaCompositing.ChannelFormula formula) {
        AlphaCompositing.ColorFormula colorFormula = perChannel(formula);
        return (bottom, top) -> blendWithAlpha(bottom, top, colorFormula);
    }

    private static PixelBlendFunction colorMode(AlphaCompositing.ColorFormula formula) {
        return (bottom, top) -> blendWithAlpha(bottom, top, formula);
    }

    private static PixelBlendFunction hslMode(HslSwap swap) {
        return colorMode((bottom, top) -> swap.apply(
                        Hsl.fromRgb(bottom.red(), bottom.green(), bottom.blue()),
                        Hsl.fromRgb(top.red(), top.green(), top.blue()))
                .toRgb());
    }

    @FunctionalInterface
    private interface HslSwap {
        Hsl apply(Hsl bottom, Hsl top);
    }
}
