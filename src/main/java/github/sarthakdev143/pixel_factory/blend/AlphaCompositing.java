package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.Rgba;

// Mode colour is interpolated toward the bottom by the top alpha; output alpha is Porter-Duff "over".
final class AlphaCompositing {

    private static final long MAX = Rgba.MAX;

    private AlphaCompositing() {
    }

    static int porterDuffAlpha(int bottomAlpha, int topAlpha) {
        return Rgba.clamp(bottomAlpha + topAlpha - ((long) bottomAlpha * topAlpha / MAX));
    }

    static Rgba blendWithAlpha(Rgba bottom, Rgba top, ColorFormula formula) {
        if (top.isTransparent()) {
            return bottom;
        }

        int[] mixed = formula.mix(bottom, top);
        long red;
        long green;
        long blue;
        if (top.isOpaque()) {
            red = mixed[0];
            green = mixed[1];
            blue = mixed[2];
        } else {
            double alpha = top.alpha() / (double) MAX;
            red = (long) (mixed[0] * alpha + bottom.red() * (1.0 - alpha));
            green = (long) (mixed[1] * alpha + bottom.green() * (1.0 - alpha));
            blue = (long) (mixed[2] * alpha + bottom.blue() * (1.0 - alpha));
        }
        return Rgba.clamped(red, green, blue, porterDuffAlpha(bottom.alpha(), top.alpha()));
    }

    static ColorFormula perChannel(ChannelFormula formula) {
        return (bottom, top) -> new int[]{
                Rgba.clamp(formula.apply(bottom.red(), top.red())),
                Rgba.clamp(formula.apply(bottom.green(), top.green())),
                Rgba.clamp(formula.apply(bottom.blue(), top.blue()))
        };
    }

    @FunctionalInterface
    interface ColorFormula {
        int[] mix(Rgba bottom, Rgba top);
    }

    @FunctionalInterface
    interface ChannelFormula {
        long apply(long bottom, long top);
    }
}
