package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.Rgba;

// Components in [0, 1].
record Hsl(double hue, double saturation, double lightness) {

    static Hsl fromRgb(int red, int green, int blue) {
        double r = red / (double) Rgba.MAX;
        double g = green / (double) Rgba.MAX;
        double b = blue / (double) Rgba.MAX;

        double max = Math.max(Math.max(r, g), b);
        double min = Math.min(Math.min(r, g), b);
        double lightness = (max + min) / 2;
        if (max == min) {
            return new Hsl(0, 0, lightness);
        }

        double delta = max - min;
        double saturation = lightness > 0.5 ? delta / (2 - max - min) : delta / (max + min);
        double hue;
        if (max == r) {
            hue = (g - b) / delta + (g < b ? 6 : 0);
        } else if (max == g) {
            hue = (b - r) / delta + 2;
        } else {
            hue = (r - g) / delta + 4;
        }
        return new Hsl(hue / 6, saturation, lightness);
    }

    int[] toRgb() {
        if (saturation == 0) {
            int gray = toChannel(lightness);
            return new int[]{gray, gray, gray};
        }

        double q = lightness < 0.5 ? lightness * (1 + saturation) : lightness + saturation - lightness * saturation;
        double p = 2 * lightness - q;
        return new int[]{
                toChannel(hueToComponent(p, q, hue + 1.0 / 3.0)),
                toChannel(hueToComponent(p, q, hue)),
                toChannel(hueToComponent(p, q, hue - 1.0 / 3.0))
        };
    }

    private static double hueToComponent(double p, double q, double t) {
        if (t < 0) {
            t += 1;
        }
        if (t > 1) {
            t -= 1;
        }
        if (t < 1.0 / 6.0) {
            return p + (q - p) * 6 * t;
        }
        if (t < 1.0 / 2.0) {
            return q;
        }
        if (t < 2.0 / 3.0) {
            return p + (q - p) * (2.0 / 3.0 - t) * 6;
        }
        return p;
    }

    private static int toChannel(double component) {
        return Rgba.clamp(Math.round(component * Rgba.MAX));
    }
}
