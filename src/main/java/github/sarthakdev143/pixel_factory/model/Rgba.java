package github.sarthakdev143.pixel_factory.model;

public record Rgba(int red, int green, int blue, int alpha) {

    public static final int MAX = 0xffff;
    public static final Rgba TRANSPARENT = new Rgba(0, 0, 0, 0);

    public Rgba {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
        checkChannel("alpha", alpha);
    }

    public static Rgba clamped(long red, long green, long blue, long alpha) {
        return new Rgba(clamp(red), clamp(green), clamp(blue), clamp(alpha));
    }

    public static Rgba of8Bit(int red, int green, int blue, int alpha) {
        return clamped(red * 257L, green * 257L, blue * 257L, alpha * 257L);
    }

    public static int clamp(long value) {
        if (value < 0) {
            return 0;
        }
        return value > MAX ? MAX : (int) value;
    }

    public boolean isOpaque() {
        return alpha == MAX;
    }

    public boolean isTransparent() {
        return alpha == 0;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > MAX) {
            throw new IllegalArgumentException(name + " channel must be between 0 and " + MAX + " but was " + value);
        }
    }
}
