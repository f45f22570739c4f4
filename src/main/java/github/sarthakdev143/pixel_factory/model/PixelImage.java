package github.sarthakdev143.pixel_factory.model;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.util.Arrays;

/**
 * A fixed-size raster of non-premultiplied 16-bit RGBA pixels.
 * <p>
 * Dimensions are set at construction and never change. Every read and write is
 * bounds-checked. Instances are not thread-safe for concurrent writes to the same
 * pixel; the pixel processor only ever lets one task write a given row.
 */
public final class PixelImage {

    private static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final short[] pixels;

    public PixelImage(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = new short[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)];
    }

    private PixelImage(int width, int height, short[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public static PixelImage filled(int width, int height, Rgba color) {
        PixelImage image = new PixelImage(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, color);
            }
        }
        return image;
    }

    public static PixelImage fromBufferedImage(BufferedImage source) {
        PixelImage image = new PixelImage(source.getWidth(), source.getHeight());
        if (isSixteenBitComponentImage(source)) {
            copySixteenBitSamples(source.getRaster(), image);
            return image;
        }

        for (int y = 0; y < image.height; y++) {
            for (int x = 0; x < image.width; x++) {
                int argb = source.getRGB(x, y);
                image.set(x, y, Rgba.of8Bit(
                        (argb >> 16) & 0xff,
                        (argb >> 8) & 0xff,
                        argb & 0xff,
                        (argb >>> 24) & 0xff));
            }
        }
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public Rgba get(int x, int y) {
        int offset = offset(x, y);
        return new Rgba(
                pixels[offset] & 0xffff,
                pixels[offset + 1] & 0xffff,
                pixels[offset + 2] & 0xffff,
                pixels[offset + 3] & 0xffff);
    }

    public void set(int x, int y, Rgba color) {
        int offset = offset(x, y);
        pixels[offset] = (short) color.red();
        pixels[offset + 1] = (short) color.green();
        pixels[offset + 2] = (short) color.blue();
        pixels[offset + 3] = (short) color.alpha();
    }

    public PixelImage copy() {
        return new PixelImage(width, height, pixels.clone());
    }

    public BufferedImage toBufferedImage() {
        BufferedImage target = new BufferedImage(Math.max(width, 1), Math.max(height, 1), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int offset = offset(x, y);
                int argb = (to8Bit(pixels[offset + 3]) << 24)
                        | (to8Bit(pixels[offset]) << 16)
                        | (to8Bit(pixels[offset + 1]) << 8)
                        | to8Bit(pixels[offset + 2]);
                target.setRGB(x, y, argb);
            }
        }
        return target;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PixelImage image)) {
            return false;
        }
        return width == image.width && height == image.height && Arrays.equals(pixels, image.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelImage[" + width + "x" + height + "]";
    }

    private int offset(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException(
                    "Pixel (" + x + "," + y + ") is outside image bounds " + width + "x" + height);
        }
        return (y * width + x) * CHANNELS;
    }

    private static int to8Bit(short channel) {
        return ((channel & 0xffff) * 255 + 32767) / 65535;
    }

    private static boolean isSixteenBitComponentImage(BufferedImage source) {
        ColorModel colorModel = source.getColorModel();
        Raster raster = source.getRaster();
        if (raster.getTransferType() != DataBuffer.TYPE_USHORT || colorModel.isAlphaPremultiplied()) {
            return false;
        }
        int bands = raster.getNumBands();
        int colorSpaceType = colorModel.getColorSpace().getType();
        boolean rgb = colorSpaceType == ColorSpace.TYPE_RGB && (bands == 3 || bands == 4);
        boolean gray = colorSpaceType == ColorSpace.TYPE_GRAY && (bands == 1 || bands == 2);
        return rgb || gray;
    }

    private static void copySixteenBitSamples(Raster raster, PixelImage target) {
        int bands = raster.getNumBands();
        int[] sample = new int[bands];
        for (int y = 0; y < target.height; y++) {
            for (int x = 0; x < target.width; x++) {
                raster.getPixel(x, y, sample);
                Rgba color = switch (bands) {
                    case 1 -> new Rgba(sample[0], sample[0], sample[0], Rgba.MAX);
                    case 2 -> new Rgba(sample[0], sample[0], sample[0], sample[1]);
                    case 3 -> new Rgba(sample[0], sample[1], sample[2], Rgba.MAX);
                    default -> new Rgba(sample[0], sample[1], sample[2], sample[3]);
                };
                target.set(x, y, color);
            }
        }
    }
}
