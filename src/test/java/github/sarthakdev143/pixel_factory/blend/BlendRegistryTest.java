package github.sarthakdev143.pixel_factory.blend;

import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.model.Rgba;
import github.sarthakdev143.pixel_factory.processing.PixelProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlendRegistryTest {

    private static final int MAX = Rgba.MAX;

    private PixelProcessor processor;
    private BlendRegistry registry;

    @BeforeEach
    void setUp() {
        processor = new PixelProcessor(3);
        registry = BlendRegistry.withDefaults(processor);
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    @Test
    void defaultsRegisterAllThirtyModesInSortedOrder() {
        assertThat(registry.names())
                .hasSize(30)
                .isSorted()
                .contains(BlendModes.NORMAL, BlendModes.ERASE, BlendModes.HARD_MIX, BlendModes.LUMINOSITY);
    }

    @Test
    void registeringAnExistingNameFails() {
        assertThatThrownBy(() -> registry.register(BlendModes.MULTIPLY, (bottom, top) -> top))
                .isInstanceOf(DuplicateBlendModeException.class)
                .hasMessage("multiply is already registered");
    }

    @Test
    void customModesCanBeRegisteredAndLookedUp() {
        registry.register("keep-top", (bottom, top) -> top);

        assertThat(registry.contains("keep-top")).isTrue();
        assertThat(registry.lookup("keep-top").name()).isEqualTo("keep-top");
    }

    @Test
    void unknownModeIsAnExplicitError() {
        assertThatThrownBy(() -> registry.lookup("sparkle"))
                .isInstanceOf(UnknownBlendModeException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown blend mode: sparkle");
        assertThatThrownBy(() -> registry.blendColor("sparkle", Rgba.TRANSPARENT, Rgba.TRANSPARENT))
                .isInstanceOf(UnknownBlendModeException.class);
    }

    @Test
    void transparentTopKeepsBottomInEveryMode() {
        Rgba bottom = new Rgba(12_000, 40_000, 65_000, 30_000);
        Rgba top = new Rgba(50_000, 1_000, 7_000, 0);

        for (String name : registry.names()) {
            assertThat(registry.blendColor(name, bottom, top)).as(name).isEqualTo(bottom);
        }
    }

    @Test
    void opaqueTopUsesFormulaResult() {
        Rgba bottom = new Rgba(MAX, 32_768, 0, MAX);
        Rgba top = new Rgba(32_768, MAX, MAX, MAX);

        assertThat(registry.blendColor(BlendModes.MULTIPLY, bottom, top))
                .isEqualTo(new Rgba(32_768, 32_768, 0, MAX));
        assertThat(registry.blendColor(BlendModes.NORMAL, bottom, top)).isEqualTo(top);
    }

    @Test
    void outputAlphaIsPorterDuffOver() {
        Rgba bottom = new Rgba(MAX, MAX, MAX, 32_768);
        Rgba top = new Rgba(0, 0, 0, 32_768);

        assertThat(registry.blendColor(BlendModes.MULTIPLY, bottom, top).alpha()).isEqualTo(49_152);
    }

    @Test
    void subtractClampsAtZero() {
        Rgba bottom = new Rgba(1_000, 30_000, 0, MAX);
        Rgba top = new Rgba(5_000, 10_000, 0, MAX);

        assertThat(registry.blendColor(BlendModes.SUBTRACT, bottom, top))
                .isEqualTo(new Rgba(0, 20_000, 0, MAX));
    }

    @Test
    void differenceWithItselfIsBlack() {
        Rgba color = new Rgba(11_111, 22_222, 33_333, MAX);

        assertThat(registry.blendColor(BlendModes.DIFFERENCE, color, color)).isEqualTo(new Rgba(0, 0, 0, MAX));
    }

    @Test
    void screenWithWhiteIsWhite() {
        Rgba bottom = new Rgba(100, 20_000, 60_000, MAX);
        Rgba white = new Rgba(MAX, MAX, MAX, MAX);

        assertThat(registry.blendColor(BlendModes.SCREEN, bottom, white)).isEqualTo(white);
    }

    @Test
    void saturationFromGrayTopDesaturatesBottom() {
        Rgba red = new Rgba(MAX, 0, 0, MAX);
        Rgba gray = new Rgba(20_000, 20_000, 20_000, MAX);

        assertThat(registry.blendColor(BlendModes.SATURATION, red, gray))
                .isEqualTo(new Rgba(32_768, 32_768, 32_768, MAX));
    }

    @Test
    void hslModesKeepAColourBlendedWithItself() {
        Rgba color = new Rgba(12_345, 40_000, 61_234, MAX);

        for (String mode : new String[]{BlendModes.HUE, BlendModes.SATURATION, BlendModes.COLOR, BlendModes.LUMINOSITY}) {
            assertThat(registry.blendColor(mode, color, color)).as(mode).isEqualTo(color);
        }
    }

    @Test
    void eraseRemovesCoverage() {
        Rgba bottom = new Rgba(MAX, MAX, MAX, MAX);
        Rgba opaqueTop = new Rgba(0, 0, 0, MAX);

        assertThat(registry.blendColor(BlendModes.ERASE, bottom, opaqueTop)).isEqualTo(Rgba.TRANSPARENT);
    }

    @Test
    void blendImagesLeavesInputsUntouched() {
        PixelImage bottom = PixelImage.filled(5, 7, new Rgba(MAX, MAX, MAX, MAX));
        PixelImage top = PixelImage.filled(5, 7, new Rgba(0, MAX, 0, MAX));
        PixelImage bottomBefore = bottom.copy();
        PixelImage topBefore = top.copy();

        PixelImage result = registry.blendImages(BlendModes.MULTIPLY, bottom, top);

        assertThat(bottom).isEqualTo(bottomBefore);
        assertThat(top).isEqualTo(topBefore);
        assertThat(result).isNotSameAs(bottom);
        assertThat(result.get(4, 6)).isEqualTo(new Rgba(0, MAX, 0, MAX));
    }

    @Test
    void blendImagesKeepsBottomSizeWhenTopIsSmaller() {
        PixelImage bottom = PixelImage.filled(6, 6, new Rgba(MAX, 0, 0, MAX));
        PixelImage top = PixelImage.filled(2, 2, new Rgba(0, 0, MAX, MAX));

        PixelImage result = registry.blendImages(BlendModes.NORMAL, bottom, top);

        assertThat(result.width()).isEqualTo(6);
        assertThat(result.height()).isEqualTo(6);
        assertThat(result.get(0, 0)).isEqualTo(new Rgba(0, 0, MAX, MAX));
        assertThat(result.get(5, 5)).isEqualTo(new Rgba(MAX, 0, 0, MAX));
    }

    @Test
    void blendPixelChangesOnlyTheTargetPixelOfBottom() {
        PixelImage bottom = PixelImage.filled(3, 3, new Rgba(MAX, MAX, MAX, MAX));
        PixelImage top = PixelImage.filled(3, 3, new Rgba(0, 0, 0, MAX));

        registry.blendPixel(BlendModes.NORMAL, 1, 2, bottom, top);

        assertThat(bottom.get(1, 2)).isEqualTo(new Rgba(0, 0, 0, MAX));
        assertThat(bottom.get(0, 0)).isEqualTo(new Rgba(MAX, MAX, MAX, MAX));
    }

    @Test
    void blendPixelOutsideBottomIsOutOfBounds() {
        PixelImage bottom = new PixelImage(2, 2);
        PixelImage top = new PixelImage(4, 4);

        assertThatThrownBy(() -> registry.blendPixel(BlendModes.NORMAL, 3, 3, bottom, top))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
