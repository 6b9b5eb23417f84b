package qrlab.render;

import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.*;

class ColorMaskTest {

    private final Color fill = new Color(100, 200, 50);

    @Test
    void testDarken() {
        assertEquals(new Color(70, 140, 35), ColorMask.darken(fill, 0.3));
    }

    @Test
    void testSolid() {
        var mask = ColorMask.of(ColorMaskType.SOLID, fill);
        assertEquals(fill, mask.colorAt(0, 0, 100, 100));
        assertEquals(fill, mask.colorAt(99, 99, 100, 100));
    }

    @Test
    void testHorizontalGradient() {
        var mask = ColorMask.of(ColorMaskType.HORIZONTAL_GRADIENT, fill);
        assertEquals(fill, mask.colorAt(0, 50, 100, 100));
        assertEquals(new Color(70, 140, 35), mask.colorAt(100, 50, 100, 100));
        assertEquals(new Color(85, 170, 42), mask.colorAt(50, 0, 100, 100));
    }

    @Test
    void testVerticalGradient() {
        var mask = ColorMask.of(ColorMaskType.VERTICAL_GRADIENT, fill);
        assertEquals(fill, mask.colorAt(80, 0, 100, 100));
        assertEquals(new Color(70, 140, 35), mask.colorAt(0, 100, 100, 100));
    }

    @Test
    void testRadialAndSquareStartAtCentre() {
        assertEquals(fill, ColorMask.of(ColorMaskType.RADIAL_GRADIENT, fill).colorAt(50, 50, 100, 100));
        assertEquals(fill, ColorMask.of(ColorMaskType.SQUARE_GRADIENT, fill).colorAt(50, 50, 100, 100));
        assertEquals(new Color(70, 140, 35), ColorMask.of(ColorMaskType.SQUARE_GRADIENT, fill).colorAt(0, 50, 100, 100));
    }
}
