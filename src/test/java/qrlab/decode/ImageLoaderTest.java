package qrlab.decode;

import org.junit.jupiter.api.Test;
import qrlab.ImageReadException;
import qrlab.TestImages;

import java.awt.Color;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class ImageLoaderTest {

    private final byte[] png = TestImages.png(TestImages.solid(30, 20, Color.RED));

    @Test
    void testReadPng() {
        var image = ImageLoader.read(png);
        assertEquals(30, image.getWidth());
        assertEquals(20, image.getHeight());
    }

    @Test
    void testReadBase64_plainAndDataUrl() {
        var encoded = Base64.getEncoder().encodeToString(png);
        assertEquals(30, ImageLoader.readBase64(encoded).getWidth());
        assertEquals(30, ImageLoader.readBase64("data:image/png;base64," + encoded).getWidth());
    }

    @Test
    void testGarbageIsUnreadable() {
        var e = assertThrows(ImageReadException.class,
                () -> ImageLoader.read("definitely not an image".getBytes(StandardCharsets.UTF_8)));
        assertEquals(DecodeResult.UNREADABLE_MESSAGE, e.getMessage());
    }

    @Test
    void testEmptyAndNullAreUnreadable() {
        assertThrows(ImageReadException.class, () -> ImageLoader.read(new byte[0]));
        assertThrows(ImageReadException.class, () -> ImageLoader.read((byte[]) null));
        assertThrows(ImageReadException.class, () -> ImageLoader.readBase64("%%%not base64%%%"));
    }
}
