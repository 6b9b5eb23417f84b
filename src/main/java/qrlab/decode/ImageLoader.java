package qrlab.decode;

import qrlab.ImageReadException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Turns uploaded bytes into images. Anything ImageIO cannot read, including empty input, raises
 * {@link ImageReadException} with {@link DecodeResult#UNREADABLE_MESSAGE}.
 */
public final class ImageLoader {

    private static final String DATA_URL_MARKER = ";base64,";

    private ImageLoader() {
    }

    public static BufferedImage read(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE, e);
        }
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE);
        }
        return image;
    }

    /**
     * Accepts plain base64 or a data URL such as {@code data:image/png;base64,iVBOR...}.
     */
    public static BufferedImage readBase64(String encoded) {
        return read(decodeBase64(encoded));
    }

    public static BufferedImage read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE, e);
        }
        return read(bytes);
    }

    static byte[] decodeBase64(String encoded) {
        if (encoded == null) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE);
        }
        var payload = encoded.trim();
        int marker = payload.indexOf(DATA_URL_MARKER);
        if (payload.startsWith("data:") && marker >= 0) {
            payload = payload.substring(marker + DATA_URL_MARKER.length());
        }
        try {
            return Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new ImageReadException(DecodeResult.UNREADABLE_MESSAGE, e);
        }
    }
}
