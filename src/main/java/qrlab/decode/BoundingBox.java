package qrlab.decode;

/**
 * Axis-aligned pixel rectangle of a symbol in the source image.
 */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (width < 0 || height < 0) throw new IllegalArgumentException("negative size " + width + "x" + height);
    }

    /**
     * Smallest box enclosing the points.
     *
     * @param xs x coordinates
     * @param ys y coordinates, same length as xs
     */
    public static BoundingBox enclosing(float[] xs, float[] ys) {
        if (xs.length == 0 || xs.length != ys.length) {
            throw new IllegalArgumentException("need matching, non-empty coordinate arrays");
        }
        float minX = xs[0], maxX = xs[0], minY = ys[0], maxY = ys[0];
        for (int i = 1; i < xs.length; i++) {
            minX = Math.min(minX, xs[i]);
            maxX = Math.max(maxX, xs[i]);
            minY = Math.min(minY, ys[i]);
            maxY = Math.max(maxY, ys[i]);
        }
        var left = (int) Math.floor(minX);
        var top = (int) Math.floor(minY);
        return new BoundingBox(left, top, (int) Math.ceil(maxX) - left, (int) Math.ceil(maxY) - top);
    }

    /**
     * Scales the box about its centre, keeping the aspect ratio, until its smaller side is at least
     * {@code minSide}. Boxes that are already big enough come back unchanged.
     */
    public BoundingBox expandToMinSide(int minSide) {
        int smaller = Math.min(width, height);
        if (smaller >= minSide) {
            return this;
        }
        double scale = smaller == 0 ? minSide : (double) minSide / smaller;
        int newWidth = (int) Math.ceil(Math.max(width, 1) * scale);
        int newHeight = (int) Math.ceil(Math.max(height, 1) * scale);
        int centerX = x + width / 2;
        int centerY = y + height / 2;
        return new BoundingBox(centerX - newWidth / 2, centerY - newHeight / 2, newWidth, newHeight);
    }

    /** Maps a box found on a resized copy back to the original image. */
    public BoundingBox scale(double factor) {
        return new BoundingBox((int) Math.floor(x * factor), (int) Math.floor(y * factor),
                (int) Math.ceil(width * factor), (int) Math.ceil(height * factor));
    }

    public BoundingBox grow(int margin) {
        return new BoundingBox(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }

    /** Intersection with a {@code width x height} image. */
    public BoundingBox clampTo(int imageWidth, int imageHeight) {
        var left = Math.max(0, x);
        var top = Math.max(0, y);
        var right = Math.min(imageWidth, x + width);
        var bottom = Math.min(imageHeight, y + height);
        return new BoundingBox(left, top, Math.max(0, right - left), Math.max(0, bottom - top));
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
