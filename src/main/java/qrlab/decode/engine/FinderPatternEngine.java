package qrlab.decode.engine;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.utils.Converters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.decode.BoundingBox;
import qrlab.decode.DecodedSymbol;
import qrlab.decode.EngineKind;
import qrlab.decode.ImagePreprocessor;
import qrlab.decode.MatConversions;
import qrlab.decode.OpenCvLoader;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

/**
 * Fallback engine. Looks for the three nested-square finder patterns with OpenCV contours, straightens the
 * symbol with a perspective transform and hands the clip to a {@link ClipDecoder}.
 *
 * <p>Reports the rectangle spanned by the finder patterns. Only one symbol per image.
 */
public class FinderPatternEngine implements BarcodeEngine {
    private static final Logger log = LoggerFactory.getLogger(FinderPatternEngine.class);

    private static final int HIERARCHY_IDX_FIRST_CHILD = 2;
    /** nested contours inside a finder pattern edge map, four levels would also catch noisier prints */
    private static final int MARKER_MIN_CHILDREN = 5;

    /** distance between the warped finder centres */
    private static final double CLIP_SPAN = 200;
    /** space kept around the warped finder centres so the quiet zone survives */
    private static final double CLIP_OFFSET = 80;

    private final ClipDecoder clipDecoder;
    private final ImagePreprocessor preprocessor;

    /**
     * @param clipDecoder  decodes each straightened candidate
     * @param preprocessor source of edge maps and debug dumps
     */
    public FinderPatternEngine(ClipDecoder clipDecoder, ImagePreprocessor preprocessor) {
        this.clipDecoder = clipDecoder;
        this.preprocessor = preprocessor;
    }

    public FinderPatternEngine() {
        this(new ZxingClipDecoder(), new ImagePreprocessor());
    }

    @Override
    public List<DecodedSymbol> decode(BufferedImage image) {
        var gray = preprocessor.grayscale(MatConversions.toBgrMat(image));
        var symbol = scan(gray, preprocessor.finderEdges(gray, false));
        // no finder patterns on the raw edges, threshold first and look again
        if (symbol == null) {
            log.debug("no finder patterns, retry with threshold");
            symbol = scan(gray, preprocessor.finderEdges(gray, true));
        }
        return symbol == null ? List.of() : List.of(symbol);
    }

    private DecodedSymbol scan(Mat src, Mat edges) {
        var hierarchy = new Mat();
        var contours = new ArrayList<MatOfPoint>();
        Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_TREE, Imgproc.CHAIN_APPROX_NONE);

        // text and other dense glyphs also nest deeply, so group by depth and only try groups of plausible size
        var countMarkerMap = new HashMap<Integer, List<MatOfPoint>>();
        for (int i = 0; i < contours.size(); i++) {
            var contour = contours.get(i);
            var rect = Imgproc.minAreaRect(new MatOfPoint2f(contour.toArray()));
            if (testSquare(rect)) {
                var hierarchyArray = hierarchy.get(0, i);
                int count = 0;
                while ((int) hierarchyArray[HIERARCHY_IDX_FIRST_CHILD] != -1) {
                    count++;
                    hierarchyArray = hierarchy.get(0, (int) hierarchyArray[HIERARCHY_IDX_FIRST_CHILD]);
                }
                if (count >= MARKER_MIN_CHILDREN) {
                    countMarkerMap.computeIfAbsent(count, k -> new ArrayList<>()).add(contour);
                }
            }
        }
        for (var markerContours : countMarkerMap.values()) {
            var markerCount = markerContours.size();
            // fewer than three cannot be a symbol, more than five is mostly noise or several symbols
            if (markerCount >= 3 && markerCount <= 5) {
                var symbol = cutImage(src, markerContours);
                if (symbol != null) {
                    return symbol;
                }
            }
        }
        return null;
    }

    private DecodedSymbol cutImage(Mat src, List<MatOfPoint> contours) {
        int size = contours.size();
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                for (int k = j + 1; k < size; k++) {
                    var markers = new RotatedRect[]{
                        markerRect(contours.get(i)),
                        markerRect(contours.get(j)),
                        markerRect(contours.get(k))
                    };
                    Point[] points = {markers[0].center, markers[1].center, markers[2].center};

                    if (testTriangle(points)) {
                        var p0 = points[0];
                        var p1 = points[1];
                        var p2 = points[2];
                        // fourth corner of the parallelogram, opposite the right angle
                        var p3 = new Point(p1.x + p2.x - p0.x, p2.y + p1.y - p0.y);

                        var target = List.of(
                                new Point(CLIP_OFFSET, CLIP_OFFSET),
                                new Point(CLIP_OFFSET + CLIP_SPAN, CLIP_OFFSET),
                                new Point(CLIP_OFFSET, CLIP_OFFSET + CLIP_SPAN),
                                new Point(CLIP_OFFSET + CLIP_SPAN, CLIP_OFFSET + CLIP_SPAN)
                        );
                        var transform = Imgproc.getPerspectiveTransform(
                                Converters.vector_Point_to_Mat(Arrays.asList(p0, p1, p2, p3), CvType.CV_32F),
                                Converters.vector_Point_to_Mat(target, CvType.CV_32F)
                        );
                        var clipSide = CLIP_SPAN + CLIP_OFFSET * 2;
                        var warped = new Mat();
                        Imgproc.warpPerspective(src, warped, transform, new Size(clipSide, clipSide),
                                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(255));
                        preprocessor.dump(String.format("cutImage-match_%d-%d-%d", i, j, k), warped);

                        var text = clipDecoder.decode(MatConversions.toBufferedImage(warped));
                        if (text != null) {
                            var box = rectangle(new Point[]{p0, p1, p2, p3}, markers)
                                    .clampTo(src.cols(), src.rows());
                            return DecodedSymbol.qr(text, box, EngineKind.FINDER_PATTERN);
                        }
                    }
                }
            }
        }
        return null;
    }

    /** Axis-aligned box of the four corner centres, widened by half a marker. */
    private BoundingBox rectangle(Point[] corners, RotatedRect[] markers) {
        var xs = new float[corners.length];
        var ys = new float[corners.length];
        for (int i = 0; i < corners.length; i++) {
            xs[i] = (float) corners[i].x;
            ys[i] = (float) corners[i].y;
        }
        double halfMarker = 0;
        for (var marker : markers) {
            halfMarker = Math.max(halfMarker, Math.max(marker.size.width, marker.size.height) / 2);
        }
        return BoundingBox.enclosing(xs, ys).grow((int) Math.ceil(halfMarker));
    }

    private RotatedRect markerRect(MatOfPoint matOfPoint) {
        return Imgproc.minAreaRect(new MatOfPoint2f(matOfPoint.toArray()));
    }

    /** rect is roughly square */
    private boolean testSquare(RotatedRect rect) {
        final double SQUARE_SCALE_MAX = 1.2;
        final double SQUARE_SCALE_MIN = 1 / 1.2;

        var rectRatio = rect.size.width / rect.size.height;
        return rectRatio > SQUARE_SCALE_MIN
                && rectRatio < SQUARE_SCALE_MAX;
    }

    /**
     * The three points form a roughly isosceles right triangle.
     * On success the array is rotated so that points[0] is the right angle and (points[1], points[2]) the hypotenuse.
     */
    static boolean testTriangle(Point[] points) {
        var p0 = points[0];
        var p1 = points[1];
        var p2 = points[2];

        // squared side lengths
        var l01 = pow2(p0.x - p1.x) + pow2(p0.y - p1.y);
        if (l01 == 0) {
            return false;
        }
        var l12 = pow2(p1.x - p2.x) + pow2(p1.y - p2.y);
        if (l12 == 0) {
            return false;
        }
        var l20 = pow2(p2.x - p0.x) + pow2(p2.y - p0.y);
        if (l20 == 0) {
            return false;
        }

        double[] lines = {l01, l12, l20};
        Arrays.sort(lines);
        var lA = lines[0];
        var lC = lines[2];
        var ratioCA = lC / lA;
        // 2.3104 = (2 sin 50°)², the apex angle may not exceed 100°
        // 1.6384 = (2 sin 40°)², nor drop below 80°
        if (ratioCA > 2.3104 || ratioCA < 1.6384) {
            return false;
        }

        if (l01 > l12 && l01 > l20) {
            points[0] = p2;
            points[1] = p0;
            points[2] = p1;
        } else if (l20 > l01 && l20 > l12) {
            points[0] = p1;
            points[1] = p2;
            points[2] = p0;
        }
        return true;
    }

    private static double pow2(double val) {
        return val * val;
    }

    @Override
    public EngineKind kind() {
        return EngineKind.FINDER_PATTERN;
    }

    @Override
    public boolean isAvailable() {
        return OpenCvLoader.isAvailable();
    }
}
