package qrlab.decode;

/**
 * Which decoder produced a symbol.
 */
public enum EngineKind {
    /** ZXing multi-reader, reports finder pattern geometry */
    ZXING,
    /** OpenCV contour search for the three finder patterns, clip decoded separately */
    FINDER_PATTERN,
    /** OpenCV QRCodeDetector */
    OPENCV
}
