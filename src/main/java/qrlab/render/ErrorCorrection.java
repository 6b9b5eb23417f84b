package qrlab.render;

import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

public enum ErrorCorrection implements StyleOption {
    L(ErrorCorrectionLevel.L),
    M(ErrorCorrectionLevel.M),
    Q(ErrorCorrectionLevel.Q),
    H(ErrorCorrectionLevel.H);

    private final ErrorCorrectionLevel level;

    ErrorCorrection(ErrorCorrectionLevel level) {
        this.level = level;
    }

    public ErrorCorrectionLevel level() {
        return level;
    }

    @Override
    public String wireName() {
        return name();
    }
}
