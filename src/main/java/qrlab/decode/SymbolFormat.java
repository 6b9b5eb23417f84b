package qrlab.decode;

public enum SymbolFormat {
    QR,
    OTHER
}
