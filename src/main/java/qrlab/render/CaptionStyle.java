package qrlab.render;

public record CaptionStyle(String text, String color, int size, TextPosition position) {
}
