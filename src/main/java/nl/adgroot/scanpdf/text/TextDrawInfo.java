package nl.adgroot.scanpdf.text;

/**
 * Where and how large to draw one OCR element, in PDF points with a top-left origin.
 * {@code x}/{@code y} is the top-left corner of the measured text after centering it in its box.
 */
public record TextDrawInfo(
    String text,
    int fontSize,
    float x,
    float y,
    float width,
    float height,
    float textWidth,
    float textHeight,
    float ascent
) {}
