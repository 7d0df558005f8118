package nl.adgroot.scanpdf.ocr;

public enum OcrPriority {
  FOREGROUND,
  BACKGROUND
}
