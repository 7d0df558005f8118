package nl.adgroot.scanpdf.image;

public enum BitDepth {
  COLOR,
  GRAYSCALE,
  BLACK_WHITE
}
