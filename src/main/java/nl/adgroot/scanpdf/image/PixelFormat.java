package nl.adgroot.scanpdf.image;

public enum PixelFormat {
  BW1,
  GRAY8,
  RGB24,
  ARGB32
}
