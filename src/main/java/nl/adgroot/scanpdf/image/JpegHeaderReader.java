package nl.adgroot.scanpdf.image;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.jetbrains.annotations.Nullable;

/**
 * Reads the SOF and JFIF APP0 segments of a JPEG stream.
 */
public final class JpegHeaderReader {

  private static final int SOI = 0xD8;
  private static final int SOS = 0xDA;
  private static final int EOI = 0xD9;
  private static final int APP0 = 0xE0;

  private JpegHeaderReader() {
    // utility class
  }

  @Nullable
  public static JpegHeader read(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    }
  }

  /**
   * @return the header, or {@code null} if the stream is not a JPEG or ends before a frame header
   */
  @Nullable
  public static JpegHeader read(InputStream stream) throws IOException {
    DataInputStream in = new DataInputStream(new BufferedInputStream(stream));
    try {
      if (in.readUnsignedByte() != 0xFF || in.readUnsignedByte() != SOI) {
        return null;
      }

      double hDpi = 0;
      double vDpi = 0;

      for (;;) {
        int b = in.readUnsignedByte();
        if (b != 0xFF) {
          return null;
        }
        int marker = in.readUnsignedByte();
        while (marker == 0xFF) {
          marker = in.readUnsignedByte(); // fill bytes
        }

        if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) {
          continue; // standalone markers, no length
        }
        if (marker == SOS || marker == EOI) {
          return null;
        }

        int length = in.readUnsignedShort();
        if (length < 2) {
          return null;
        }

        if (isStartOfFrame(marker)) {
          in.readUnsignedByte(); // precision
          int height = in.readUnsignedShort();
          int width = in.readUnsignedShort();
          int components = in.readUnsignedByte();
          return new JpegHeader(width, height, components, hDpi, vDpi);
        }

        if (marker == APP0 && length >= 14) {
          byte[] data = new byte[length - 2];
          in.readFully(data);
          if (data[0] == 'J' && data[1] == 'F' && data[2] == 'I' && data[3] == 'F' && data[4] == 0) {
            int units = data[7] & 0xFF;
            int xDensity = ((data[8] & 0xFF) << 8) | (data[9] & 0xFF);
            int yDensity = ((data[10] & 0xFF) << 8) | (data[11] & 0xFF);
            if (units == 1) {
              hDpi = xDensity;
              vDpi = yDensity;
            } else if (units == 2) {
              hDpi = xDensity * 2.54;
              vDpi = yDensity * 2.54;
            }
          }
          continue;
        }

        skipFully(in, length - 2);
      }
    } catch (EOFException e) {
      return null;
    }
  }

  private static boolean isStartOfFrame(int marker) {
    // C4 (DHT), C8 (JPG) and CC (DAC) share the range but are not frame headers
    return marker >= 0xC0 && marker <= 0xCF && marker != 0xC4 && marker != 0xC8 && marker != 0xCC;
  }

  private static void skipFully(DataInputStream in, int n) throws IOException {
    int remaining = n;
    while (remaining > 0) {
      int skipped = in.skipBytes(remaining);
      if (skipped <= 0) {
        throw new EOFException();
      }
      remaining -= skipped;
    }
  }
}
