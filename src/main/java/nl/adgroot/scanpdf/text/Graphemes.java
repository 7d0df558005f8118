package nl.adgroot.scanpdf.text;

import com.ibm.icu.text.BreakIterator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User-perceived characters (extended grapheme clusters) of a string. ICU segments emoji
 * ZWJ sequences and flag pairs as single clusters; the JDK 17 iterator does not.
 */
public final class Graphemes {

  private Graphemes() {}

  public static List<String> split(String text) {
    List<String> clusters = new ArrayList<>();
    BreakIterator it = BreakIterator.getCharacterInstance();
    it.setText(text);
    int start = it.first();
    for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
      clusters.add(text.substring(start, end));
    }
    return clusters;
  }

  /** Reverses the order of clusters, keeping each cluster intact. */
  public static String reverse(String text) {
    List<String> clusters = split(text);
    Collections.reverse(clusters);
    return String.join("", clusters);
  }
}
