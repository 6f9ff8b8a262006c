//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.text;

import java.util.Arrays;

/**
 * Maps character offsets in a text to zero-based line numbers. Lines are terminated by
 * {@code \n}, {@code \r\n} or a lone {@code \r}.
 */
public class LineMap {

  /** Computes the line map for {@code text}. */
  public static LineMap of (CharSequence text) {
    int[] starts = new int[16];
    int count = 1, length = text.length();
    for (int ii = 0; ii < length; ii++) {
      char c = text.charAt(ii);
      if (c == '\n' || c == '\r') {
        if (c == '\r' && ii+1 < length && text.charAt(ii+1) == '\n') ii++;
        if (count == starts.length) starts = Arrays.copyOf(starts, starts.length*2);
        starts[count++] = ii+1;
      }
    }
    return new LineMap(Arrays.copyOf(starts, count), length);
  }

  /** Returns the number of lines. An empty text has one (empty) line. */
  public int lineCount () {
    return _starts.length;
  }

  /** Returns the offset of the first character of line {@code line}. */
  public int lineStart (int line) {
    if (line < 0 || line >= _starts.length) throw new IndexOutOfBoundsException(
      "Line " + line + " not in [0, " + _starts.length + ")");
    return _starts[line];
  }

  /**
   * Returns the zero-based line that contains {@code position}. The position just past the end
   * of the text belongs to the last line.
   */
  public int lineNumber (int position) {
    if (position < 0 || position > _length) throw new IndexOutOfBoundsException(
      "Position " + position + " not in [0, " + _length + "]");
    int idx = Arrays.binarySearch(_starts, position);
    return (idx >= 0) ? idx : -idx - 2;
  }

  private LineMap (int[] starts, int length) {
    _starts = starts;
    _length = length;
  }

  private final int[] _starts;
  private final int _length;
}
