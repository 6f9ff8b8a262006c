//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

/**
 * Escapes the three characters that are reserved in method markup text and attribute values:
 * {@code <}, {@code >} and {@code &}. Nothing else is touched, not even quotes.
 */
public class Escaping {

  /** Appends {@code text} to {@code out}, escaping reserved characters. */
  public static void appendEncoded (StringBuilder out, String text) {
    int length = text.length(), start = 0;
    for (int ii = 0; ii < length; ii++) {
      String encoding = encodingFor(text.charAt(ii));
      if (encoding != null) {
        if (ii > start) out.append(text, start, ii);
        out.append(encoding);
        start = ii + 1;
      }
    }
    if (length > start) out.append(text, start, length);
  }

  /** Returns {@code text} with reserved characters escaped. */
  public static String encode (String text) {
    StringBuilder sb = new StringBuilder(text.length() + 16);
    appendEncoded(sb, text);
    return sb.toString();
  }

  /** Reverses {@link #encode}. Ampersands that do not start one of the three escapes are left
    * alone. */
  public static String decode (String text) {
    int amp = text.indexOf('&');
    if (amp == -1) return text;
    StringBuilder sb = new StringBuilder(text.length());
    int start = 0;
    while (amp != -1) {
      sb.append(text, start, amp);
      int next = amp + 1;
      if (text.startsWith(LT, amp)) { sb.append('<'); next = amp + LT.length(); }
      else if (text.startsWith(GT, amp)) { sb.append('>'); next = amp + GT.length(); }
      else if (text.startsWith(AMP, amp)) { sb.append('&'); next = amp + AMP.length(); }
      else sb.append('&');
      start = next;
      amp = text.indexOf('&', start);
    }
    sb.append(text, start, text.length());
    return sb.toString();
  }

  private static String encodingFor (char c) {
    switch (c) {
    case '<': return LT;
    case '>': return GT;
    case '&': return AMP;
    default:  return null;
    }
  }

  private static final String LT = "&lt;";
  private static final String GT = "&gt;";
  private static final String AMP = "&amp;";

  private Escaping () {} // no instances
}
