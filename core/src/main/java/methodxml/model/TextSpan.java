//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

import com.google.common.base.Preconditions;

/**
 * An immutable range of characters in a source text: {@link #start} inclusive to {@link #end}
 * exclusive.
 */
public final class TextSpan implements Comparable<TextSpan> {

  /** Creates a span covering {@code start} (inclusive) to {@code end} (exclusive). */
  public static TextSpan fromBounds (int start, int end) {
    Preconditions.checkArgument(end >= start, "end (%s) precedes start (%s)", end, start);
    return new TextSpan(start, end - start);
  }

  /** The offset of the first character in this span. */
  public final int start;

  /** The number of characters in this span. */
  public final int length;

  public TextSpan (int start, int length) {
    Preconditions.checkArgument(start >= 0, "start must be non-negative: %s", start);
    Preconditions.checkArgument(length >= 0, "length must be non-negative: %s", length);
    this.start = start;
    this.length = length;
  }

  /** Returns the offset just past the last character in this span. */
  public int end () { return start + length; }

  /** Returns whether this span contains no characters. */
  public boolean isEmpty () { return length == 0; }

  /** Returns whether {@code position} falls inside this span. */
  public boolean contains (int position) {
    return position >= start && position < end();
  }

  /** Returns whether {@code other} lies entirely inside this span. */
  public boolean contains (TextSpan other) {
    return other.start >= start && other.end() <= end();
  }

  /** Returns the characters of {@code text} covered by this span. */
  public String substring (CharSequence text) {
    return text.subSequence(start, end()).toString();
  }

  /** Returns whether this span and {@code other} share at least one character. */
  public boolean overlapsWith (TextSpan other) {
    return Math.max(start, other.start) < Math.min(end(), other.end());
  }

  /** Returns whether this span and {@code other} overlap or touch. */
  public boolean intersectsWith (TextSpan other) {
    return other.start <= end() && other.end() >= start;
  }

  @Override public int compareTo (TextSpan other) {
    int cmp = Integer.compare(start, other.start);
    return (cmp != 0) ? cmp : Integer.compare(length, other.length);
  }

  @Override public boolean equals (Object other) {
    return (other instanceof TextSpan) && start == ((TextSpan)other).start &&
      length == ((TextSpan)other).length;
  }

  @Override public int hashCode () {
    return start * 31 + length;
  }

  @Override public String toString () {
    return "[" + start + ".." + end() + ")";
  }
}
