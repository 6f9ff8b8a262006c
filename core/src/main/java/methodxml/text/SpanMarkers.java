//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.text;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import methodxml.model.TextSpan;

/**
 * Extracts spans from text annotated with open and close markers, e.g.
 * <code>namespace A/&#42;1&#42;/{}/&#42;2&#42;/ class A {}</code>. Each close marker ends the span begun by the most
 * recent unmatched open marker, so markers may nest.
 */
public class SpanMarkers {

  /** The result of {@link #parse}: the text with all markers removed, and the marked spans in the
    * order in which they were closed. Spans are offsets into {@link #text}. */
  public static class Parsed {
    public final String text;
    public final ImmutableList<TextSpan> spans;

    public Parsed (String text, ImmutableList<TextSpan> spans) {
      this.text = text;
      this.spans = spans;
    }

    /** Returns {@link #spans} sorted, with overlapping and touching spans merged. */
    public ImmutableList<TextSpan> normalizedSpans () {
      return normalize(spans);
    }
  }

  /** The default markers: <code>/&#42;1&#42;/</code> opens a span and <code>/&#42;2&#42;/</code>
    * closes it. */
  public static final SpanMarkers DEFAULT = new SpanMarkers("/*1*/", "/*2*/");

  public SpanMarkers (String open, String close) {
    Preconditions.checkArgument(!open.isEmpty() && !close.isEmpty(), "Markers must be non-empty");
    Preconditions.checkArgument(!open.equals(close), "Open and close markers must differ");
    _open = open;
    _close = close;
  }

  /**
   * Strips the markers from {@code marked} and returns the spans they delimit.
   * @throws IllegalArgumentException if a close marker has no open marker, or an open marker is
   * never closed.
   */
  public Parsed parse (String marked) {
    StringBuilder text = new StringBuilder(marked.length());
    Deque<Integer> opens = new ArrayDeque<>();
    ImmutableList.Builder<TextSpan> spans = ImmutableList.builder();
    int pos = 0, length = marked.length();
    while (pos < length) {
      if (marked.startsWith(_open, pos)) {
        opens.push(text.length());
        pos += _open.length();
      } else if (marked.startsWith(_close, pos)) {
        if (opens.isEmpty()) throw new IllegalArgumentException(
          "Unmatched " + _close + " at offset " + pos);
        spans.add(TextSpan.fromBounds(opens.pop(), text.length()));
        pos += _close.length();
      } else {
        text.append(marked.charAt(pos++));
      }
    }
    if (!opens.isEmpty()) throw new IllegalArgumentException(
      opens.size() + " unclosed " + _open + " marker(s)");
    return new Parsed(text.toString(), spans.build());
  }

  /** Sorts {@code spans} and merges any that overlap or touch, yielding disjoint spans in
    * ascending order. */
  public static ImmutableList<TextSpan> normalize (Iterable<TextSpan> spans) {
    List<TextSpan> sorted = new ArrayList<>();
    for (TextSpan span : spans) sorted.add(span);
    if (sorted.isEmpty()) return ImmutableList.of();
    Collections.sort(sorted);

    ImmutableList.Builder<TextSpan> merged = ImmutableList.builder();
    int start = sorted.get(0).start, end = sorted.get(0).end();
    for (TextSpan span : sorted.subList(1, sorted.size())) {
      if (span.start <= end) end = Math.max(end, span.end());
      else {
        merged.add(TextSpan.fromBounds(start, end));
        start = span.start;
        end = span.end();
      }
    }
    merged.add(TextSpan.fromBounds(start, end));
    return merged.build();
  }

  private final String _open;
  private final String _close;
}
