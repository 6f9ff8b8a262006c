//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Accumulates method markup in a single buffer. Elements are opened via {@link #tag}, which
 * returns a handle that closes the element when it is itself closed. Handles are meant to be used
 * with try-with-resources, which guarantees that elements close in the reverse of the order in
 * which they were opened, even when emission bails out early:
 *
 * <pre>{@code
 * try (Tag block = writer.tag("Block")) {
 *   try (Tag name = writer.tag("Name")) {
 *     writer.encodedText("x");
 *   }
 *   writer.leafTag("Null");
 * }
 * }</pre>
 *
 * A writer also supports speculative output: {@link #mark} notes the current buffer position and
 * {@link #rewind} discards everything written since. A writer is used by one thread for one
 * method body and then discarded.
 */
public class MethodXmlWriter {

  /**
   * An open element. Closing it appends the element's close tag. A tag may only be closed once,
   * only while it is the innermost open element, and only if its open tag has not been discarded
   * by a {@link MethodXmlWriter#rewind}. An element that received no content is closed in
   * self-closing form: {@code <NameRef name="x"/>} rather than {@code <NameRef name="x"></NameRef>}.
   */
  public final class Tag implements AutoCloseable {

    /** The name of this element. */
    public final String name;

    /** Returns whether this tag is still open. */
    public boolean isOpen () {
      return _state == OPEN;
    }

    @Override public void close () {
      Preconditions.checkState(_state != CLOSED, "Tag <%s> closed twice", name);
      Preconditions.checkState(_state != DISCARDED,
                               "Tag <%s> was discarded by a rewind and cannot be closed", name);
      Tag innermost = _open.peek();
      if (innermost != this) throw new IllegalStateException(
        "Tag <" + name + "> closed while <" + innermost.name + "> is still open");
      _open.pop();
      _state = CLOSED;
      if (_builder.length() == _contentStart) {
        _builder.setLength(_contentStart - 1);
        _builder.append("/>");
      } else closeTag(name);
      _end = _builder.length();

      // closed elements nested in this one are covered by its extent
      while (!_closed.isEmpty() && _closed.peek()._offset >= _offset) _closed.pop();
      _closed.push(this);
    }

    @Override public String toString () {
      return "<" + name + ">@" + _offset;
    }

    private Tag (String name, int offset) {
      this.name = name;
      _offset = offset;
    }

    private final int _offset;
    private int _contentStart;
    private int _end;
    private int _state = OPEN;
  }

  /** Creates a writer with a default initial buffer size. */
  public MethodXmlWriter () {
    this(DEFAULT_CAPACITY);
  }

  /** Creates a writer whose buffer initially holds {@code initialCapacity} chars. */
  public MethodXmlWriter (int initialCapacity) {
    _builder = new StringBuilder(initialCapacity);
  }

  /** Opens element {@code name} with {@code attributes} (empty attributes are omitted). The
    * element is closed by closing the returned tag. */
  public Tag tag (String name, Attribute... attributes) {
    Tag tag = new Tag(name, _builder.length());
    openTag(name, attributes);
    tag._contentStart = _builder.length();
    _open.push(tag);
    return tag;
  }

  /** Appends a self-closing element with no attributes, e.g. {@code <Null/>}. */
  public void leafTag (String name) {
    _builder.append('<').append(name).append("/>");
  }

  /** Appends {@code text}, escaping reserved characters. */
  public void encodedText (String text) {
    Escaping.appendEncoded(_builder, text);
  }

  /** Appends a line separator. */
  public void lineBreak () {
    _builder.append(System.lineSeparator());
  }

  /** Returns the number of elements currently open. */
  public int depth () {
    return _open.size();
  }

  /** Returns a checkpoint that can later be passed to {@link #rewind}. */
  public int mark () {
    return _builder.length();
  }

  /**
   * Discards everything written since {@code mark} was obtained. Elements opened since then are
   * discarded along with their open tags; closing their handles afterwards is an error.
   * @throws IllegalArgumentException if {@code mark} lies beyond the end of the buffer.
   * @throws IllegalStateException if {@code mark} lies inside an element that has since been
   * closed, as rewinding there would leave a partial element in the buffer.
   */
  public void rewind (int mark) {
    Preconditions.checkArgument(mark >= 0 && mark <= _builder.length(),
                                "Cannot rewind to %s, buffer length is %s", mark,
                                _builder.length());
    for (Tag closed : _closed) {
      if (closed._offset >= mark) continue;
      if (closed._end > mark) throw new IllegalStateException(
        "Cannot rewind to " + mark + ", inside closed element " + closed + "-" + closed._end);
      break;
    }
    _builder.setLength(mark);
    while (!_open.isEmpty() && _open.peek()._offset >= mark) _open.pop()._state = DISCARDED;
    while (!_closed.isEmpty() && _closed.peek()._offset >= mark) _closed.pop();
  }

  /** Returns the markup written so far. */
  @Override public String toString () {
    return _builder.toString();
  }

  private void openTag (String name, Attribute[] attributes) {
    StringBuilder sb = _builder;
    sb.append('<').append(name);
    for (Attribute attr : attributes) {
      if (attr.isEmpty()) continue;
      sb.append(' ').append(attr.name).append("=\"");
      Escaping.appendEncoded(sb, attr.value);
      sb.append('"');
    }
    sb.append('>');
  }

  private void closeTag (String name) {
    _builder.append("</").append(name).append('>');
  }

  private final StringBuilder _builder;
  private final Deque<Tag> _open = new ArrayDeque<>();
  // outermost closed elements still in the buffer, latest first; their extents do not overlap
  private final Deque<Tag> _closed = new ArrayDeque<>();

  private static final int DEFAULT_CAPACITY = 256;
  private static final int OPEN = 0, CLOSED = 1, DISCARDED = 2;
}
