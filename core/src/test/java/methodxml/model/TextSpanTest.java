//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

import org.junit.*;
import static org.junit.Assert.*;

public class TextSpanTest {

  @Test public void testBounds () {
    TextSpan span = TextSpan.fromBounds(3, 7);
    assertEquals(3, span.start);
    assertEquals(4, span.length);
    assertEquals(7, span.end());
    assertTrue(span.contains(3));
    assertFalse(span.contains(7));
    assertTrue(new TextSpan(5, 0).isEmpty());
  }

  @Test public void testOverlapAndIntersect () {
    TextSpan a = TextSpan.fromBounds(0, 5), b = TextSpan.fromBounds(5, 9);
    assertFalse(a.overlapsWith(b));
    assertTrue(a.intersectsWith(b));
    assertTrue(a.overlapsWith(TextSpan.fromBounds(4, 6)));
    assertFalse(a.intersectsWith(TextSpan.fromBounds(6, 9)));
    assertTrue(a.contains(TextSpan.fromBounds(1, 5)));
    assertFalse(a.contains(b));
  }

  @Test public void testOrdering () {
    assertTrue(new TextSpan(1, 5).compareTo(new TextSpan(2, 1)) < 0);
    assertTrue(new TextSpan(1, 5).compareTo(new TextSpan(1, 2)) > 0);
    assertEquals(new TextSpan(1, 5), TextSpan.fromBounds(1, 6));
    assertEquals(new TextSpan(1, 5).hashCode(), TextSpan.fromBounds(1, 6).hashCode());
  }

  @Test(expected=IllegalArgumentException.class) public void testInvertedBounds () {
    TextSpan.fromBounds(5, 4);
  }
}
