//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import java.util.Random;
import org.junit.*;
import static org.junit.Assert.*;

public class EscapingTest {

  @Test public void testReserved () {
    assertEquals("a &lt; b &amp;&amp; c &gt; d", Escaping.encode("a < b && c > d"));
    assertEquals("&lt;&gt;&amp;", Escaping.encode("<>&"));
  }

  @Test public void testUnreservedPassThrough () {
    for (String text : new String[] { "", "plain", "\"quoted\" 'single'", "tab\tnewline\n",
                                      "été 😀" }) {
      assertEquals(text, Escaping.encode(text));
    }
  }

  @Test public void testNoDoubleEscape () {
    // an escape token in the input is itself escaped exactly once
    assertEquals("&amp;lt;", Escaping.encode("&lt;"));
    assertEquals("&lt;", Escaping.decode(Escaping.encode("&lt;")));
  }

  @Test public void testAppendEncoded () {
    StringBuilder sb = new StringBuilder("x=");
    Escaping.appendEncoded(sb, "1<2");
    assertEquals("x=1&lt;2", sb.toString());
  }

  @Test public void testDecodeLeavesStrayAmpersands () {
    assertEquals("a & b &quot;", Escaping.decode("a & b &quot;"));
    assertEquals("&", Escaping.decode("&"));
  }

  @Test public void testDecodeInvertsEncode () {
    String alphabet = "<>&;lgtamp x\n";
    Random rando = new Random(42);
    for (int ii = 0; ii < 1000; ii++) {
      StringBuilder sb = new StringBuilder();
      for (int cc = 0, ll = rando.nextInt(20); cc < ll; cc++) {
        sb.append(alphabet.charAt(rando.nextInt(alphabet.length())));
      }
      String text = sb.toString();
      assertEquals(text, Escaping.decode(Escaping.encode(text)));
    }
  }
}
