//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import methodxml.emit.MethodXmlWriter.Tag;
import methodxml.model.VariableKind;
import org.junit.*;
import static org.junit.Assert.*;

public class MethodXmlWriterTest {

  @Test public void testNesting () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag block = out.tag("Block")) {
      try (Tag stmt = out.tag("ExpressionStatement", Attributes.lineNumber(3))) {
        try (Tag name = out.tag("Name")) {
          out.encodedText("x");
        }
      }
      out.leafTag("Null");
    }
    assertEquals("<Block><ExpressionStatement line=\"3\"><Name>x</Name></ExpressionStatement>" +
                 "<Null/></Block>", out.toString());
    assertEquals(0, out.depth());
  }

  @Test public void testEmptyAttributesOmitted () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag tag = out.tag("Cast", Attribute.EMPTY, Attributes.name(null), Attribute.EMPTY)) {
      out.encodedText("v");
    }
    assertEquals("<Cast>v</Cast>", out.toString());
  }

  @Test public void testEmptyStringAttributeKept () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag tag = out.tag("Name", new Attribute("name", ""))) {
      out.encodedText("v");
    }
    assertEquals("<Name name=\"\">v</Name>", out.toString());
  }

  @Test public void testAttributeValuesEscaped () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag tag = out.tag("NameRef", Attributes.fullName("List<Map<K,V>> & co"))) {
      out.encodedText("a<b");
    }
    assertEquals("<NameRef fullname=\"List&lt;Map&lt;K,V&gt;&gt; &amp; co\">a&lt;b</NameRef>",
                 out.toString());
  }

  @Test public void testContentlessTagSelfCloses () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag tag = out.tag("NameRef", Attributes.name("x"))) {}
    assertEquals("<NameRef name=\"x\"/>", out.toString());
  }

  @Test public void testClosedOnException () {
    MethodXmlWriter out = new MethodXmlWriter();
    try {
      try (Tag outer = out.tag("MethodCall")) {
        try (Tag inner = out.tag("Argument")) {
          out.encodedText("1");
          throw new RuntimeException("bail");
        }
      }
    } catch (RuntimeException e) {
      assertEquals("bail", e.getMessage());
    }
    assertEquals("<MethodCall><Argument>1</Argument></MethodCall>", out.toString());
    assertEquals(0, out.depth());
  }

  @Test public void testOutOfOrderCloseFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag outer = out.tag("Block");
    Tag inner = out.tag("Expression");
    try {
      outer.close();
      fail("Closing an outer tag before its inner tag should fail");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("<Expression>"));
    }
    inner.close();
    outer.close();
    assertEquals("<Block><Expression/></Block>", out.toString());
  }

  @Test(expected=IllegalStateException.class) public void testDoubleCloseFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag tag = out.tag("Block");
    tag.close();
    tag.close();
  }

  @Test public void testRewindRestoresBuffer () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag block = out.tag("Block")) {
      out.encodedText("kept");
      String before = out.toString();
      int mark = out.mark();
      try (Tag cast = out.tag("Cast", Attributes.rank(2))) {
        out.encodedText("speculative & discarded");
      }
      out.leafTag("Null");
      out.rewind(mark);
      assertEquals(before, out.toString());
    }
    assertEquals("<Block>kept</Block>", out.toString());
  }

  @Test public void testRewindDiscardsOpenTags () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag block = out.tag("Block");
    int mark = out.mark();
    Tag call = out.tag("MethodCall");
    Tag arg = out.tag("Argument");
    assertEquals(3, out.depth());

    out.rewind(mark);
    assertEquals(1, out.depth());
    assertFalse(call.isOpen());
    assertFalse(arg.isOpen());
    assertTrue(block.isOpen());
    try {
      arg.close();
      fail("Closing a rewound tag should fail");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("rewind"));
    }

    out.encodedText("x");
    block.close();
    assertEquals("<Block>x</Block>", out.toString());
  }

  @Test(expected=IllegalArgumentException.class) public void testRewindForwardFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    out.encodedText("abc");
    out.rewind(out.mark() + 1);
  }

  @Test(expected=IllegalArgumentException.class) public void testRewindNegativeFails () {
    new MethodXmlWriter().rewind(-1);
  }

  @Test public void testRewindToCurrentIsNoop () {
    MethodXmlWriter out = new MethodXmlWriter(4);
    out.encodedText("abc");
    out.rewind(out.mark());
    assertEquals("abc", out.toString());
  }

  @Test public void testRewindIntoClosedElementFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag block = out.tag("Block");
    Tag cast = out.tag("Cast");
    int mark = out.mark();
    out.encodedText("x");
    cast.close();
    try {
      out.rewind(mark);
      fail("Rewinding into a closed element should fail");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("Cast"));
    }
    block.close();
    assertEquals("<Block><Cast>x</Cast></Block>", out.toString());
  }

  @Test public void testRewindIntoSelfClosedElementFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag block = out.tag("Block");
    Tag ref = out.tag("NameRef", Attributes.variableKind(VariableKind.LOCAL));
    int mark = out.mark();
    ref.close();
    try {
      out.rewind(mark);
      fail("Rewinding into a closed element should fail");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("NameRef"));
    }
    block.close();
    assertEquals("<Block><NameRef variablekind=\"local\"/></Block>", out.toString());
  }

  @Test public void testRewindIntoClosedParentFails () {
    MethodXmlWriter out = new MethodXmlWriter();
    Tag call = out.tag("MethodCall");
    int mark = out.mark();
    try (Tag arg = out.tag("Argument")) {
      out.encodedText("a");
    }
    call.close();
    try {
      out.rewind(mark);
      fail("Rewinding into a closed element should fail");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("MethodCall"));
    }
  }

  @Test public void testRewindAroundClosedElements () {
    MethodXmlWriter out = new MethodXmlWriter();
    try (Tag block = out.tag("Block")) {
      int start = out.mark();
      try (Tag name = out.tag("Name")) {
        out.encodedText("a");
      }
      int between = out.mark();
      try (Tag name = out.tag("Name")) {
        out.encodedText("b");
      }
      out.rewind(between);
      assertEquals("<Block><Name>a</Name>", out.toString());
      out.rewind(start);
      assertEquals("<Block>", out.toString());
      out.encodedText("c");
    }
    assertEquals("<Block>c</Block>", out.toString());
  }

  @Test public void testLineBreak () {
    MethodXmlWriter out = new MethodXmlWriter();
    out.leafTag("Null");
    out.lineBreak();
    out.leafTag("Null");
    assertEquals("<Null/>" + System.lineSeparator() + "<Null/>", out.toString());
  }
}
