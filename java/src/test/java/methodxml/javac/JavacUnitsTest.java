//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.javac;

import com.google.common.base.Joiner;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class JavacUnitsTest {

  @Rule public TemporaryFolder temp = new TemporaryFolder();

  public static final String BROKEN = Joiner.on("\n").join(
    "package foo;",
    "public class Broken {",
    "  java.util.List raw = null;",
    "  int missing = undefinedName;",
    "}");

  @Test public void testDiagnosticSummary () {
    Locale saved = Locale.getDefault();
    try {
      // dotless i under Turkish case rules
      Locale.setDefault(new Locale("tr", "TR"));
      JavacUnits units = new JavacUnits().options("-Xlint:all");
      units.process("Broken.java", BROKEN);
      String summary = JavacUnits.summarize(units.diagnostics());
      assertTrue(summary, summary.contains("error=1"));
      assertTrue(summary, summary.contains("warning="));
      assertEquals(summary.toLowerCase(Locale.ROOT), summary);
      assertFalse(summary, summary.contains("ı"));
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test public void testEmptySummary () {
    assertEquals("", JavacUnits.summarize(Collections.emptyList()));
  }

  @Test public void testProcessFiles () throws Exception {
    Path file = temp.newFile("Disk.java").toPath();
    String code = "package foo;\npublic class Disk {\n  int size () { return 1; }\n}\n";
    Files.write(file, code.getBytes(StandardCharsets.UTF_8));

    JavacUnits units = new JavacUnits();
    List<JavacUnit> result = units.process(Collections.singletonList(file));
    assertEquals(1, result.size());
    assertTrue(units.diagnostics().isEmpty());

    // units stay usable once the file manager is released
    JavacUnit unit = result.get(0);
    assertEquals(code, unit.text);
    assertTrue(unit.documentId().id.endsWith("Disk.java"));
    assertEquals(2, unit.semanticModel().lineNumber(TreeFinder.method(unit, "size")));
  }
}
