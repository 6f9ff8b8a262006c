//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.javac;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.Trees;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Parses and attributes Java source with the system Java compiler, stopping short of generating
 * bytecode, and hands back the resulting compilation units for rendering.
 */
public class JavacUnits {

  public JavacUnits () {
    this(ToolProvider.getSystemJavaCompiler());
  }

  public JavacUnits (JavaCompiler compiler) {
    if (compiler == null) throw new IllegalStateException(
      "No system Java compiler available; running on a JRE?");
    _compiler = compiler;
  }

  /** Provides the classpath used by the compiler. */
  public Iterable<Path> classpath () { return Collections.emptyList(); }

  /** Adds {@code options} to the options passed to the compiler. */
  public JavacUnits options (String... options) {
    Collections.addAll(_options, options);
    return this;
  }

  /** Returns the diagnostics reported by the most recent {@code process} call. */
  public List<Diagnostic<? extends JavaFileObject>> diagnostics () {
    return _diagnostics;
  }

  /** Processes {@code files}. */
  public List<JavacUnit> process (Iterable<Path> files) {
    StandardJavaFileManager fm = _compiler.getStandardFileManager(null, null, null);
    try {
      return process0(fm.getJavaFileObjectsFromFiles(Iterables.transform(files, Path::toFile)));
    } finally {
      try {
        fm.close();
      } catch (IOException e) {
        System.err.println("Failed to close file manager: " + e);
      }
    }
  }

  /** Combines {@code file} and {@code code} into a test file and processes it. */
  public JavacUnit process (String file, String code) {
    return process(Collections.singletonList(file), Collections.singletonList(code)).get(0);
  }

  /** Combines {@code files} and {@code codes} into test files and processes them. */
  public List<JavacUnit> process (Iterable<String> files, Iterable<String> codes) {
    List<JavaFileObject> objs = Lists.newArrayList();
    Iterator<String> citer = codes.iterator();
    for (String file : files) objs.add(mkTestObject(file, citer.next()));
    return process0(objs);
  }

  private List<JavacUnit> process0 (Iterable<? extends JavaFileObject> files) {
    List<String> opts = Lists.newArrayList("-proc:none");
    opts.addAll(_options);

    String cp = Joiner.on(File.pathSeparator).join(classpath());
    if (cp.length() > 0) {
      opts.add("-classpath");
      opts.add(cp);
    }

    DiagnosticCollector<JavaFileObject> diags = new DiagnosticCollector<>();
    JavacTask task = (JavacTask)_compiler.getTask(null, null, diags, opts, null, files);
    try {
      Iterable<? extends CompilationUnitTree> asts = task.parse();
      task.analyze(); // don't need results, but need symbols and types in the trees

      Trees trees = Trees.instance(task);
      List<JavacUnit> units = Lists.newArrayList();
      for (CompilationUnitTree ast : asts) {
        String text = ast.getSourceFile().getCharContent(true).toString();
        units.add(new JavacUnit(ast, text, trees, task.getElements(), task.getTypes()));
      }
      return units;

    } catch (IOException e) {
      throw new RuntimeException(e);

    } finally {
      _diagnostics = ImmutableList.copyOf(diags.getDiagnostics());
      reportDiagnostics(_diagnostics);
    }
  }

  private static void reportDiagnostics (List<Diagnostic<? extends JavaFileObject>> diags) {
    String summary = summarize(diags);
    if (summary.length() > 0) System.err.println("Diagnostics [" + summary + "]");
  }

  /** Counts {@code diags} by kind, e.g. {@code error=1, warning=2}. Empty if there are none. */
  static String summarize (List<? extends Diagnostic<?>> diags) {
    int[] counts = new int[Diagnostic.Kind.values().length];
    for (Diagnostic<?> diag : diags) counts[diag.getKind().ordinal()]++;

    StringBuilder sb = new StringBuilder();
    for (Diagnostic.Kind kind : Diagnostic.Kind.values()) {
      int count = counts[kind.ordinal()];
      if (count == 0) continue;
      if (sb.length() > 0) sb.append(", ");
      sb.append(kind.toString().toLowerCase(Locale.ROOT)).append('=').append(count);
    }
    return sb.toString();
  }

  private JavaFileObject mkTestObject (String file, String code) {
    return new SimpleJavaFileObject(URI.create("test:/" + file), JavaFileObject.Kind.SOURCE) {
      @Override public CharSequence getCharContent (boolean ignoreEncodingErrors) {
        return code;
      }
    };
  }

  private final JavaCompiler _compiler;
  private final List<String> _options = Lists.newArrayList();
  private List<Diagnostic<? extends JavaFileObject>> _diagnostics = ImmutableList.of();
}
