//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.javac;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreePath;
import com.sun.source.util.Trees;
import javax.lang.model.element.Element;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import methodxml.model.DocumentId;
import methodxml.model.TextSpan;
import methodxml.text.LineMap;

/**
 * An attributed compilation unit along with the compiler services needed to interrogate it.
 */
public class JavacUnit {

  /** The compilation unit. */
  public final CompilationUnitTree tree;

  /** The source text of the compilation unit. */
  public final String text;

  public final Trees trees;
  public final Elements elements;
  public final Types types;

  /** The line map of {@link #text}. */
  public final LineMap lines;

  public JavacUnit (CompilationUnitTree tree, String text, Trees trees, Elements elements,
                    Types types) {
    this.tree = tree;
    this.text = text;
    this.trees = trees;
    this.elements = elements;
    this.types = types;
    this.lines = LineMap.of(text);
  }

  /** Returns an id for this unit's source file. */
  public DocumentId documentId () {
    return new DocumentId(tree.getSourceFile().toUri().toString());
  }

  /** Returns a semantic model that answers questions about nodes in this unit. */
  public JavacSemanticModel semanticModel () {
    return new JavacSemanticModel(this);
  }

  /** Returns the path from the root of this unit to {@code node}. */
  public TreePath path (Tree node) {
    TreePath path = TreePath.getPath(tree, node);
    if (path == null) throw new IllegalArgumentException("Node not in " + this + ": " + node);
    return path;
  }

  /** Returns the symbol that {@code node} declares or references, or null. */
  public Element element (Tree node) {
    return trees.getElement(path(node));
  }

  /** Returns the type of {@code node}, or null. */
  public TypeMirror typeOf (Tree node) {
    return trees.getTypeMirror(path(node));
  }

  /**
   * Returns the source span of {@code node}.
   * @throws IllegalArgumentException if the compiler did not record a position for the node,
   * as happens for synthesized trees.
   */
  public TextSpan span (Tree node) {
    SourcePositions pos = trees.getSourcePositions();
    long start = pos.getStartPosition(tree, node), end = pos.getEndPosition(tree, node);
    if (start == Diagnostic.NOPOS || end == Diagnostic.NOPOS || end < start) {
      throw new IllegalArgumentException("No source position for " + node.getKind());
    }
    return TextSpan.fromBounds((int)start, (int)end);
  }

  /** Returns whether the compiler recorded a source span for {@code node}. */
  public boolean hasSpan (Tree node) {
    SourcePositions pos = trees.getSourcePositions();
    long start = pos.getStartPosition(tree, node), end = pos.getEndPosition(tree, node);
    return start != Diagnostic.NOPOS && end != Diagnostic.NOPOS && end > start;
  }

  @Override public String toString () {
    return tree.getSourceFile().getName();
  }
}
