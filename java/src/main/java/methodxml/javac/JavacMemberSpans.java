//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.javac;

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.TreeScanner;
import javax.lang.model.element.Element;
import javax.lang.model.util.Elements;
import methodxml.model.TextSpan;
import methodxml.store.MemberSpansCache;

/**
 * Computes the spans of the method-level members of a compilation unit: the methods,
 * constructors, fields and initializer blocks of every class in the unit, including nested
 * classes. Members declared inside method bodies (local and anonymous classes) are not included.
 * Spans are returned in source order. Members synthesized by the compiler, such as default
 * constructors, have no source and are skipped.
 */
public class JavacMemberSpans implements MemberSpansCache.Computer<JavacUnit> {

  @Override public ImmutableList<TextSpan> memberSpans (JavacUnit unit) {
    ImmutableList.Builder<TextSpan> spans = ImmutableList.builder();
    new TreeScanner<Void,Void>() {
      @Override public Void visitClass (ClassTree node, Void unused) {
        for (Tree member : node.getMembers()) {
          switch (member.getKind()) {
          case METHOD:
          case VARIABLE:
          case BLOCK:
            if (isExplicit(unit, member) && unit.hasSpan(member)) spans.add(unit.span(member));
            break;
          default:
            // nested types have members of their own
            scan(member, null);
            break;
          }
        }
        return null;
      }
    }.scan(unit.tree, null);
    return spans.build();
  }

  private static boolean isExplicit (JavacUnit unit, Tree member) {
    if (member.getKind() == Tree.Kind.BLOCK) return true;
    Element elem = unit.element(member);
    return elem == null || unit.elements.getOrigin(elem) == Elements.Origin.EXPLICIT;
  }
}
