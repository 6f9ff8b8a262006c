//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import com.google.common.base.CharMatcher;
import methodxml.model.BinaryOperatorKind;
import methodxml.model.SpecialCastKind;
import methodxml.model.VariableKind;

/**
 * Builds the attributes used by method markup. Each factory maps a "no information" input (null,
 * blank, {@code NONE}) to {@link Attribute#EMPTY} so that callers can pass optional data straight
 * through.
 */
public class Attributes {

  public static final String BINARY_OPERATOR = "binaryoperator";
  public static final String DIRECT_CAST = "directcast";
  public static final String FULL_NAME = "fullname";
  public static final String IMPLICIT = "implicit";
  public static final String LINE = "line";
  public static final String NAME = "name";
  public static final String RANK = "rank";
  public static final String TRY_CAST = "trycast";
  public static final String TYPE = "type";
  public static final String VARIABLE_KIND = "variablekind";

  public static Attribute binaryOperator (BinaryOperatorKind kind) {
    if (kind == BinaryOperatorKind.NONE) return Attribute.EMPTY;
    return new Attribute(BINARY_OPERATOR, kind.text());
  }

  public static Attribute fullName (String name) {
    return isBlank(name) ? Attribute.EMPTY : new Attribute(FULL_NAME, name);
  }

  /** Returns {@code implicit="yes"} or {@code implicit="no"}, or nothing if {@code implicit} is
    * null. */
  public static Attribute implicit (Boolean implicit) {
    if (implicit == null) return Attribute.EMPTY;
    return new Attribute(IMPLICIT, implicit ? "yes" : "no");
  }

  public static Attribute lineNumber (int lineNumber) {
    return new Attribute(LINE, Integer.toString(lineNumber));
  }

  public static Attribute name (String name) {
    return isBlank(name) ? Attribute.EMPTY : new Attribute(NAME, name);
  }

  public static Attribute rank (int rank) {
    return new Attribute(RANK, Integer.toString(rank));
  }

  /** Returns {@code directcast="yes"} or {@code trycast="yes"}, or nothing for an ordinary
    * (null) cast. */
  public static Attribute specialCastKind (SpecialCastKind kind) {
    if (kind == null) return Attribute.EMPTY;
    switch (kind) {
    case DIRECT_CAST: return new Attribute(DIRECT_CAST, "yes");
    case TRY_CAST: return new Attribute(TRY_CAST, "yes");
    default: throw new IllegalStateException("Invalid SpecialCastKind: " + kind);
    }
  }

  public static Attribute type (String typeName) {
    return isBlank(typeName) ? Attribute.EMPTY : new Attribute(TYPE, typeName);
  }

  public static Attribute variableKind (VariableKind kind) {
    if (kind == VariableKind.NONE) return Attribute.EMPTY;
    return new Attribute(VARIABLE_KIND, kind.text());
  }

  private static boolean isBlank (String text) {
    return text == null || CharMatcher.whitespace().matchesAllOf(text);
  }

  private Attributes () {} // no instances
}
