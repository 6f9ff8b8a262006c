//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * Classifies the referent of a {@code NameRef} element. Rendered as the {@code variablekind}
 * attribute.
 */
public enum VariableKind {

  /** No variable kind attribute. */
  NONE(null),

  /** A property (or record component) access. */
  PROPERTY("property"),

  /** A method group or method reference. */
  METHOD("method"),

  /** A field, enum constant or event. */
  FIELD("field"),

  /** A local variable or parameter. */
  LOCAL("local"),

  /** A name whose referent could not be resolved. */
  UNKNOWN("unknown");

  /**
   * Returns the token used for this kind in markup.
   * @throws IllegalStateException if this is {@link #NONE}, which has no token.
   */
  public String text () {
    if (_text == null) throw new IllegalStateException("Invalid VariableKind: " + this);
    return _text;
  }

  VariableKind (String text) {
    _text = text;
  }

  private final String _text;
}
