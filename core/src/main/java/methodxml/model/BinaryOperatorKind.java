//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * The binary operators that are called out with a {@code binaryoperator} attribute on
 * {@code Assignment} and {@code BinaryOperation} elements. Operators not listed here are rendered
 * without the attribute, via {@link #NONE}.
 */
public enum BinaryOperatorKind {

  /** No operator attribute. */
  NONE(null),

  /** Numeric addition. */
  PLUS("plus"),

  /** Bitwise (or non-short-circuiting logical) or. */
  BITWISE_OR("bitor"),

  /** Bitwise (or non-short-circuiting logical) and. */
  BITWISE_AND("bitand"),

  /** String concatenation. */
  CONCATENATE("concatenate"),

  /** Delegate (event handler) combination. */
  ADD_DELEGATE("adddelegate");

  /**
   * Returns the token used for this operator in markup.
   * @throws IllegalStateException if this is {@link #NONE}, which has no token.
   */
  public String text () {
    if (_text == null) throw new IllegalStateException("Invalid BinaryOperatorKind: " + this);
    return _text;
  }

  BinaryOperatorKind (String text) {
    _text = text;
  }

  private final String _text;
}
