//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * The kinds of symbols an analysis layer reports for a name. Only the variable-like kinds map to
 * a {@link VariableKind}; the rest exist so that an analysis layer can classify every symbol it
 * sees, and so that a misplaced one is reported rather than silently mislabeled.
 */
public enum SymbolKind {

  /** An event (a field-like member with add and remove accessors). */
  EVENT,
  /** A field or enum constant. */
  FIELD,
  /** A local variable, including resources, exception and pattern bindings. */
  LOCAL,
  /** A method or constructor parameter. */
  PARAMETER,
  /** A method or constructor. */
  METHOD,
  /** A property or record component. */
  PROPERTY,

  /** A class, interface, enum, record or type parameter. */
  TYPE,
  /** A package or module. */
  NAMESPACE,
  /** Anything else. */
  OTHER;
}
