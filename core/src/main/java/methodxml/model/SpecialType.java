//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * Well-known types that a builder can name without having a type in hand, for example the type
 * of a literal.
 */
public enum SpecialType {
  BOOLEAN, CHAR, BYTE, SHORT, INT, LONG, FLOAT, DOUBLE, STRING, OBJECT, VOID;
}
