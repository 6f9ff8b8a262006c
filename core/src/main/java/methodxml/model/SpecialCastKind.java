//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * The cast forms that are flagged on a {@code Cast} element. An ordinary cast has no special cast
 * kind and is represented by {@code null}.
 */
public enum SpecialCastKind {

  /** A cast that never applies user-defined conversions. Rendered as {@code directcast="yes"}. */
  DIRECT_CAST,

  /** A cast that yields null rather than failing. Rendered as {@code trycast="yes"}. */
  TRY_CAST;
}
