//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * The queries a {@code MethodXmlBuilder} makes of the compiler or analyzer that supplies the
 * method body being rendered. The builder never inspects nodes, types or symbols itself; it only
 * passes them back through this interface.
 *
 * @param <N> the analyzer's syntax node representation.
 * @param <T> the analyzer's type representation.
 * @param <S> the analyzer's symbol representation.
 */
public interface SemanticModel<N,T,S> {

  /** Returns the metadata name of {@code type}, e.g. {@code java.util.Map$Entry}. */
  String metadataName (T type);

  /** Returns the display name of the module (assembly, jar) that contains {@code type}. */
  String moduleName (T type);

  /** Returns whether {@code type} is an array type. */
  boolean isArray (T type);

  /** Returns the rank of the array type {@code type}, as reported by the type system. Only called
    * when {@link #isArray} is true. */
  int arrayRank (T type);

  /** Returns the element type of the array type {@code type}. Only called when {@link #isArray} is
    * true. */
  T elementType (T type);

  /** Resolves {@code special} to this analyzer's representation of that type. */
  T specialType (SpecialType special);

  /** Returns the zero-based line number of the line that contains the start of {@code node}. */
  int lineNumber (N node);

  /** Returns the verbatim source text of {@code node}. */
  String sourceText (N node);

  /** Classifies {@code symbol}, which is never null. */
  SymbolKind symbolKind (S symbol);
}
