//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import com.google.common.base.Preconditions;
import methodxml.emit.MethodXmlWriter.Tag;
import methodxml.model.BinaryOperatorKind;
import methodxml.model.SemanticModel;
import methodxml.model.SpecialCastKind;
import methodxml.model.SpecialType;
import methodxml.model.SymbolKind;
import methodxml.model.VariableKind;

/**
 * The base class for visitors that render a method body as markup. A visitor walks its own
 * syntax tree and calls the tag and {@code generate} methods here, opening composite elements with
 * try-with-resources:
 *
 * <pre>{@code
 * try (Tag stmt = expressionStatementTag(getLineNumber(node))) {
 *   try (Tag call = methodCallTag()) {
 *     ...
 *   }
 * }
 * }</pre>
 *
 * Everything the builder needs to know about types, symbols and source positions comes from the
 * {@link SemanticModel} supplied at construction.
 *
 * @param <N> the syntax node representation.
 * @param <T> the type representation.
 * @param <S> the symbol representation.
 */
public abstract class MethodXmlBuilder<N,T,S> {

  /** The analysis layer that answers questions about nodes, types and symbols. */
  protected final SemanticModel<N,T,S> model;

  protected MethodXmlBuilder (SemanticModel<N,T,S> model) {
    this(model, new MethodXmlWriter());
  }

  protected MethodXmlBuilder (SemanticModel<N,T,S> model, MethodXmlWriter writer) {
    this.model = Preconditions.checkNotNull(model, "model");
    _writer = Preconditions.checkNotNull(writer, "writer");
  }

  /** Returns the markup generated so far. */
  @Override public String toString () {
    return _writer.toString();
  }

  protected Tag argumentTag () { return tag(ARGUMENT); }
  protected Tag arrayElementAccessTag () { return tag(ARRAY_ELEMENT_ACCESS); }
  protected Tag arrayTag () { return tag(ARRAY); }
  protected Tag arrayTypeTag (int rank) { return tag(ARRAY_TYPE, Attributes.rank(rank)); }

  protected Tag assignmentTag () { return assignmentTag(BinaryOperatorKind.NONE); }
  protected Tag assignmentTag (BinaryOperatorKind kind) {
    return tag(ASSIGNMENT, Attributes.binaryOperator(kind));
  }

  protected void baseReferenceTag () { _writer.leafTag(BASE_REFERENCE); }

  protected Tag binaryOperationTag (BinaryOperatorKind kind) {
    return tag(BINARY_OPERATION, Attributes.binaryOperator(kind));
  }

  protected Tag blockTag () { return tag(BLOCK); }
  protected Tag booleanTag () { return tag(BOOLEAN); }
  protected Tag boundTag () { return tag(BOUND); }

  protected Tag castTag () { return castTag(null); }
  protected Tag castTag (SpecialCastKind kind) {
    return tag(CAST, Attributes.specialCastKind(kind));
  }

  protected Tag charTag () { return tag(CHAR); }
  protected Tag commentTag () { return tag(COMMENT); }
  protected Tag expressionTag () { return tag(EXPRESSION); }

  protected Tag expressionStatementTag (int lineNumber) {
    return tag(EXPRESSION_STATEMENT, Attributes.lineNumber(lineNumber));
  }

  protected Tag literalTag () { return tag(LITERAL); }
  protected Tag localTag (int lineNumber) { return tag(LOCAL, Attributes.lineNumber(lineNumber)); }
  protected Tag methodCallTag () { return tag(METHOD_CALL); }
  protected Tag nameTag () { return tag(NAME); }

  protected Tag nameRefTag (VariableKind kind) { return nameRefTag(kind, null, null); }
  protected Tag nameRefTag (VariableKind kind, String name, String fullName) {
    return tag(NAME_REF, Attributes.variableKind(kind), Attributes.name(name),
               Attributes.fullName(fullName));
  }

  protected Tag newArrayTag () { return tag(NEW_ARRAY); }
  protected Tag newClassTag () { return tag(NEW_CLASS); }
  protected Tag newDelegateTag (String name) { return tag(NEW_DELEGATE, Attributes.name(name)); }

  protected void nullTag () { _writer.leafTag(NULL); }

  protected Tag numberTag (String typeName) { return tag(NUMBER, Attributes.type(typeName)); }
  protected Tag parenthesesTag () { return tag(PARENTHESES); }
  protected Tag quoteTag (int lineNumber) { return tag(QUOTE, Attributes.lineNumber(lineNumber)); }
  protected Tag stringTag () { return tag(STRING); }

  protected void thisReferenceTag () { _writer.leafTag(THIS_REFERENCE); }

  protected Tag typeTag () { return typeTag(null); }
  protected Tag typeTag (Boolean implicit) { return tag(TYPE, Attributes.implicit(implicit)); }

  protected void lineBreak () { _writer.lineBreak(); }
  protected void encodedText (String text) { _writer.encodedText(text); }

  /** Returns a checkpoint for use with {@link #rewind}. */
  protected int getMark () { return _writer.mark(); }

  /** Discards everything generated since {@code mark} was obtained. Tags opened since then must
    * not be closed afterwards. */
  protected void rewind (int mark) { _writer.rewind(mark); }

  /**
   * Classifies {@code symbol} for a {@code NameRef}. An unresolved (null) symbol is
   * {@link VariableKind#UNKNOWN}.
   * @throws IllegalArgumentException if the symbol is not a variable, method or property.
   */
  protected VariableKind getVariableKind (S symbol) {
    if (symbol == null) return VariableKind.UNKNOWN;

    SymbolKind kind = model.symbolKind(symbol);
    switch (kind) {
    case EVENT:
    case FIELD:
      return VariableKind.FIELD;
    case LOCAL:
    case PARAMETER:
      return VariableKind.LOCAL;
    case METHOD:
      return VariableKind.METHOD;
    case PROPERTY:
      return VariableKind.PROPERTY;
    default:
      throw new IllegalArgumentException("Invalid symbol kind: " + kind);
    }
  }

  protected String getTypeName (T type) {
    return model.metadataName(type);
  }

  protected int getLineNumber (N node) {
    return model.lineNumber(node);
  }

  /** Quotes the source of a node that the visitor does not otherwise model. */
  protected void generateUnknown (N node) {
    try (Tag quote = quoteTag(getLineNumber(node))) {
      encodedText(model.sourceText(node));
    }
  }

  protected void generateName (String name) {
    try (Tag tag = nameTag()) {
      encodedText(name);
    }
  }

  protected void generateType (T type) {
    generateType(type, null, false);
  }

  protected void generateType (T type, Boolean implicit) {
    generateType(type, implicit, false);
  }

  /**
   * Generates {@code type}. Array types are wrapped in one {@code ArrayType} element per rank
   * group reported by the type system, around the element type.
   * @param implicit if non-null, flags whether the type was written in source or inferred.
   * @param assemblyQualify whether to append ", " and the name of the containing module.
   */
  protected void generateType (T type, Boolean implicit, boolean assemblyQualify) {
    if (model.isArray(type)) {
      try (Tag tag = arrayTypeTag(model.arrayRank(type))) {
        generateType(model.elementType(type), implicit, assemblyQualify);
      }
    } else {
      try (Tag tag = typeTag(implicit)) {
        String typeName = assemblyQualify ?
          getTypeName(type) + ", " + model.moduleName(type) : getTypeName(type);
        encodedText(typeName);
      }
    }
  }

  protected void generateType (SpecialType specialType) {
    generateType(model.specialType(specialType));
  }

  protected void generateNullLiteral () {
    try (Tag tag = literalTag()) {
      nullTag();
    }
  }

  /** Generates a {@code Number} element for {@code value}, which has type {@code type}. See
    * {@link Numbers#format} for the text format. */
  protected void generateNumber (Object value, T type) {
    try (Tag tag = numberTag(getTypeName(type))) {
      encodedText(Numbers.format(value));
    }
  }

  protected void generateNumber (Object value, SpecialType specialType) {
    generateNumber(value, model.specialType(specialType));
  }

  protected void generateChar (char value) {
    try (Tag tag = charTag()) {
      encodedText(String.valueOf(value));
    }
  }

  protected void generateString (String value) {
    try (Tag tag = stringTag()) {
      encodedText(value);
    }
  }

  protected void generateBoolean (boolean value) {
    try (Tag tag = booleanTag()) {
      encodedText(value ? "true" : "false");
    }
  }

  protected void generateThisReference () { thisReferenceTag(); }
  protected void generateBaseReference () { baseReferenceTag(); }

  private Tag tag (String name, Attribute... attributes) {
    return _writer.tag(name, attributes);
  }

  private final MethodXmlWriter _writer;

  private static final String ARGUMENT = "Argument";
  private static final String ARRAY = "Array";
  private static final String ARRAY_ELEMENT_ACCESS = "ArrayElementAccess";
  private static final String ARRAY_TYPE = "ArrayType";
  private static final String ASSIGNMENT = "Assignment";
  private static final String BASE_REFERENCE = "BaseReference";
  private static final String BINARY_OPERATION = "BinaryOperation";
  private static final String BLOCK = "Block";
  private static final String BOOLEAN = "Boolean";
  private static final String BOUND = "Bound";
  private static final String CAST = "Cast";
  private static final String CHAR = "Char";
  private static final String COMMENT = "Comment";
  private static final String EXPRESSION = "Expression";
  private static final String EXPRESSION_STATEMENT = "ExpressionStatement";
  private static final String LITERAL = "Literal";
  private static final String LOCAL = "Local";
  private static final String METHOD_CALL = "MethodCall";
  private static final String NAME = "Name";
  private static final String NAME_REF = "NameRef";
  private static final String NEW_ARRAY = "NewArray";
  private static final String NEW_CLASS = "NewClass";
  private static final String NEW_DELEGATE = "NewDelegate";
  private static final String NULL = "Null";
  private static final String NUMBER = "Number";
  private static final String PARENTHESES = "Parentheses";
  private static final String QUOTE = "Quote";
  private static final String STRING = "String";
  private static final String THIS_REFERENCE = "ThisReference";
  private static final String TYPE = "Type";
}
