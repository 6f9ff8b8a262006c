//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.javac;

import com.sun.source.tree.Tree;
import javax.lang.model.element.Element;
import javax.lang.model.element.ModuleElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.PrimitiveType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import methodxml.model.SemanticModel;
import methodxml.model.SpecialType;
import methodxml.model.SymbolKind;

/**
 * Answers a builder's questions about the trees, types and symbols of a {@link JavacUnit}.
 *
 * <p>Java has no multi-dimensional array types: {@code int[][]} is an array of {@code int[]}, so
 * every array type has rank one and nested arrays yield nested {@code ArrayType} elements.</p>
 */
public class JavacSemanticModel implements SemanticModel<Tree,TypeMirror,Element> {

  /** Used as the module name of types in the unnamed module, or with no module at all. */
  public static final String UNNAMED_MODULE = "unnamed";

  public JavacSemanticModel (JavacUnit unit) {
    _unit = unit;
  }

  /** Returns the unit about which this model answers questions. */
  public JavacUnit unit () {
    return _unit;
  }

  /** Returns the binary name of declared types (e.g. {@code java.util.Map$Entry}) and the
    * source name of everything else. */
  @Override public String metadataName (TypeMirror type) {
    switch (type.getKind()) {
    case DECLARED:
      TypeElement elem = (TypeElement)((DeclaredType)type).asElement();
      return _unit.elements.getBinaryName(elem).toString();
    case ARRAY:
      return metadataName(((ArrayType)type).getComponentType()) + "[]";
    default:
      return type.toString();
    }
  }

  @Override public String moduleName (TypeMirror type) {
    Element elem;
    if (type.getKind().isPrimitive()) elem = _unit.types.boxedClass((PrimitiveType)type);
    else if (type.getKind() == TypeKind.VOID) elem = _unit.elements.getTypeElement("java.lang.Void");
    else elem = _unit.types.asElement(type);
    if (elem == null) return UNNAMED_MODULE;

    ModuleElement module = _unit.elements.getModuleOf(elem);
    return (module == null || module.isUnnamed()) ? UNNAMED_MODULE :
      module.getQualifiedName().toString();
  }

  @Override public boolean isArray (TypeMirror type) {
    return type.getKind() == TypeKind.ARRAY;
  }

  @Override public int arrayRank (TypeMirror type) {
    return 1;
  }

  @Override public TypeMirror elementType (TypeMirror type) {
    return ((ArrayType)type).getComponentType();
  }

  @Override public TypeMirror specialType (SpecialType special) {
    switch (special) {
    case BOOLEAN: return _unit.types.getPrimitiveType(TypeKind.BOOLEAN);
    case CHAR:    return _unit.types.getPrimitiveType(TypeKind.CHAR);
    case BYTE:    return _unit.types.getPrimitiveType(TypeKind.BYTE);
    case SHORT:   return _unit.types.getPrimitiveType(TypeKind.SHORT);
    case INT:     return _unit.types.getPrimitiveType(TypeKind.INT);
    case LONG:    return _unit.types.getPrimitiveType(TypeKind.LONG);
    case FLOAT:   return _unit.types.getPrimitiveType(TypeKind.FLOAT);
    case DOUBLE:  return _unit.types.getPrimitiveType(TypeKind.DOUBLE);
    case STRING:  return _unit.elements.getTypeElement("java.lang.String").asType();
    case OBJECT:  return _unit.elements.getTypeElement("java.lang.Object").asType();
    case VOID:    return _unit.types.getNoType(TypeKind.VOID);
    default: throw new IllegalArgumentException("Invalid SpecialType: " + special);
    }
  }

  @Override public int lineNumber (Tree node) {
    return _unit.lines.lineNumber(_unit.span(node).start);
  }

  @Override public String sourceText (Tree node) {
    return _unit.span(node).substring(_unit.text);
  }

  @Override public SymbolKind symbolKind (Element symbol) {
    switch (symbol.getKind()) {
    case FIELD:
    case ENUM_CONSTANT:
      return SymbolKind.FIELD;
    case LOCAL_VARIABLE:
    case RESOURCE_VARIABLE:
    case EXCEPTION_PARAMETER:
    case BINDING_VARIABLE:
      return SymbolKind.LOCAL;
    case PARAMETER:
      return SymbolKind.PARAMETER;
    case METHOD:
    case CONSTRUCTOR:
      return SymbolKind.METHOD;
    case RECORD_COMPONENT:
      return SymbolKind.PROPERTY;
    case CLASS:
    case INTERFACE:
    case ENUM:
    case ANNOTATION_TYPE:
    case RECORD:
    case TYPE_PARAMETER:
      return SymbolKind.TYPE;
    case PACKAGE:
    case MODULE:
      return SymbolKind.NAMESPACE;
    default:
      return SymbolKind.OTHER;
    }
  }

  private final JavacUnit _unit;
}
