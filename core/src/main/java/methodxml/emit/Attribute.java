//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.emit;

import com.google.common.base.Preconditions;

/**
 * A name/value pair rendered on an open tag. {@link #EMPTY} stands in for an attribute that has
 * nothing to say and is left off the tag entirely; it is distinct from an attribute whose value
 * is the empty string.
 */
public final class Attribute {

  /** The attribute that is never rendered. */
  public static final Attribute EMPTY = new Attribute();

  /** The attribute name, or null for {@link #EMPTY}. */
  public final String name;

  /** The unescaped attribute value, or null for {@link #EMPTY}. */
  public final String value;

  public Attribute (String name, String value) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.value = Preconditions.checkNotNull(value, "value");
  }

  /** Returns whether this is the {@link #EMPTY} attribute. */
  public boolean isEmpty () {
    return this == EMPTY;
  }

  @Override public boolean equals (Object other) {
    if (this == other) return true;
    if (!(other instanceof Attribute) || isEmpty() || ((Attribute)other).isEmpty()) return false;
    Attribute oattr = (Attribute)other;
    return name.equals(oattr.name) && value.equals(oattr.value);
  }

  @Override public int hashCode () {
    return isEmpty() ? 0 : name.hashCode() ^ value.hashCode();
  }

  @Override public String toString () {
    return isEmpty() ? "<empty>" : name + "=\"" + value + "\"";
  }

  private Attribute () {
    this.name = null;
    this.value = null;
  }
}
