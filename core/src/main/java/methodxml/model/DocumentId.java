//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

import com.google.common.base.Preconditions;

/**
 * Identifies a source document independently of its contents. Two ids are equal if they name the
 * same document.
 */
public final class DocumentId {

  /** The identifier, typically a path or URI. */
  public final String id;

  public DocumentId (String id) {
    this.id = Preconditions.checkNotNull(id);
  }

  @Override public boolean equals (Object other) {
    return (other instanceof DocumentId) && id.equals(((DocumentId)other).id);
  }

  @Override public int hashCode () {
    return id.hashCode();
  }

  @Override public String toString () {
    return id;
  }
}
