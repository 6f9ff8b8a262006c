//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.store;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import methodxml.model.DocumentId;
import methodxml.model.TextSpan;
import methodxml.model.VersionStamp;

/**
 * The spans of the method-level members (methods, constructors, fields, initializers) of one
 * version of one document.
 */
public final class MemberSpans {

  public final DocumentId documentId;
  public final VersionStamp version;
  public final ImmutableList<TextSpan> spans;

  public MemberSpans (DocumentId documentId, VersionStamp version, ImmutableList<TextSpan> spans) {
    this.documentId = Preconditions.checkNotNull(documentId, "documentId");
    this.version = Preconditions.checkNotNull(version, "version");
    this.spans = Preconditions.checkNotNull(spans, "spans");
  }

  /** Returns whether these spans were computed for {@code version} of {@code documentId}. */
  public boolean matches (DocumentId documentId, VersionStamp version) {
    return this.documentId.equals(documentId) && this.version.equals(version);
  }

  @Override public String toString () {
    return "MemberSpans(" + documentId + ", " + version + ", " + spans + ")";
  }
}
