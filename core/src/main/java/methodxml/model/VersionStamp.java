//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.model;

/**
 * Identifies one version of a document's contents. A document gets a new stamp every time its
 * text changes; stamps are only compared for equality.
 */
public final class VersionStamp {

  /** Returns a stamp for {@code version}. */
  public static VersionStamp of (long version) {
    return new VersionStamp(version);
  }

  /** The version number. */
  public final long version;

  @Override public boolean equals (Object other) {
    return (other instanceof VersionStamp) && version == ((VersionStamp)other).version;
  }

  @Override public int hashCode () {
    return Long.hashCode(version);
  }

  @Override public String toString () {
    return "v" + version;
  }

  private VersionStamp (long version) {
    this.version = version;
  }
}
