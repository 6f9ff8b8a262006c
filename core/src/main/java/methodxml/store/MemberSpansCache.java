//
// MethodXml - renders method bodies as structured markup
// http://github.com/scaled/codex/blob/master/LICENSE

package methodxml.store;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import methodxml.model.DocumentId;
import methodxml.model.TextSpan;
import methodxml.model.VersionStamp;

/**
 * Remembers the member spans of the most recently requested document version. There is exactly
 * one slot: a request for any other document or version recomputes the spans and replaces the
 * slot.
 *
 * <p>This class is thread safe. The spans are computed outside the lock, so two threads that miss
 * at the same time both compute, and whichever stores last wins.</p>
 *
 * @param <D> the document representation passed to the compute function.
 */
public class MemberSpansCache<D> {

  /** Computes the member spans of a document. */
  public interface Computer<D> {
    ImmutableList<TextSpan> memberSpans (D document);
  }

  public MemberSpansCache (Computer<D> computer) {
    _computer = computer;
  }

  /**
   * Returns the member spans of {@code document}, which has id {@code documentId} and version
   * {@code version}. The cached spans are returned if they were computed for exactly that id and
   * version, otherwise the spans are computed and cached.
   */
  public ImmutableList<TextSpan> getOrCreate (DocumentId documentId, VersionStamp version,
                                              D document) {
    synchronized (_gate) {
      if (_saved != null && _saved.matches(documentId, version)) return _saved.spans;
    }

    ImmutableList<TextSpan> spans = _computer.memberSpans(document);
    save(documentId, version, spans);
    return spans;
  }

  /** Replaces the cached spans with {@code spans}, computed for {@code version} of
    * {@code documentId}. */
  public void save (DocumentId documentId, VersionStamp version, ImmutableList<TextSpan> spans) {
    MemberSpans saved = new MemberSpans(documentId, version, spans);
    synchronized (_gate) {
      _saved = saved;
    }
  }

  /** Returns the contents of the slot, if any. */
  public Optional<MemberSpans> peek () {
    synchronized (_gate) {
      return Optional.ofNullable(_saved);
    }
  }

  /** Empties the slot. */
  public void clear () {
    synchronized (_gate) {
      _saved = null;
    }
  }

  private final Computer<D> _computer;
  private final Object _gate = new Object();
  private MemberSpans _saved;
}
