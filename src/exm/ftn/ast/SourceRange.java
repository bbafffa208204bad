package exm.ftn.ast;

import com.google.common.base.Preconditions;

/**
 * Closed range of source: both the begin and end location are part of the
 * range.  Used to underline the whole of an expression in diagnostics.
 */
public final class SourceRange {
  public final SourceLocation begin;
  public final SourceLocation end;

  public SourceRange(SourceLocation begin, SourceLocation end) {
    Preconditions.checkNotNull(begin);
    Preconditions.checkNotNull(end);
    this.begin = begin;
    this.end = end;
  }

  public boolean contains(SourceLocation loc) {
    return begin.compareTo(loc) <= 0 && loc.compareTo(end) <= 0;
  }

  public boolean contains(SourceRange other) {
    return contains(other.begin) && contains(other.end);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceRange)) {
      return false;
    }
    SourceRange other = (SourceRange)obj;
    return begin.equals(other.begin) && end.equals(other.end);
  }

  @Override
  public int hashCode() {
    return begin.hashCode() * 37 + end.hashCode();
  }

  @Override
  public String toString() {
    return "[" + begin + "-" + end + "]";
  }
}
