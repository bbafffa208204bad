package exm.ftn.ast;

/**
 * Simple immutable class to record a line/column position in the
 * source file.  Lines and columns count from 1.
 */
public final class SourceLocation implements Comparable<SourceLocation> {
  public final int line;
  public final int column;

  public SourceLocation(int line, int column) {
    super();
    this.line = line;
    this.column = column;
  }

  /**
   * @param chars
   * @return location chars characters further along the same line
   */
  public SourceLocation advance(int chars) {
    return new SourceLocation(line, column + chars);
  }

  @Override
  public int compareTo(SourceLocation o) {
    if (line != o.line) {
      return Integer.compare(line, o.line);
    }
    return Integer.compare(column, o.column);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceLocation)) {
      return false;
    }
    SourceLocation other = (SourceLocation)obj;
    return line == other.line && column == other.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
