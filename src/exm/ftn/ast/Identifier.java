package exm.ftn.ast;

import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * A name as written in the source.  Fortran names are not case sensitive,
 * so identifiers compare equal regardless of the case they were written in.
 */
public final class Identifier {
  private final String name;

  public Identifier(String name) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(!name.isEmpty(), "Empty identifier");
    this.name = name;
  }

  /** Name as spelled in source */
  public String getName() {
    return name;
  }

  public int getLength() {
    return name.length();
  }

  private String canonical() {
    return name.toUpperCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Identifier)) {
      return false;
    }
    return canonical().equals(((Identifier)obj).canonical());
  }

  @Override
  public int hashCode() {
    return canonical().hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
