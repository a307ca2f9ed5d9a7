package exm.qtc.common.lang;

/**
 * Identifies one function overload.  originalName is the name used at
 * call sites; uniqueName distinguishes overloads of the same name.
 */
public class FnID implements Comparable<FnID> {
  private final String uniqueName;
  private final String originalName;

  public FnID(String uniqueName, String originalName) {
    this.uniqueName = uniqueName;
    this.originalName = originalName;
  }

  public static FnID of(String name) {
    return new FnID(name, name);
  }

  public String uniqueName() {
    return uniqueName;
  }

  public String originalName() {
    return originalName;
  }

  @Override
  public int hashCode() {
    return uniqueName.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FnID &&
        ((FnID)obj).uniqueName.equals(uniqueName);
  }

  @Override
  public int compareTo(FnID o) {
    return uniqueName.compareTo(o.uniqueName);
  }

  @Override
  public String toString() {
    return uniqueName;
  }
}
