package exm.qtc.common.lang;

/**
 * Ownership requirement of a function parameter.
 */
public enum ParamMode {
  /** Callee uses the value and hands it back: no state change for caller */
  BORROWED,
  /** Callee takes ownership: consumes a linear or affine argument */
  OWNED;

  public String keyword() {
    return this == OWNED ? "owned " : "";
  }
}
