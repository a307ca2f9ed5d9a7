package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;

public class ArityMismatchException extends UserException {

  /**
   * @param what description of the arguments, e.g. "type arguments to f"
   */
  public ArityMismatchException(SourceLoc loc, String name, String what,
                                int expected, int actual) {
    super(ErrorKind.ARITY_MISMATCH, loc, "Wrong number of " + what
        + ": expected " + expected + " but got " + actual,
        names(name), types());
  }

  private static final long serialVersionUID = 1L;
}
