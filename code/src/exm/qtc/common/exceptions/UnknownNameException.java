package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;

public class UnknownNameException extends UserException {

  /**
   * @param what the kind of thing looked up, e.g. "function" or "type"
   * @param name the name that could not be found
   */
  public UnknownNameException(SourceLoc loc, String what, String name) {
    super(ErrorKind.UNKNOWN_NAME, loc, "The following " + what + " was not "
        + "defined in the current context: " + name,
        names(name), types());
  }

  private static final long serialVersionUID = 1L;
}
