package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;

public class UseBeforeDefinitionException extends UserException {

  /**
   * @param maybe true if defined on some paths but not all
   */
  public UseBeforeDefinitionException(SourceLoc loc, String name,
                                      boolean maybe) {
    super(ErrorKind.USE_BEFORE_DEFINITION, loc, "Variable " + name
        + (maybe ? " is not defined on all paths" : " is not yet defined"),
        names(name), types());
  }

  private static final long serialVersionUID = 1L;
}
