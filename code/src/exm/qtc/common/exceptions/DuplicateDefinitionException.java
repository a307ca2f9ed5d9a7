package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;

public class DuplicateDefinitionException extends UserException {

  public DuplicateDefinitionException(SourceLoc loc, String name,
                                      String reason) {
    super(ErrorKind.DUPLICATE_DEFINITION, loc, name + " already defined: "
          + reason, names(name), types());
  }

  private static final long serialVersionUID = 1L;
}
