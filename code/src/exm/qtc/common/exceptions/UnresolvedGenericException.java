package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

public class UnresolvedGenericException extends UserException {

  public UnresolvedGenericException(SourceLoc loc, String definition,
                                    String message) {
    super(ErrorKind.UNRESOLVED_GENERIC, loc, "Cannot specialise "
        + definition + ": " + message, names(definition), types());
  }

  public UnresolvedGenericException(SourceLoc loc, String definition,
                                    Type unresolved) {
    super(ErrorKind.UNRESOLVED_GENERIC, loc, "Cannot specialise "
        + definition + ": argument " + unresolved.typeName()
        + " is not concrete", names(definition), types(unresolved));
  }

  private static final long serialVersionUID = 1L;
}
