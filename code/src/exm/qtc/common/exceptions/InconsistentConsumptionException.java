package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

public class InconsistentConsumptionException extends UserException {

  public InconsistentConsumptionException(SourceLoc loc, String name,
                                          Type type, String where) {
    super(ErrorKind.INCONSISTENT_CONSUMPTION, loc, "Linear variable " + name
        + " with type " + type.typeName() + " is consumed on some paths but "
        + "not others " + where, names(name), types(type));
  }

  private static final long serialVersionUID = 1L;
}
