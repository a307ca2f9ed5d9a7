package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

/**
 * A variable has genuinely different types on two paths reaching the
 * same program point.
 */
public class InconsistentBindingTypeException extends UserException {

  public InconsistentBindingTypeException(SourceLoc loc, String name,
                                          Type t1, Type t2) {
    super(ErrorKind.INCONSISTENT_BINDING_TYPE, loc, "Variable " + name
        + " has type " + t1.typeName() + " on one path and type "
        + t2.typeName() + " on another", names(name), types(t1, t2));
  }

  private static final long serialVersionUID = 1L;
}
