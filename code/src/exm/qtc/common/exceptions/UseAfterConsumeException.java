package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

public class UseAfterConsumeException extends UserException {

  public UseAfterConsumeException(SourceLoc loc, String name, Type type,
                                  boolean maybe) {
    super(ErrorKind.USE_AFTER_CONSUME, loc, "Variable " + name + " with "
        + "type " + type.typeName() + " was already consumed"
        + (maybe ? " on some paths" : ""), names(name), types(type));
  }

  private static final long serialVersionUID = 1L;
}
