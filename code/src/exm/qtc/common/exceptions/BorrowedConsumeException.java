package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

public class BorrowedConsumeException extends UserException {

  public BorrowedConsumeException(SourceLoc loc, String name, Type type) {
    super(ErrorKind.BORROWED_CONSUME, loc, "Borrowed parameter " + name
        + " with type " + type.typeName() + " cannot be consumed: declare it "
        + "as owned", names(name), types(type));
  }

  private static final long serialVersionUID = 1L;
}
