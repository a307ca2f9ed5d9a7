package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

public class TypeMismatchException
extends UserException
{
  public TypeMismatchException(SourceLoc loc, String message)
  {
    super(ErrorKind.TYPE_MISMATCH, loc, message);
  }

  public TypeMismatchException(SourceLoc loc, String message,
                               Type ...involved) {
    super(ErrorKind.TYPE_MISMATCH, loc, message, names(), types(involved));
  }

  private static final long serialVersionUID = 1L;
}
