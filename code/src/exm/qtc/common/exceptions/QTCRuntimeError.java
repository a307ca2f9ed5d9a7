package exm.qtc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or missing feature), never
 * a problem with the user's program.
 * */
public class QTCRuntimeError extends RuntimeException
{
  public QTCRuntimeError(String msg)
  {
    super(msg);
  }

  public QTCRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
