package exm.qtc.common.exceptions;

/**
 * Used to signal that the compiler should stop with the given exit code.
 */
public class QTCFatal extends RuntimeException {
  public final int exitCode;

  public QTCFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
