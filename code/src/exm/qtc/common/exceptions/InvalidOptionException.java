package exm.qtc.common.exceptions;

/**
 * A compiler setting has an invalid value.
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
