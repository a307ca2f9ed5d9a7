package exm.qtc.ui;

public enum ExitCode
{
  SUCCESS(0),
  /** Program rejected by checker */
  ERROR_USER(4),
  /** Bad setting */
  ERROR_COMMAND(5),
  /** Internal error in QTC */
  ERROR_INTERNAL(90);

  final int code;

  ExitCode(int code)
  {
    this.code = code;
  }

  public int code()
  {
    return code;
  }
}
