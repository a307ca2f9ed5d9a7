package exm.qtc.common.exceptions;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.ast.SourceLoc;

/**
 * Type or nat parameters of a call could not be inferred from the
 * arguments.  An annotation on the call's target resolves this.
 */
public class UnresolvedParameterException extends UserException {

  public UnresolvedParameterException(SourceLoc loc, String function,
                                      List<String> unresolved) {
    super(ErrorKind.UNRESOLVED_PARAMETER, loc, "Could not infer generic "
        + "parameter(s) " + StringUtils.join(unresolved, ", ")
        + " in call to " + function + ": add a type annotation",
        names(function), types());
  }

  public UnresolvedParameterException(SourceLoc loc, String message) {
    super(ErrorKind.UNRESOLVED_PARAMETER, loc, message);
  }

  private static final long serialVersionUID = 1L;
}
