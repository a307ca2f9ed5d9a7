package exm.qtc.common.exceptions;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.ast.SourceLoc;

public class RecursiveMonomorphisationException extends UserException {

  /**
   * @param chain the specialisations in progress, outermost first
   */
  public RecursiveMonomorphisationException(SourceLoc loc, String name,
                                String reason, List<String> chain) {
    super(ErrorKind.RECURSIVE_MONOMORPHISATION, loc, "Specialisation of "
        + name + " does not terminate (" + reason + "): "
        + StringUtils.join(chain, " -> "), chain, types());
  }

  private static final long serialVersionUID = 1L;
}
