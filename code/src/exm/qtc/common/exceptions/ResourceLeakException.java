package exm.qtc.common.exceptions;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.Type;

/**
 * A linear value could be dropped without being used.
 */
public class ResourceLeakException extends UserException {

  public ResourceLeakException(SourceLoc loc, String name, Type type,
                               String reason) {
    super(ErrorKind.RESOURCE_LEAK, loc, "Linear value " + name + " with "
        + "type " + type.typeName() + " is leaked: " + reason,
        names(name), types(type));
  }

  private static final long serialVersionUID = 1L;
}
