package exm.qtc.frontend.tree;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.OwnershipClass;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.Typed;

/**
 * A local binding created at one program point: a parameter, an
 * assignment target or a loop variable.  The same name may have several
 * bindings in a body if it is reassigned.
 */
public class Binding implements Typed {
  private final String name;
  private final Type type;
  private final OwnershipClass ownership;
  private final SourceLoc definedAt;

  public Binding(String name, Type type, SourceLoc definedAt) {
    this.name = name;
    this.type = type;
    this.ownership = type.classify();
    this.definedAt = definedAt;
  }

  public String name() {
    return name;
  }

  @Override
  public Type type() {
    return type;
  }

  public OwnershipClass ownership() {
    return ownership;
  }

  public SourceLoc definedAt() {
    return definedAt;
  }

  @Override
  public String toString() {
    return name + ": " + type + " (" + ownership.toString().toLowerCase()
           + ") @ " + definedAt;
  }
}
