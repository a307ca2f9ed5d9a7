package exm.qtc.frontend.typecheck;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.InconsistentBindingTypeException;
import exm.qtc.common.lang.Types.Type;

/**
 * Types of local variables on one control flow path.  Copied at branches
 * and reconciled at merge points.
 */
public class TypeEnv {
  private final Map<String, Type> types;
  private boolean reachable;

  public TypeEnv() {
    this(new LinkedHashMap<String, Type>(), true);
  }

  private TypeEnv(Map<String, Type> types, boolean reachable) {
    this.types = types;
    this.reachable = reachable;
  }

  public TypeEnv copy() {
    return new TypeEnv(new LinkedHashMap<String, Type>(types), reachable);
  }

  /** @return null if not assigned on this path */
  public Type lookup(String name) {
    return types.get(name);
  }

  public void define(String name, Type type) {
    types.put(name, type);
  }

  public Set<String> names() {
    return types.keySet();
  }

  public boolean isReachable() {
    return reachable;
  }

  /**
   * Mark that control never continues past this point on this path
   */
  public void markUnreachable() {
    this.reachable = false;
  }

  /**
   * Merge types from predecessor paths.  Unreachable paths are ignored.
   * A variable assigned on only some paths keeps its type: whether it is
   * defined is checked separately.
   * @throws InconsistentBindingTypeException if a variable has different
   *                types on different paths
   */
  public static TypeEnv merge(SourceLoc loc, Iterable<TypeEnv> paths)
      throws InconsistentBindingTypeException {
    TypeEnv res = null;
    for (TypeEnv path: paths) {
      if (!path.reachable) {
        continue;
      }
      if (res == null) {
        res = path.copy();
        continue;
      }
      for (Map.Entry<String, Type> e: path.types.entrySet()) {
        Type prev = res.types.get(e.getKey());
        if (prev == null) {
          res.types.put(e.getKey(), e.getValue());
        } else if (!prev.equals(e.getValue())) {
          throw new InconsistentBindingTypeException(loc, e.getKey(),
                                                     prev, e.getValue());
        }
      }
    }
    if (res == null) {
      // No path continues
      res = new TypeEnv();
      res.reachable = false;
    }
    return res;
  }

  @Override
  public String toString() {
    return (reachable ? "" : "(unreachable) ") + types;
  }
}
