package exm.qtc.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.InconsistentConsumptionException;
import exm.qtc.common.exceptions.ResourceLeakException;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.util.TernaryLogic.Ternary;

/**
 * Definite assignment and consumption state of every local binding on
 * one control flow path.
 */
public class BindingStates {

  public static class VarState {
    public final Type type;
    public final Ternary assigned;
    public final Ternary consumed;
    public final SourceLoc definedAt;
    /** Borrowed parameter: may not be consumed, need not be */
    public final boolean borrowedParam;

    public VarState(Type type, Ternary assigned, Ternary consumed,
                    SourceLoc definedAt, boolean borrowedParam) {
      this.type = type;
      this.assigned = assigned;
      this.consumed = consumed;
      this.definedAt = definedAt;
      this.borrowedParam = borrowedParam;
    }

    public static VarState defined(Type type, SourceLoc definedAt) {
      return new VarState(type, Ternary.TRUE, Ternary.FALSE, definedAt,
                          false);
    }

    public VarState consume() {
      return new VarState(type, assigned, Ternary.TRUE, definedAt,
                          borrowedParam);
    }

    /**
     * Whether the binding holds a value that has not been consumed
     */
    public Ternary live() {
      if (assigned == Ternary.FALSE || consumed == Ternary.TRUE) {
        return Ternary.FALSE;
      } else if (assigned == Ternary.TRUE && consumed == Ternary.FALSE) {
        return Ternary.TRUE;
      }
      return Ternary.MAYBE;
    }

    public boolean isLinear() {
      return type.classify().isLinear();
    }

    /** Linear value that must be consumed on this path */
    public boolean mustConsume() {
      return isLinear() && !borrowedParam && live().possible();
    }

    @Override
    public String toString() {
      return "assigned=" + assigned + " consumed=" + consumed
           + (borrowedParam ? " borrowed" : "");
    }
  }

  private final Map<String, VarState> states;
  private boolean reachable = true;

  public BindingStates() {
    this.states = new LinkedHashMap<String, VarState>();
  }

  private BindingStates(Map<String, VarState> states, boolean reachable) {
    this.states = new LinkedHashMap<String, VarState>(states);
    this.reachable = reachable;
  }

  public BindingStates copy() {
    return new BindingStates(states, reachable);
  }

  /** @return null if never assigned on this path */
  public VarState get(String name) {
    return states.get(name);
  }

  public void put(String name, VarState state) {
    states.put(name, state);
  }

  public Set<String> names() {
    return states.keySet();
  }

  public boolean isReachable() {
    return reachable;
  }

  public void markUnreachable() {
    reachable = false;
  }

  /**
   * Merge states from predecessor paths.  Unreachable paths are ignored.
   * Linear bindings must be live on all paths or none.
   * @param where description of merge point for error messages
   * @throws ResourceLeakException if a linear value is created on some
   *      paths and still live where they merge
   * @throws InconsistentConsumptionException if a linear value is
   *      consumed on some paths but not others
   */
  public static BindingStates merge(SourceLoc loc, String where,
      List<BindingStates> paths)
      throws ResourceLeakException, InconsistentConsumptionException {
    List<BindingStates> live = new ArrayList<BindingStates>();
    for (BindingStates path: paths) {
      if (path.reachable) {
        live.add(path);
      }
    }
    if (live.isEmpty()) {
      BindingStates res = new BindingStates();
      res.reachable = false;
      return res;
    } else if (live.size() == 1) {
      return live.get(0).copy();
    }

    Set<String> allNames = new LinkedHashSet<String>();
    for (BindingStates path: live) {
      allNames.addAll(path.states.keySet());
    }

    BindingStates res = new BindingStates();
    for (String name: allNames) {
      res.states.put(name, mergeVar(loc, where, name, live));
    }
    return res;
  }

  private static VarState mergeVar(SourceLoc loc, String where, String name,
      List<BindingStates> paths)
      throws ResourceLeakException, InconsistentConsumptionException {
    VarState proto = null;
    for (BindingStates path: paths) {
      if (path.states.containsKey(name)) {
        proto = path.states.get(name);
        break;
      }
    }

    List<VarState> vs = new ArrayList<VarState>(paths.size());
    for (BindingStates path: paths) {
      VarState v = path.states.get(name);
      if (v == null) {
        v = new VarState(proto.type, Ternary.FALSE, Ternary.FALSE,
                         proto.definedAt, false);
      }
      vs.add(v);
    }

    if (proto.isLinear()) {
      checkLinearAgrees(loc, where, name, proto.type, vs);
    }

    Ternary assigned = vs.get(0).assigned;
    Ternary consumed = vs.get(0).consumed;
    boolean borrowed = vs.get(0).borrowedParam;
    boolean deadEverywhere = vs.get(0).live() == Ternary.FALSE;
    SourceLoc definedAt = vs.get(0).definedAt;
    for (VarState v: vs.subList(1, vs.size())) {
      assigned = Ternary.consensus(assigned, v.assigned);
      consumed = Ternary.consensus(consumed, v.consumed);
      borrowed = borrowed || v.borrowedParam;
      deadEverywhere = deadEverywhere && v.live() == Ternary.FALSE;
      if (v.assigned != Ternary.FALSE && definedAt.equals(SourceLoc.UNKNOWN)) {
        definedAt = v.definedAt;
      }
    }
    if (deadEverywhere && assigned.possible()) {
      // Unassigned on some paths, consumed on the rest: still no value
      consumed = Ternary.TRUE;
    }
    return new VarState(proto.type, assigned, consumed, definedAt, borrowed);
  }

  private static void checkLinearAgrees(SourceLoc loc, String where,
      String name, Type type, List<VarState> vs)
      throws ResourceLeakException, InconsistentConsumptionException {
    boolean anyLive = false, anyDead = false, anyUndefined = false;
    boolean anyBorrowed = false, anyOwned = false;
    for (VarState v: vs) {
      if (v.live() != Ternary.FALSE) {
        anyLive = true;
        if (v.borrowedParam) {
          anyBorrowed = true;
        } else {
          anyOwned = true;
        }
      } else {
        anyDead = true;
      }
      if (v.assigned == Ternary.FALSE) {
        anyUndefined = true;
      }
    }
    if (anyLive && anyDead) {
      if (anyUndefined) {
        throw new ResourceLeakException(loc, name, type, "created on some "
            + "paths but not consumed before they merge " + where);
      }
      throw new InconsistentConsumptionException(loc, name, type, where);
    } else if (anyBorrowed && anyOwned) {
      throw new InconsistentConsumptionException(loc, name, type, where);
    }
  }

  @Override
  public String toString() {
    return (reachable ? "" : "(unreachable) ") + states;
  }
}
