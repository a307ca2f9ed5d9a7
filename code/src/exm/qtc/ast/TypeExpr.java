package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Type annotation as written in source: a name applied to type and nat
 * arguments (e.g. array[T, n], Pair[int, qubit], Option[T]), or a tuple
 * of types.  Names are resolved against the scope by the checker.
 */
public class TypeExpr {

  public static enum Kind {
    NAMED,
    TUPLE,
  }

  /**
   * Nat argument as written: a literal or a nat variable name
   */
  public static class NatExpr {
    private final Long value;
    private final String name;

    private NatExpr(Long value, String name) {
      this.value = value;
      this.name = name;
    }

    public static NatExpr lit(long value) {
      return new NatExpr(value, null);
    }

    public static NatExpr var(String name) {
      return new NatExpr(null, name);
    }

    public boolean isLiteral() {
      return value != null;
    }

    public long value() {
      return value;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return isLiteral() ? value.toString() : name;
    }
  }

  private final Kind kind;
  private final String name;
  private final List<TypeExpr> typeArgs;
  private final List<NatExpr> natArgs;
  private final SourceLoc loc;

  private TypeExpr(Kind kind, String name, List<TypeExpr> typeArgs,
                   List<NatExpr> natArgs, SourceLoc loc) {
    this.kind = kind;
    this.name = name;
    this.typeArgs = Collections.unmodifiableList(
                          new ArrayList<TypeExpr>(typeArgs));
    this.natArgs = Collections.unmodifiableList(
                          new ArrayList<NatExpr>(natArgs));
    this.loc = loc;
  }

  public static TypeExpr named(String name) {
    return generic(name, Collections.<TypeExpr>emptyList(),
                   Collections.<NatExpr>emptyList());
  }

  public static TypeExpr generic(String name, List<TypeExpr> typeArgs,
                                 List<NatExpr> natArgs) {
    return new TypeExpr(Kind.NAMED, name, typeArgs, natArgs,
                        SourceLoc.UNKNOWN);
  }

  public static TypeExpr generic(String name, TypeExpr ...typeArgs) {
    return generic(name, Arrays.asList(typeArgs),
                   Collections.<NatExpr>emptyList());
  }

  public static TypeExpr array(TypeExpr elem, NatExpr len) {
    return generic("array", Collections.singletonList(elem),
                   Collections.singletonList(len));
  }

  public static TypeExpr option(TypeExpr inner) {
    return generic("Option", inner);
  }

  public static TypeExpr tuple(TypeExpr ...elems) {
    return new TypeExpr(Kind.TUPLE, null, Arrays.asList(elems),
        Collections.<NatExpr>emptyList(), SourceLoc.UNKNOWN);
  }

  public TypeExpr at(SourceLoc newLoc) {
    return new TypeExpr(kind, name, typeArgs, natArgs, newLoc);
  }

  public Kind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  public List<TypeExpr> typeArgs() {
    return typeArgs;
  }

  public List<NatExpr> natArgs() {
    return natArgs;
  }

  public SourceLoc loc() {
    return loc;
  }

  @Override
  public String toString() {
    if (kind == Kind.TUPLE) {
      return "(" + StringUtils.join(typeArgs, ", ") + ")";
    }
    if (typeArgs.isEmpty() && natArgs.isEmpty()) {
      return name;
    }
    List<Object> args = new ArrayList<Object>(typeArgs);
    args.addAll(natArgs);
    return name + "[" + StringUtils.join(args, ", ") + "]";
  }
}
