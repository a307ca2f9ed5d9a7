package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.common.lang.ParamMode;

/**
 * Function or method definition as registered by the parser.
 */
public class FunctionDef {

  public static class ParamDecl {
    private final String name;
    private final TypeExpr type;
    private final ParamMode mode;

    public ParamDecl(String name, TypeExpr type, ParamMode mode) {
      this.name = name;
      this.type = type;
      this.mode = mode;
    }

    public static ParamDecl borrowed(String name, TypeExpr type) {
      return new ParamDecl(name, type, ParamMode.BORROWED);
    }

    public static ParamDecl owned(String name, TypeExpr type) {
      return new ParamDecl(name, type, ParamMode.OWNED);
    }

    public String name() {
      return name;
    }

    public TypeExpr type() {
      return type;
    }

    public ParamMode mode() {
      return mode;
    }
  }

  public static final String SELF = "self";

  private final String name;
  private final List<String> typeParams;
  private final List<String> natParams;
  private final List<ParamDecl> params;
  /** null means none */
  private final TypeExpr returnType;
  private final List<Stmt> body;
  private final SourceLoc loc;
  /** Mode of implicit receiver for methods, null for free functions */
  private final ParamMode selfMode;

  public FunctionDef(String name, List<String> typeParams,
      List<String> natParams, List<ParamDecl> params, TypeExpr returnType,
      List<Stmt> body, SourceLoc loc, ParamMode selfMode) {
    this.name = name;
    this.typeParams = Collections.unmodifiableList(
                              new ArrayList<String>(typeParams));
    this.natParams = Collections.unmodifiableList(
                              new ArrayList<String>(natParams));
    this.params = Collections.unmodifiableList(
                              new ArrayList<ParamDecl>(params));
    this.returnType = returnType;
    this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
    this.loc = loc;
    this.selfMode = selfMode;
  }

  public static FunctionDef function(String name, List<ParamDecl> params,
      TypeExpr returnType, List<Stmt> body) {
    return generic(name, Collections.<String>emptyList(),
        Collections.<String>emptyList(), params, returnType, body);
  }

  public static FunctionDef generic(String name, List<String> typeParams,
      List<String> natParams, List<ParamDecl> params, TypeExpr returnType,
      List<Stmt> body) {
    return new FunctionDef(name, typeParams, natParams, params, returnType,
                           body, SourceLoc.UNKNOWN, null);
  }

  /**
   * Method of a struct.  Generic parameters of the struct are in scope and
   * must not be repeated in typeParams/natParams.
   */
  public static FunctionDef method(String name, ParamMode selfMode,
      List<ParamDecl> params, TypeExpr returnType, List<Stmt> body) {
    return new FunctionDef(name, Collections.<String>emptyList(),
        Collections.<String>emptyList(), params, returnType, body,
        SourceLoc.UNKNOWN, selfMode);
  }

  public FunctionDef at(SourceLoc newLoc) {
    return new FunctionDef(name, typeParams, natParams, params, returnType,
                           body, newLoc, selfMode);
  }

  public String name() {
    return name;
  }

  public List<String> typeParams() {
    return typeParams;
  }

  public List<String> natParams() {
    return natParams;
  }

  public List<ParamDecl> params() {
    return params;
  }

  public TypeExpr returnType() {
    return returnType;
  }

  public List<Stmt> body() {
    return body;
  }

  public SourceLoc loc() {
    return loc;
  }

  public ParamMode selfMode() {
    return selfMode;
  }

  @Override
  public String toString() {
    return "def " + name + typeParams + natParams;
  }
}
