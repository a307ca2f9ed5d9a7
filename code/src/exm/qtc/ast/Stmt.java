package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Untyped statement node.
 */
public class Stmt {

  public static enum Kind {
    /** targets = expr, optionally annotated.  Several targets unpack a tuple */
    ASSIGN,
    EXPR,
    IF,
    WHILE,
    /** for loopVar in range(expr): body */
    FOR,
    BREAK,
    CONTINUE,
    /** return [expr] */
    RETURN,
  }

  private final Kind kind;
  private final SourceLoc loc;
  private final List<String> targets;
  private final TypeExpr annotation;
  private final Expr expr;
  private final List<Stmt> body;
  private final List<Stmt> elseBody;

  private Stmt(Kind kind, SourceLoc loc, List<String> targets,
      TypeExpr annotation, Expr expr, List<Stmt> body, List<Stmt> elseBody) {
    this.kind = kind;
    this.loc = loc;
    this.targets = Collections.unmodifiableList(
                          new ArrayList<String>(targets));
    this.annotation = annotation;
    this.expr = expr;
    this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
    this.elseBody = Collections.unmodifiableList(
                          new ArrayList<Stmt>(elseBody));
  }

  private static Stmt make(Kind kind, List<String> targets,
      TypeExpr annotation, Expr expr, List<Stmt> body, List<Stmt> elseBody) {
    return new Stmt(kind, SourceLoc.UNKNOWN, targets, annotation, expr,
                    body, elseBody);
  }

  private static final List<String> NO_TARGETS =
                                Collections.<String>emptyList();
  private static final List<Stmt> NO_STMTS = Collections.<Stmt>emptyList();

  public static Stmt assign(String target, Expr value) {
    return make(Kind.ASSIGN, Collections.singletonList(target), null, value,
                NO_STMTS, NO_STMTS);
  }

  public static Stmt assign(String target, TypeExpr annotation, Expr value) {
    return make(Kind.ASSIGN, Collections.singletonList(target), annotation,
                value, NO_STMTS, NO_STMTS);
  }

  public static Stmt unpack(List<String> targets, Expr value) {
    return make(Kind.ASSIGN, targets, null, value, NO_STMTS, NO_STMTS);
  }

  public static Stmt expr(Expr e) {
    return make(Kind.EXPR, NO_TARGETS, null, e, NO_STMTS, NO_STMTS);
  }

  public static Stmt ifThen(Expr cond, List<Stmt> thenBody) {
    return ifElse(cond, thenBody, NO_STMTS);
  }

  public static Stmt ifElse(Expr cond, List<Stmt> thenBody,
                            List<Stmt> elseBody) {
    return make(Kind.IF, NO_TARGETS, null, cond, thenBody, elseBody);
  }

  public static Stmt whileLoop(Expr cond, List<Stmt> body) {
    return make(Kind.WHILE, NO_TARGETS, null, cond, body, NO_STMTS);
  }

  public static Stmt forRange(String loopVar, Expr bound, List<Stmt> body) {
    return make(Kind.FOR, Collections.singletonList(loopVar), null, bound,
                body, NO_STMTS);
  }

  public static Stmt breakStmt() {
    return make(Kind.BREAK, NO_TARGETS, null, null, NO_STMTS, NO_STMTS);
  }

  public static Stmt continueStmt() {
    return make(Kind.CONTINUE, NO_TARGETS, null, null, NO_STMTS, NO_STMTS);
  }

  public static Stmt returnStmt(Expr value) {
    return make(Kind.RETURN, NO_TARGETS, null, value, NO_STMTS, NO_STMTS);
  }

  public static Stmt returnNone() {
    return returnStmt(null);
  }

  public static List<Stmt> block(Stmt ...stmts) {
    return Arrays.asList(stmts);
  }

  public Stmt at(SourceLoc newLoc) {
    return new Stmt(kind, newLoc, targets, annotation, expr, body, elseBody);
  }

  public Kind kind() {
    return kind;
  }

  public SourceLoc loc() {
    return loc;
  }

  /** Assignment targets, or the loop variable of a for loop */
  public List<String> targets() {
    return targets;
  }

  public String loopVar() {
    return targets.get(0);
  }

  /** null if none */
  public TypeExpr annotation() {
    return annotation;
  }

  /**
   * Assigned value, condition, range bound, expression statement or
   * returned value (null for bare return)
   */
  public Expr expr() {
    return expr;
  }

  public List<Stmt> body() {
    return body;
  }

  public List<Stmt> elseBody() {
    return elseBody;
  }

  @Override
  public String toString() {
    switch (kind) {
      case ASSIGN:
        return StringUtils.join(targets, ", ")
            + (annotation == null ? "" : ": " + annotation) + " = " + expr;
      case EXPR:
        return expr.toString();
      case IF:
        return "if " + expr + " ...";
      case WHILE:
        return "while " + expr + " ...";
      case FOR:
        return "for " + loopVar() + " in range(" + expr + ") ...";
      case RETURN:
        return "return" + (expr == null ? "" : " " + expr);
      default:
        return kind.toString().toLowerCase();
    }
  }
}
