package exm.qtc.frontend.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.TypeBinding;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;

/**
 * Typed statements.  Control flow structure is the same as in the input
 * tree; unreachable statements are dropped.
 */
public class TypedStmts {

  public static enum StmtKind {
    ASSIGN,
    EXPR,
    IF,
    WHILE,
    FOR,
    BREAK,
    CONTINUE,
    RETURN,
  }

  public abstract static class TypedStmt {
    protected final SourceLoc loc;

    protected TypedStmt(SourceLoc loc) {
      this.loc = loc;
    }

    public SourceLoc loc() {
      return loc;
    }

    public abstract StmtKind kind();

    public abstract TypedStmt bindTypeVars(TypeBinding binding);
  }

  /**
   * Assignment to one variable, or unpacking of a tuple into several
   */
  public static class Assign extends TypedStmt {
    private final List<String> targets;
    private final List<Type> targetTypes;
    private final TypedExpr value;

    public Assign(SourceLoc loc, List<String> targets,
                  List<Type> targetTypes, TypedExpr value) {
      super(loc);
      assert(targets.size() == targetTypes.size());
      this.targets = Collections.unmodifiableList(
                              new ArrayList<String>(targets));
      this.targetTypes = Collections.unmodifiableList(
                              new ArrayList<Type>(targetTypes));
      this.value = value;
    }

    public List<String> targets() {
      return targets;
    }

    public List<Type> targetTypes() {
      return targetTypes;
    }

    public TypedExpr value() {
      return value;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.ASSIGN;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new Assign(loc, targets,
          Types.bindTypeVars(targetTypes, binding),
          value.bindTypeVars(binding));
    }

    @Override
    public String toString() {
      return StringUtils.join(targets, ", ") + " = " + value;
    }
  }

  public static class ExprStmt extends TypedStmt {
    private final TypedExpr expr;

    public ExprStmt(SourceLoc loc, TypedExpr expr) {
      super(loc);
      this.expr = expr;
    }

    public TypedExpr expr() {
      return expr;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.EXPR;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new ExprStmt(loc, expr.bindTypeVars(binding));
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }

  public static class If extends TypedStmt {
    private final TypedExpr cond;
    private final List<TypedStmt> thenBlock;
    private final List<TypedStmt> elseBlock;

    public If(SourceLoc loc, TypedExpr cond, List<TypedStmt> thenBlock,
              List<TypedStmt> elseBlock) {
      super(loc);
      this.cond = cond;
      this.thenBlock = Collections.unmodifiableList(
                              new ArrayList<TypedStmt>(thenBlock));
      this.elseBlock = Collections.unmodifiableList(
                              new ArrayList<TypedStmt>(elseBlock));
    }

    public TypedExpr cond() {
      return cond;
    }

    public List<TypedStmt> thenBlock() {
      return thenBlock;
    }

    public List<TypedStmt> elseBlock() {
      return elseBlock;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.IF;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new If(loc, cond.bindTypeVars(binding),
          bindAll(thenBlock, binding), bindAll(elseBlock, binding));
    }

    @Override
    public String toString() {
      return "if " + cond;
    }
  }

  public static class While extends TypedStmt {
    private final TypedExpr cond;
    private final List<TypedStmt> body;

    public While(SourceLoc loc, TypedExpr cond, List<TypedStmt> body) {
      super(loc);
      this.cond = cond;
      this.body = Collections.unmodifiableList(
                              new ArrayList<TypedStmt>(body));
    }

    public TypedExpr cond() {
      return cond;
    }

    public List<TypedStmt> body() {
      return body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.WHILE;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new While(loc, cond.bindTypeVars(binding),
                       bindAll(body, binding));
    }

    @Override
    public String toString() {
      return "while " + cond;
    }
  }

  /**
   * for loopVar in range(bound)
   */
  public static class For extends TypedStmt {
    private final String loopVar;
    private final TypedExpr bound;
    private final List<TypedStmt> body;

    public For(SourceLoc loc, String loopVar, TypedExpr bound,
               List<TypedStmt> body) {
      super(loc);
      this.loopVar = loopVar;
      this.bound = bound;
      this.body = Collections.unmodifiableList(
                              new ArrayList<TypedStmt>(body));
    }

    public String loopVar() {
      return loopVar;
    }

    /** Loop variable has same type as bound */
    public Type loopVarType() {
      return bound.type();
    }

    public TypedExpr bound() {
      return bound;
    }

    public List<TypedStmt> body() {
      return body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.FOR;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new For(loc, loopVar, bound.bindTypeVars(binding),
                     bindAll(body, binding));
    }

    @Override
    public String toString() {
      return "for " + loopVar + " in range(" + bound + ")";
    }
  }

  public static class Break extends TypedStmt {
    public Break(SourceLoc loc) {
      super(loc);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.BREAK;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    public String toString() {
      return "break";
    }
  }

  public static class Continue extends TypedStmt {
    public Continue(SourceLoc loc) {
      super(loc);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.CONTINUE;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    public String toString() {
      return "continue";
    }
  }

  public static class Return extends TypedStmt {
    /** null for bare return */
    private final TypedExpr value;

    public Return(SourceLoc loc, TypedExpr value) {
      super(loc);
      this.value = value;
    }

    public TypedExpr value() {
      return value;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.RETURN;
    }

    @Override
    public TypedStmt bindTypeVars(TypeBinding binding) {
      return new Return(loc,
          value == null ? null : value.bindTypeVars(binding));
    }

    @Override
    public String toString() {
      return "return" + (value == null ? "" : " " + value);
    }
  }

  public static List<TypedStmt> bindAll(List<TypedStmt> stmts,
                                        TypeBinding binding) {
    List<TypedStmt> res = new ArrayList<TypedStmt>(stmts.size());
    for (TypedStmt s: stmts) {
      res.add(s.bindTypeVars(binding));
    }
    return res;
  }
}
