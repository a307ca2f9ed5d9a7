package exm.qtc.frontend.tree;

import java.util.List;

import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;
import exm.qtc.frontend.tree.TypedStmts.Assign;
import exm.qtc.frontend.tree.TypedStmts.ExprStmt;
import exm.qtc.frontend.tree.TypedStmts.For;
import exm.qtc.frontend.tree.TypedStmts.If;
import exm.qtc.frontend.tree.TypedStmts.Return;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;
import exm.qtc.frontend.tree.TypedStmts.While;

/**
 * Visit every statement and expression of a typed body in order.
 * Subclasses override the hooks they need.
 */
public abstract class TypedTreeWalker {

  protected void visitStmt(TypedStmt stmt) throws UserException {
    // Default: nothing
  }

  protected void visitExpr(TypedExpr expr) throws UserException {
    // Default: nothing
  }

  public void walk(List<TypedStmt> block) throws UserException {
    for (TypedStmt stmt: block) {
      walkStmt(stmt);
    }
  }

  public void walkStmt(TypedStmt stmt) throws UserException {
    visitStmt(stmt);
    switch (stmt.kind()) {
      case ASSIGN:
        walkExpr(((Assign)stmt).value());
        break;
      case EXPR:
        walkExpr(((ExprStmt)stmt).expr());
        break;
      case IF: {
        If ifS = (If)stmt;
        walkExpr(ifS.cond());
        walk(ifS.thenBlock());
        walk(ifS.elseBlock());
        break;
      }
      case WHILE: {
        While whileS = (While)stmt;
        walkExpr(whileS.cond());
        walk(whileS.body());
        break;
      }
      case FOR: {
        For forS = (For)stmt;
        walkExpr(forS.bound());
        walk(forS.body());
        break;
      }
      case RETURN: {
        TypedExpr val = ((Return)stmt).value();
        if (val != null) {
          walkExpr(val);
        }
        break;
      }
      case BREAK:
      case CONTINUE:
        break;
      default:
        throw new QTCRuntimeError("Unknown statement " + stmt.kind());
    }
  }

  public void walkExpr(TypedExpr expr) throws UserException {
    visitExpr(expr);
    for (TypedExpr child: expr.children()) {
      walkExpr(child);
    }
  }
}
