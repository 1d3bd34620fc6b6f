package faxc.ast.stmt;

import faxc.ast.expr.Expr;

public record ExprStmt(Expr expr) implements Stmt {}
