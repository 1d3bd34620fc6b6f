package faxc.ast.stmt;

import faxc.ast.expr.Expr;

public record ReturnStmt(Expr value) implements Stmt {}
