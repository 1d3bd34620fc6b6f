package faxc.ast.stmt;

import faxc.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        Stmt body
) implements Stmt {}
