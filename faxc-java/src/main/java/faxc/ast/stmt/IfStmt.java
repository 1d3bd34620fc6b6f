package faxc.ast.stmt;

import faxc.ast.expr.Expr;

public record IfStmt(
        Expr condition,
        Stmt thenBranch,
        Stmt elseBranch      // может быть null
) implements Stmt {}
