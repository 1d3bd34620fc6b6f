package faxc.ast.stmt;

import faxc.ast.expr.Expr;

public record ForStmt(
        Stmt init,           // VarDeclStmt или ExprStmt, может быть null
        Expr condition,      // может быть null
        Expr update,         // может быть null
        Stmt body
) implements Stmt {}
