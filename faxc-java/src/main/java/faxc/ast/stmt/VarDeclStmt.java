package faxc.ast.stmt;

import faxc.ast.expr.Expr;
import faxc.ast.type.TypeRef;

public record VarDeclStmt(
        String name,
        TypeRef type,        // null => вывод типа (auto)
        boolean constant,
        Expr initializer     // может быть null
) implements Stmt {}
