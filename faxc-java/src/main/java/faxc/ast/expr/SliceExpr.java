package faxc.ast.expr;

public record SliceExpr(
        Expr target,
        Expr start,   // null => с начала
        Expr end      // null => до конца
) implements Expr {}
