package faxc.ast.expr;

public sealed interface Expr
        permits AssignExpr, BinaryExpr, UnaryExpr, CallExpr,
        FieldAccessExpr, ArrayAccessExpr, SliceExpr,
        VarExpr, StringLiteral, BoolLiteral, NumberLiteral, NullLiteral,
        ArrayLiteral {}
