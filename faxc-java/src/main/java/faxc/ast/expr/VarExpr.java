package faxc.ast.expr;

public record VarExpr(String name) implements Expr {}
