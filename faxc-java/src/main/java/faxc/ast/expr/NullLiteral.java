package faxc.ast.expr;

public record NullLiteral() implements Expr {}
