package faxc.ast.expr;

public record StringLiteral(String value) implements Expr {}
