package faxc.ast.expr;

/** Numeric literal kept in its source spelling ("42", "3.14", "1E+10"). */
public record NumberLiteral(String text) implements Expr {}
