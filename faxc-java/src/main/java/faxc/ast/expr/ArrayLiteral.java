package faxc.ast.expr;

import java.util.List;

public record ArrayLiteral(List<Expr> elements) implements Expr {}
