package faxc.ast.expr;

import java.util.Optional;

public record UnaryExpr(
        Operator op,
        Expr expr
) implements Expr {

    public enum Operator {
        NEG("-"), NOT("!"), ADDRESS_OF("&"), DEREF("*");

        private final String symbol;

        Operator(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public static Optional<Operator> fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return Optional.of(op);
            }
            return Optional.empty();
        }
    }
}
