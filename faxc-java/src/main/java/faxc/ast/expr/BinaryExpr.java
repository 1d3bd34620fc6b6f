package faxc.ast.expr;

import java.util.Optional;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
        EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">="),
        AND("&&"), OR("||"),
        MOD_ASSIGN("%=");

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
