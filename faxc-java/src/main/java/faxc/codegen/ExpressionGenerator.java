package faxc.codegen;

import faxc.ast.decl.FunctionDecl;
import faxc.ast.expr.*;
import faxc.diag.CodegenException;
import faxc.sema.Mangler;
import faxc.sema.Resolution;

import java.util.List;

/**
 * Renders expressions to C++ text.
 *
 * <p>Every method takes a {@code bare} flag: {@code true} when the caller's
 * own syntax already fixes precedence (statement position, call argument,
 * initializer, index), {@code false} for operands of a binary operator.
 * Only binary expressions parenthesize themselves, and only when not bare;
 * assignments are grouped by the operator that holds them.
 */
public final class ExpressionGenerator {
    private final GenContext ctx;

    public ExpressionGenerator(GenContext ctx) {
        this.ctx = ctx;
    }

    public String render(Expr e, boolean bare) {
        StringBuilder out = new StringBuilder();
        emit(e, bare, out);
        return out.toString();
    }

    public void emit(Expr e, boolean bare, StringBuilder out) {
        if (e instanceof AssignExpr a) {
            emit(a.target(), true, out);
            out.append(" = ");
            emit(a.value(), true, out);
        } else if (e instanceof BinaryExpr b) {
            emitBinary(b, bare, out);
        } else if (e instanceof UnaryExpr u) {
            emitUnary(u, out);
        } else if (e instanceof CallExpr c) {
            emitCall(c, out);
        } else if (e instanceof FieldAccessExpr f) {
            emitPostfixTarget(f.target(), out);
            out.append('.').append(Mangler.mangle(f.field()));
        } else if (e instanceof ArrayAccessExpr a) {
            emitPostfixTarget(a.array(), out);
            out.append('[');
            emit(a.index(), true, out);
            out.append(']');
        } else if (e instanceof SliceExpr s) {
            emitSlice(s, out);
        } else if (e instanceof VarExpr v) {
            emitIdentifier(v.name(), out);
        } else if (e instanceof StringLiteral s) {
            out.append(quote(s.value()));
        } else if (e instanceof BoolLiteral b) {
            out.append(b.value() ? "true" : "false");
        } else if (e instanceof NumberLiteral n) {
            out.append(n.text());
        } else if (e instanceof NullLiteral) {
            out.append("nullptr");
        } else if (e instanceof ArrayLiteral a) {
            out.append('{');
            emitList(a.elements(), out);
            out.append('}');
        } else {
            throw CodegenException.unrecognized(e.getClass().getSimpleName(), ctx.where(e));
        }
    }

    // ---------- operators ----------

    private void emitBinary(BinaryExpr b, boolean bare, StringBuilder out) {
        if (b.op() == BinaryExpr.Operator.MOD_ASSIGN) {
            // остаток для int и float одинаково через fmod, а не "%=" буквально
            out.append("std::fmod(");
            emit(b.left(), true, out);
            out.append(", ");
            emit(b.right(), true, out);
            out.append(')');
            return;
        }
        if (!bare) out.append('(');
        emitOperand(b.left(), out);
        out.append(' ').append(b.op().symbol()).append(' ');
        emitOperand(b.right(), out);
        if (!bare) out.append(')');
    }

    /** (x = f()) != 0: '=' binds weaker than any binary operator. */
    private void emitOperand(Expr operand, StringBuilder out) {
        if (operand instanceof AssignExpr) {
            out.append('(');
            emit(operand, true, out);
            out.append(')');
        } else {
            emit(operand, false, out);
        }
    }

    private void emitUnary(UnaryExpr u, StringBuilder out) {
        if (u.op() == UnaryExpr.Operator.ADDRESS_OF) {
            out.append("&(");
            emit(u.expr(), true, out);
            out.append(')');
            return;
        }
        String symbol = u.op().symbol();
        String arg = render(u.expr(), true);
        out.append(symbol);
        // -(a + b), -(-x), -(-5): без скобок смысл меняется ("--x" это декремент)
        if (needsGrouping(u.expr()) || arg.startsWith(symbol)) {
            out.append('(').append(arg).append(')');
        } else {
            out.append(arg);
        }
    }

    private static boolean needsGrouping(Expr e) {
        return e instanceof BinaryExpr || e instanceof UnaryExpr || e instanceof AssignExpr;
    }

    // ---------- postfix ----------

    /** Object of {@code .field}, {@code [i]} or a call: postfix binds tighter than arithmetic. */
    private void emitPostfixTarget(Expr target, StringBuilder out) {
        if (needsGrouping(target)) {
            out.append('(');
            emit(target, true, out);
            out.append(')');
        } else {
            emit(target, true, out);
        }
    }

    private void emitCall(CallExpr c, StringBuilder out) {
        if (c.callee() instanceof VarExpr v) {
            emitCallee(v.name(), out);
        } else {
            emitPostfixTarget(c.callee(), out);
        }
        out.append('(');
        emitList(c.args(), out);
        out.append(')');
    }

    private void emitCallee(String name, StringBuilder out) {
        Resolution r = ctx.scopes().resolve(name);
        if (r != Resolution.LOCAL && ctx.options().runtimeHelpers().contains(name)) {
            out.append(ctx.options().inRuntime(name));
            return;
        }
        emitIdentifier(name, out);
    }

    private void emitSlice(SliceExpr s, StringBuilder out) {
        Expr target = s.target();
        // объект вычисляется несколько раз, поэтому только lvalue без побочных эффектов
        if (!isSliceable(target)) {
            throw CodegenException.unsupported(
                    "Slice of non-indexable expression " + target.getClass().getSimpleName(), ctx.where(s));
        }
        StringBuilder objText = new StringBuilder();
        emitPostfixTarget(target, objText);
        String obj = objText.toString();
        out.append(ctx.options().inRuntime("Array"))
                .append("<std::decay_t<decltype(").append(obj).append(")>::value_type>(");
        out.append(obj).append(".begin()");
        if (s.start() != null) {
            out.append(" + ");
            emit(s.start(), false, out);
        }
        out.append(", ");
        if (s.end() != null) {
            out.append(obj).append(".begin() + ");
            emit(s.end(), false, out);
        } else {
            out.append(obj).append(".end()");
        }
        out.append(')');
    }

    private static boolean isSliceable(Expr target) {
        if (target instanceof UnaryExpr u) return u.op() == UnaryExpr.Operator.DEREF;
        return target instanceof VarExpr || target instanceof FieldAccessExpr || target instanceof ArrayAccessExpr;
    }

    // ---------- names and literals ----------

    private void emitIdentifier(String name, StringBuilder out) {
        if (FunctionDecl.Param.RECEIVER.equals(name)) {
            out.append("(*this)");
            return;
        }
        String mangled = Mangler.mangle(name);
        Resolution r = ctx.scopes().resolve(name);
        if (r == Resolution.GLOBAL && ctx.region().qualifiesGlobals()) {
            out.append(ctx.options().inProgram(mangled));
        } else {
            out.append(mangled);
        }
    }

    private void emitList(List<Expr> items, StringBuilder out) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) out.append(", ");
            emit(items.get(i), true, out);
        }
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
