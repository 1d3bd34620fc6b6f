package faxc.codegen;

import faxc.ast.decl.FieldDecl;
import faxc.ast.decl.FunctionDecl;
import faxc.ast.decl.StructDecl;
import faxc.ast.stmt.*;
import faxc.diag.CodegenException;
import faxc.sema.Mangler;

import java.util.List;
import java.util.StringJoiner;

/**
 * Writes statements and declarations line by line. Scope and indentation are
 * entered and left in pairs, also when generation fails half way.
 */
public final class StatementGenerator {
    private final GenContext ctx;
    private final SourceWriter out;
    private final ExpressionGenerator exprs;
    private final TypeMapper types;

    public StatementGenerator(GenContext ctx, ExpressionGenerator exprs, TypeMapper types) {
        this.ctx = ctx;
        this.out = ctx.out();
        this.exprs = exprs;
        this.types = types;
    }

    // ---------- statements ----------

    public void emitStmt(Stmt s) {
        if (s instanceof BlockStmt b) {
            out.indent();
            emitBraced(b.statements());
            out.newline();
        } else if (s instanceof ExprStmt e) {
            out.indent().append(exprs.render(e.expr(), true)).append(';').newline();
        } else if (s instanceof VarDeclStmt v) {
            out.indent().append(renderVarDecl(v)).append(';').newline();
        } else if (s instanceof IfStmt i) {
            out.indent();
            emitIf(i);
            out.newline();
        } else if (s instanceof WhileStmt w) {
            out.indent().append("while (").append(exprs.render(w.condition(), true)).append(") ");
            emitBody(w.body());
            out.newline();
        } else if (s instanceof ForStmt f) {
            emitFor(f);
        } else if (s instanceof BreakStmt) {
            out.line("break;");
        } else if (s instanceof ContinueStmt) {
            out.line("continue;");
        } else if (s instanceof ReturnStmt r) {
            if (r.value() == null) out.line("return;");
            else out.line("return " + exprs.render(r.value(), true) + ";");
        } else {
            throw CodegenException.unrecognized(s.getClass().getSimpleName(), ctx.where(s));
        }
    }

    /** Writes {@code { ... }} starting at the current column; leaves the cursor after '}'. */
    private void emitBraced(List<Stmt> statements) {
        out.append('{').newline();
        ctx.scopes().enter();
        out.push();
        try {
            for (Stmt st : statements) emitStmt(st);
        } finally {
            out.pop();
            ctx.scopes().exit();
        }
        out.indent().append('}');
    }

    private void emitBody(Stmt body) {
        if (body instanceof BlockStmt b) emitBraced(b.statements());
        else emitBraced(List.of(body));
    }

    private void emitIf(IfStmt i) {
        out.append("if (").append(exprs.render(i.condition(), true)).append(") ");
        emitBody(i.thenBranch());
        if (i.elseBranch() == null) return;

        out.append(" else ");
        if (i.elseBranch() instanceof IfStmt chained) emitIf(chained);
        else emitBody(i.elseBranch());
    }

    private void emitFor(ForStmt f) {
        // заголовок for открывает свою область: i из init локальна
        ctx.scopes().enter();
        try {
            String init = f.init() == null ? "" : renderForInit(f.init());
            String cond = f.condition() == null ? "" : " " + exprs.render(f.condition(), true);
            String update = f.update() == null ? "" : " " + exprs.render(f.update(), true);
            out.indent().append("for (").append(init).append(';').append(cond).append(';').append(update).append(") ");
            emitBody(f.body());
            out.newline();
        } finally {
            ctx.scopes().exit();
        }
    }

    /** The header slot takes the clause without its terminator; the header supplies the ';'. */
    private String renderForInit(Stmt init) {
        if (init instanceof VarDeclStmt v) return renderVarDecl(v);
        if (init instanceof ExprStmt e) return exprs.render(e.expr(), true);
        throw CodegenException.unsupported(
                "For-loop initializer must be a declaration or an expression, got " + init.getClass().getSimpleName(),
                ctx.where(init));
    }

    /** {@code [const ]<type> <name>[ = <init>]}, without the terminator. */
    public String renderVarDecl(VarDeclStmt v) {
        // объявляем до инициализатора: в C++ имя видно уже в нём
        ctx.scopes().declare(v.name());
        StringBuilder sb = new StringBuilder();
        if (v.constant()) sb.append("const ");
        sb.append(types.map(v.type(), ctx.where(v))).append(' ').append(Mangler.mangle(v.name()));
        if (v.initializer() != null) {
            sb.append(" = ");
            exprs.emit(v.initializer(), true, sb);
        }
        return sb.toString();
    }

    // ---------- declarations ----------

    public void emitFunction(FunctionDecl f) {
        String returnType = types.map(f.returnType(), ctx.where(f));
        Region prev = ctx.enterRegion(Region.FUNCTION_BODY);
        ctx.scopes().enter();
        try {
            StringJoiner params = new StringJoiner(", ");
            for (FunctionDecl.Param p : f.params()) {
                ctx.scopes().declare(p.name());
                if (p.isReceiver()) continue;
                params.add(types.map(p.type(), ctx.where(f)) + " " + Mangler.mangle(p.name()));
            }
            out.indent().append(returnType).append(' ').append(Mangler.mangle(f.name()))
                    .append('(').append(params.toString()).append(") ");
            emitBraced(f.body().statements());
            out.newline();
        } finally {
            ctx.scopes().exit();
            ctx.restoreRegion(prev);
        }
    }

    public void emitStruct(StructDecl s) {
        out.line("struct " + Mangler.mangle(s.name()) + " {");
        // поля видны в методах без квалификации, как локальные
        ctx.scopes().enter();
        out.push();
        try {
            for (FieldDecl field : s.fields()) {
                ctx.scopes().declare(field.name());
                out.line(types.map(field.type(), ctx.where(field)) + " " + Mangler.mangle(field.name()) + ";");
            }
            for (FunctionDecl m : s.methods()) {
                out.newline();
                emitFunction(m);
            }
        } finally {
            out.pop();
            ctx.scopes().exit();
        }
        out.line("};");
    }
}
