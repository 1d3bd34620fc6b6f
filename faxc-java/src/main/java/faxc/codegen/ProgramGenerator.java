package faxc.codegen;

import faxc.ast.AstDocument;
import faxc.ast.Program;
import faxc.ast.decl.*;
import faxc.ast.expr.CallExpr;
import faxc.ast.expr.VarExpr;
import faxc.ast.stmt.ExprStmt;
import faxc.ast.stmt.Stmt;
import faxc.sema.GlobalSymbols;
import faxc.sema.Mangler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Assembles one C++ translation unit from a program: includes, the program
 * namespace with every declaration, and a synthesized {@code main} that runs
 * the top-level statements inside a single failure boundary.
 *
 * <p>Instances hold no per-pass state and may be reused; each call to
 * {@link #generate} builds a fresh {@link GenContext}.
 */
public final class ProgramGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProgramGenerator.class);

    public static final String ENTRY_POINT = "main";

    private final CodegenOptions options;

    public ProgramGenerator(CodegenOptions options) {
        this.options = options;
    }

    public ProgramGenerator() {
        this(CodegenOptions.defaults());
    }

    public String generate(Program program) {
        return generate(AstDocument.of(program));
    }

    public String generate(AstDocument document) {
        Program program = document.program();

        // 1) реестр глобальных имён и набор импортов до вывода любого текста
        GlobalSymbols globals = GlobalSymbols.collect(program);
        Set<String> imports = new LinkedHashSet<>();
        for (ImportDecl i : program.imports()) imports.add(i.path());
        log.debug("Registry: {} globals, {} of {} imports distinct",
                globals.size(), imports.size(), program.imports().size());

        GenContext ctx = new GenContext(options, globals, document);
        ExpressionGenerator exprs = new ExpressionGenerator(ctx);
        StatementGenerator stmts = new StatementGenerator(ctx, exprs, new TypeMapper(options, globals));
        SourceWriter out = ctx.out();

        emitHeader(imports, out);

        // 2) namespace с объявлениями
        out.line("namespace " + options.programNamespace() + " {").newline();
        for (Decl d : program.declarations()) {
            emitDecl(d, stmts, out);
            out.newline();
        }
        out.line("} // namespace " + options.programNamespace()).newline();

        // 3) точка входа
        emitEntryPoint(program, globals, ctx, stmts);

        ctx.checkUnwound();
        return out.toString();
    }

    private void emitHeader(Set<String> imports, SourceWriter out) {
        out.line("// Generated by faxc. Do not edit.");
        out.line("#include \"" + options.runtimeHeader() + "\"");
        out.line("#include <cmath>");
        out.line("#include <type_traits>");
        for (String path : imports) out.line("#include \"" + path + ".hpp\"");
        out.newline();
    }

    private void emitDecl(Decl d, StatementGenerator stmts, SourceWriter out) {
        if (d instanceof FunctionDecl f) {
            stmts.emitFunction(f);
        } else if (d instanceof StructDecl s) {
            stmts.emitStruct(s);
        } else if (d instanceof GlobalVarDecl g) {
            out.indent().append(stmts.renderVarDecl(g.variable())).append(';').newline();
        }
    }

    private void emitEntryPoint(Program program, GlobalSymbols globals, GenContext ctx, StatementGenerator stmts) {
        SourceWriter out = ctx.out();
        boolean hasEntryFunction = globals.isFunction(Mangler.mangle(ENTRY_POINT));

        out.line("int main(int argc, char* argv[]) {");
        out.push();
        out.line("(void)argc;");
        out.line("(void)argv;");
        out.line("try {");
        out.push();

        Region prev = ctx.enterRegion(Region.ENTRY_POINT);
        try {
            for (Stmt s : program.statements()) {
                if (hasEntryFunction && isEntryCall(s)) continue;
                stmts.emitStmt(s);
            }
        } finally {
            ctx.restoreRegion(prev);
        }
        if (hasEntryFunction) out.line(options.inProgram(Mangler.mangle(ENTRY_POINT)) + "();");
        out.line("return 0;");

        out.pop();
        out.line("} catch (const std::exception& e) {");
        out.push();
        out.line("std::cerr << \"[FATAL]: \" << e.what() << std::endl;");
        out.line("return 1;");
        out.pop();
        out.line("} catch (...) {");
        out.push();
        out.line("std::cerr << \"[FATAL]: unknown error\" << std::endl;");
        out.line("return 1;");
        out.pop();
        out.line("}");
        out.pop();
        out.line("}");
    }

    /** An explicit top-level {@code main()} call; the entry point adds its own. */
    private static boolean isEntryCall(Stmt s) {
        return s instanceof ExprStmt e
                && e.expr() instanceof CallExpr c
                && c.callee() instanceof VarExpr v
                && ENTRY_POINT.equals(v.name());
    }
}
