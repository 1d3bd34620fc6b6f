package faxc.codegen;

import faxc.ast.Program;
import faxc.ast.decl.*;
import faxc.ast.expr.*;
import faxc.ast.stmt.*;
import faxc.ast.type.NamedTypeRef;
import faxc.ast.type.TypeRef;
import faxc.diag.CodegenException;
import faxc.io.AstReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static faxc.ast.expr.BinaryExpr.Operator.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProgramGeneratorTest {

    private final ProgramGenerator generator = new ProgramGenerator();

    // ---------- builders ----------

    private static TypeRef t(String name) { return new NamedTypeRef(name); }

    private static Expr id(String name) { return new VarExpr(name); }

    private static Expr num(int v) { return new NumberLiteral(Integer.toString(v)); }

    private static Expr call(String name, Expr... args) { return new CallExpr(id(name), List.of(args)); }

    private static Stmt exprStmt(Expr e) { return new ExprStmt(e); }

    private static BlockStmt block(Stmt... stmts) { return new BlockStmt(List.of(stmts)); }

    private static FunctionDecl fn(String name, String returnType, List<FunctionDecl.Param> params, Stmt... body) {
        return new FunctionDecl(name, t(returnType), params, block(body));
    }

    private static GlobalVarDecl global(String name, String type, Expr init) {
        return new GlobalVarDecl(new VarDeclStmt(name, t(type), false, init));
    }

    private static Program program(List<Decl> decls, Stmt... statements) {
        return new Program(List.of(), decls, List.of(statements));
    }

    private static final String ENTRY_TAIL = """
                    return 0;
                } catch (const std::exception& e) {
                    std::cerr << "[FATAL]: " << e.what() << std::endl;
                    return 1;
                } catch (...) {
                    std::cerr << "[FATAL]: unknown error" << std::endl;
                    return 1;
                }
            }
            """;

    // ---------- whole translation unit ----------

    @Test
    void minimal_program_with_main() {
        var p = program(
                List.of(fn("main", "int", List.of(), new ReturnStmt(num(0)))),
                exprStmt(call("main")));

        String expected = """
                // Generated by faxc. Do not edit.
                #include "fax_runtime.hpp"
                #include <cmath>
                #include <type_traits>

                namespace fax_app {

                int main() {
                    return 0;
                }

                } // namespace fax_app

                int main(int argc, char* argv[]) {
                    (void)argc;
                    (void)argv;
                    try {
                        fax_app::main();
                """ + ENTRY_TAIL;

        assertEquals(expected, generator.generate(p));
    }

    @Test
    void empty_program_still_has_entry_point() {
        String out = generator.generate(program(List.of()));
        assertTrue(out.contains("namespace fax_app {\n\n} // namespace fax_app\n"));
        assertTrue(out.contains("    try {\n        return 0;\n"));
        assertFalse(out.contains("fax_app::main();"));
    }

    @Test
    void explicit_main_calls_are_replaced_by_a_single_one() {
        var p = program(
                List.of(fn("main", "void", List.of())),
                exprStmt(call("println", new StringLiteral("start"))),
                exprStmt(call("main")),
                exprStmt(call("main")));

        String out = generator.generate(p);
        assertTrue(out.contains("""
                        fax_std::println("start");
                        fax_app::main();
                        return 0;
                """));
        assertEquals(out.indexOf("fax_app::main();"), out.lastIndexOf("fax_app::main();"));
    }

    @Test
    void main_call_without_declared_main_is_kept_as_is() {
        String out = generator.generate(program(List.of(), exprStmt(call("main"))));
        assertTrue(out.contains("        main();\n"));
        assertFalse(out.contains("fax_app::main();"));
    }

    @Test
    void imports_are_deduplicated_in_first_seen_order() {
        var p = new Program(
                List.of(new ImportDecl("math"), new ImportDecl("io"), new ImportDecl("math")),
                List.of(), List.of());

        String out = generator.generate(p);
        assertTrue(out.contains("""
                #include <type_traits>
                #include "math.hpp"
                #include "io.hpp"

                namespace fax_app {
                """));
        assertEquals(out.indexOf("math.hpp"), out.lastIndexOf("math.hpp"));
    }

    // ---------- names ----------

    @Test
    void reserved_word_is_mangled_everywhere() {
        var p = program(
                List.of(global("class", "int", num(1))),
                exprStmt(call("println", id("class"))));

        String out = generator.generate(p);
        assertTrue(out.contains("\nint class_ = 1;\n"));
        assertTrue(out.contains("fax_std::println(fax_app::class_);"));
        assertFalse(out.contains(" class ="));
    }

    @Test
    void globals_are_qualified_outside_namespace_scope_only() {
        var p = program(
                List.of(
                        global("counter", "int", num(0)),
                        global("total", "int", id("counter")),
                        fn("bump", "void", List.of(),
                                exprStmt(new AssignExpr(id("counter"), new BinaryExpr(id("counter"), ADD, num(1)))))),
                exprStmt(new AssignExpr(id("counter"), num(5))),
                exprStmt(call("bump")));

        String out = generator.generate(p);
        assertTrue(out.contains("\nint total = counter;\n"));
        assertTrue(out.contains("""
                void bump() {
                    fax_app::counter = fax_app::counter + 1;
                }
                """));
        assertTrue(out.contains("""
                        fax_app::counter = 5;
                        fax_app::bump();
                """));
    }

    @Test
    void parameter_shadows_global() {
        var p = program(List.of(
                global("x", "int", num(1)),
                fn("f", "int", List.of(new FunctionDecl.Param("x", t("int"))), new ReturnStmt(id("x"))),
                fn("g", "int", List.of(), new ReturnStmt(id("x")))));

        String out = generator.generate(p);
        assertTrue(out.contains("int f(int x) {\n    return x;\n}\n"));
        assertTrue(out.contains("int g() {\n    return fax_app::x;\n}\n"));
    }

    @Test
    void local_declaration_ends_with_its_block() {
        var p = program(List.of(fn("f", "void", List.of(),
                block(new VarDeclStmt("v", t("int"), false, num(1))),
                exprStmt(call("println", id("v"))))));
        var withGlobal = new Program(List.of(),
                List.of(global("v", "int", null), p.declarations().get(0)), List.of());

        String out = generator.generate(withGlobal);
        assertTrue(out.contains("""
                void f() {
                    {
                        int v = 1;
                    }
                    fax_std::println(fax_app::v);
                }
                """));
    }

    // ---------- records ----------

    @Test
    void struct_with_fields_and_receiver_method() {
        var sum = new FunctionDecl("sum", t("int"),
                List.of(new FunctionDecl.Param("self", null)),
                block(new ReturnStmt(new BinaryExpr(new FieldAccessExpr(id("self"), "x"), ADD, id("y")))));
        var p = program(List.of(
                global("y", "int", num(0)),
                new StructDecl("Point",
                        List.of(new FieldDecl("x", t("int")), new FieldDecl("y", t("int"))),
                        List.of(sum)),
                fn("origin", "Point", List.of(new FunctionDecl.Param("p", t("Point"))), new ReturnStmt(id("p")))));

        String out = generator.generate(p);
        assertTrue(out.contains("""
                struct Point {
                    int x;
                    int y;

                    int sum() {
                        return (*this).x + y;
                    }
                };

                """));
        assertTrue(out.contains("fax_app::Point origin(fax_app::Point p) {"));
    }

    // ---------- statements ----------

    @Test
    void control_flow_layout() {
        var loopBody = block(
                new IfStmt(new BinaryExpr(id("i"), EQ, num(1)),
                        block(new ContinueStmt()),
                        new IfStmt(new BinaryExpr(id("i"), EQ, num(2)),
                                new BreakStmt(),
                                block(exprStmt(call("println", id("i")))))));
        var forLoop = new ForStmt(
                new VarDeclStmt("i", t("int"), false, num(0)),
                new BinaryExpr(id("i"), LT, num(3)),
                new AssignExpr(id("i"), new BinaryExpr(id("i"), ADD, num(1))),
                loopBody);
        var whileLoop = new WhileStmt(new BoolLiteral(true), block(new BreakStmt()));

        String out = generator.generate(program(List.of(fn("f", "void", List.of(), forLoop, whileLoop, new ReturnStmt(null)))));
        assertTrue(out.contains("""
                void f() {
                    for (int i = 0; i < 3; i = i + 1) {
                        if (i == 1) {
                            continue;
                        } else if (i == 2) {
                            break;
                        } else {
                            fax_std::println(i);
                        }
                    }
                    while (true) {
                        break;
                    }
                    return;
                }
                """), out);
    }

    @Test
    void for_with_empty_clauses() {
        var loop = new ForStmt(null, null, null, block(new BreakStmt()));
        String out = generator.generate(program(List.of(fn("f", "void", List.of(), loop))));
        assertTrue(out.contains("    for (;;) {\n        break;\n    }\n"));
    }

    @Test
    void for_initializer_expression_and_const_declaration() {
        var loop = new ForStmt(exprStmt(new AssignExpr(id("i"), num(0))), null, null, block());
        var c = new VarDeclStmt("limit", null, true, new NumberLiteral("2.5"));
        String out = generator.generate(program(List.of(fn("f", "void", List.of(), c, loop))));
        assertTrue(out.contains("    const auto limit = 2.5;\n"));
        assertTrue(out.contains("    for (i = 0;;) {\n    }\n"));
    }

    @Test
    void for_initializer_that_is_not_a_clause_is_unsupported() {
        var loop = new ForStmt(new WhileStmt(new BoolLiteral(true), block()), null, null, block());
        var e = assertThrows(CodegenException.class,
                () -> generator.generate(program(List.of(fn("f", "void", List.of(), loop)))));
        assertEquals(CodegenException.Kind.UNSUPPORTED_CONSTRUCT, e.kind());
    }

    @Test
    void slice_of_literal_reports_its_location() {
        var doc = AstReader.parse("""
                {"type": "Program", "body": [
                  {"type": "ExpressionStatement", "expression": {
                    "type": "SliceExpression",
                    "object": {"type": "Literal", "value": "abc"},
                    "start": {"type": "Literal", "value": 0},
                    "end": {"type": "Literal", "value": 2}}}
                ]}
                """);
        var e = assertThrows(CodegenException.class, () -> generator.generate(doc));
        assertEquals(CodegenException.Kind.UNSUPPORTED_CONSTRUCT, e.kind());
        assertEquals("$.body[0].expression", e.location());
    }

    // ---------- passes ----------

    @Test
    void output_is_deterministic_and_generator_is_reusable() {
        var p = program(
                List.of(global("n", "int", num(3)), fn("main", "void", List.of(), exprStmt(call("println", id("n"))))),
                exprStmt(call("main")));

        String first = generator.generate(p);
        var bad = program(List.of(fn("f", "void", List.of(),
                new ForStmt(new ReturnStmt(null), null, null, block()))));
        assertThrows(CodegenException.class, () -> generator.generate(bad));
        assertEquals(first, generator.generate(p));
    }

    @Test
    void custom_options_rename_namespaces() {
        var options = new CodegenOptions("app", "rt", "rt.hpp", 2, java.util.Set.of("print"));
        var p = program(List.of(global("n", "int", num(1))), exprStmt(call("print", id("n"))));

        String out = new ProgramGenerator(options).generate(p);
        assertTrue(out.contains("#include \"rt.hpp\"\n"));
        assertTrue(out.contains("namespace app {\n"));
        assertTrue(out.contains("  try {\n    rt::print(app::n);\n"));
    }
}
