package faxc.io;

import faxc.ast.AstDocument;
import faxc.ast.Program;
import faxc.ast.decl.*;
import faxc.ast.expr.*;
import faxc.ast.stmt.*;
import faxc.ast.type.NamedTypeRef;
import faxc.ast.type.TypeRef;
import faxc.diag.CodegenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads a serialized syntax tree (JSON, as produced by the Fax-lang parser)
 * into typed records. The whole document is validated here, before any
 * generation starts: shape errors are {@code MALFORMED_INPUT}, unknown tags
 * are {@code UNRECOGNIZED_NODE}, known tags in the wrong position are
 * {@code UNSUPPORTED_CONSTRUCT}. Every error names the JSON path of the node.
 */
public final class AstReader {
    private static final Logger log = LoggerFactory.getLogger(AstReader.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> TOP_LEVEL_ONLY = Set.of(
            "ImportStatement", "FunctionDeclaration", "StructDeclaration", "Program");
    private static final Set<String> STATEMENTS = Set.of(
            "BlockStatement", "ExpressionStatement", "VariableDeclaration", "IfStatement",
            "WhileStatement", "ForStatement", "BreakStatement", "ContinueStatement", "ReturnStatement");
    private static final Set<String> EXPRESSIONS = Set.of(
            "AssignmentExpression", "BinaryExpression", "UnaryExpression", "CallExpression",
            "MemberExpression", "IndexExpression", "SliceExpression", "Literal", "Identifier",
            "ArrayLiteral");

    private static final TypeRef VOID = new NamedTypeRef("void");

    private final IdentityHashMap<Object, String> locations = new IdentityHashMap<>();

    private AstReader() {}

    public static AstDocument read(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public static AstDocument parse(String json) {
        AstReader reader = new AstReader();
        Program program = reader.readProgram(JsonParser.parse(json), "$");
        log.debug("Read {} nodes", reader.locations.size());
        return new AstDocument(program, reader.locations);
    }

    // ---------- top level ----------

    private Program readProgram(Object json, String path) {
        Map<String, Object> node = object(json, path);
        String kind = kindOf(node, path);
        if (!"Program".equals(kind)) {
            throw CodegenException.malformed("Root node must be Program, got '" + kind + "'", path);
        }

        List<ImportDecl> imports = new ArrayList<>();
        List<Decl> declarations = new ArrayList<>();
        List<Stmt> statements = new ArrayList<>();

        List<Object> body = list(node, "body", path);
        for (int i = 0; i < body.size(); i++) {
            String at = path + ".body[" + i + "]";
            Map<String, Object> n = object(body.get(i), at);
            switch (kindOf(n, at)) {
                case "ImportStatement" -> imports.add(remember(new ImportDecl(importPath(n, at)), at));
                case "FunctionDeclaration" -> declarations.add(readFunction(n, at));
                case "StructDeclaration" -> declarations.add(readStruct(n, at));
                case "VariableDeclaration" -> declarations.add(remember(new GlobalVarDecl(readVarDecl(n, at)), at));
                default -> statements.add(readStmt(n, at));
            }
        }
        return remember(new Program(imports, declarations, statements), path);
    }

    private String importPath(Map<String, Object> n, String path) {
        String p = string(n, path, "path");
        if (p.isBlank() || p.indexOf('"') >= 0 || p.indexOf('\n') >= 0) {
            throw CodegenException.malformed("Invalid import path '" + p + "'", path);
        }
        return p;
    }

    private FunctionDecl readFunction(Map<String, Object> n, String path) {
        String name = identifier(n, path, "name");

        List<FunctionDecl.Param> params = new ArrayList<>();
        List<Object> raw = list(n, "params", path);
        for (int i = 0; i < raw.size(); i++) {
            String at = path + ".params[" + i + "]";
            Map<String, Object> p = object(raw.get(i), at);
            params.add(new FunctionDecl.Param(identifier(p, at, "name"), typeAnnotation(p, at, "type", "param_type")));
        }

        TypeRef returnType = typeAnnotation(n, path, "returnType", "return_type");
        Stmt body = readStmt(required(n, path, "body"), path + ".body");
        if (!(body instanceof BlockStmt block)) {
            throw CodegenException.malformed("Function body must be a BlockStatement", path + ".body");
        }
        return remember(new FunctionDecl(name, returnType == null ? VOID : returnType, params, block), path);
    }

    private StructDecl readStruct(Map<String, Object> n, String path) {
        String name = identifier(n, path, "name");

        List<FieldDecl> fields = new ArrayList<>();
        List<Object> raw = list(n, "fields", path);
        for (int i = 0; i < raw.size(); i++) {
            String at = path + ".fields[" + i + "]";
            Map<String, Object> f = object(raw.get(i), at);
            TypeRef type = typeAnnotation(f, at, "type", "field_type");
            if (type == null) throw CodegenException.malformed("Missing required field 'type'", at);
            fields.add(remember(new FieldDecl(identifier(f, at, "name"), type), at));
        }

        List<FunctionDecl> methods = new ArrayList<>();
        Object rawMethods = field(n, "methods");
        if (rawMethods != null) {
            List<Object> ms = list(n, "methods", path);
            for (int i = 0; i < ms.size(); i++) {
                String at = path + ".methods[" + i + "]";
                Map<String, Object> m = object(ms.get(i), at);
                String kind = kindOf(m, at);
                if (!"FunctionDeclaration".equals(kind)) {
                    throw misplaced(kind, "a method", at);
                }
                methods.add(readFunction(m, at));
            }
        }
        return remember(new StructDecl(name, fields, methods), path);
    }

    // ---------- statements ----------

    private Stmt readStmt(Object json, String path) {
        Map<String, Object> n = object(json, path);
        String kind = kindOf(n, path);
        Stmt s = switch (kind) {
            case "BlockStatement" -> {
                List<Stmt> body = new ArrayList<>();
                List<Object> raw = list(n, "body", path);
                for (int i = 0; i < raw.size(); i++) body.add(readStmt(raw.get(i), path + ".body[" + i + "]"));
                yield new BlockStmt(body);
            }
            case "ExpressionStatement" -> new ExprStmt(expr(n, path, "expression"));
            case "VariableDeclaration" -> readVarDecl(n, path);
            case "IfStatement" -> new IfStmt(
                    expr(n, path, "test"),
                    readStmt(required(n, path, "consequent"), path + ".consequent"),
                    optionalStmt(n, path, "alternate"));
            case "WhileStatement" -> new WhileStmt(
                    expr(n, path, "test"),
                    readStmt(required(n, path, "body"), path + ".body"));
            case "ForStatement" -> new ForStmt(
                    optionalStmt(n, path, "init"),
                    optionalExpr(n, path, "test"),
                    optionalExpr(n, path, "update"),
                    readStmt(required(n, path, "body"), path + ".body"));
            case "BreakStatement" -> new BreakStmt();
            case "ContinueStatement" -> new ContinueStmt();
            case "ReturnStatement" -> new ReturnStmt(optionalExpr(n, path, "argument"));
            default -> throw misplaced(kind, "a statement", path);
        };
        return remember(s, path);
    }

    private VarDeclStmt readVarDecl(Map<String, Object> n, String path) {
        String name = identifier(n, path, "identifier");
        TypeRef type = typeAnnotation(n, path, "dataType", "data_type");
        Object kind = field(n, "kind");
        Object isConstant = field(n, "isConstant", "is_constant");
        if (isConstant != null && !(isConstant instanceof Boolean)) {
            throw CodegenException.malformed("Field 'isConstant' must be a boolean", path);
        }
        boolean constant = "const".equals(kind) || Boolean.TRUE.equals(isConstant);
        return remember(new VarDeclStmt(name, type, constant, optionalExpr(n, path, "initializer")), path);
    }

    private Stmt optionalStmt(Map<String, Object> n, String path, String name) {
        Object v = field(n, name);
        return v == null ? null : readStmt(v, path + "." + name);
    }

    // ---------- expressions ----------

    private Expr readExpr(Object json, String path) {
        Map<String, Object> n = object(json, path);
        String kind = kindOf(n, path);
        Expr e = switch (kind) {
            case "AssignmentExpression" -> new AssignExpr(expr(n, path, "left"), expr(n, path, "right"));
            case "BinaryExpression" -> {
                String op = string(n, path, "operator");
                BinaryExpr.Operator operator = BinaryExpr.Operator.fromSymbol(op).orElseThrow(
                        () -> CodegenException.malformed("Unknown binary operator '" + op + "'", path));
                yield new BinaryExpr(expr(n, path, "left"), operator, expr(n, path, "right"));
            }
            case "UnaryExpression" -> {
                String op = string(n, path, "operator");
                UnaryExpr.Operator operator = UnaryExpr.Operator.fromSymbol(op).orElseThrow(
                        () -> CodegenException.malformed("Unknown unary operator '" + op + "'", path));
                yield new UnaryExpr(operator, expr(n, path, "argument"));
            }
            case "CallExpression" -> new CallExpr(expr(n, path, "callee"), exprList(n, path, "arguments"));
            case "MemberExpression" -> new FieldAccessExpr(expr(n, path, "object"), identifier(n, path, "property"));
            case "IndexExpression" -> new ArrayAccessExpr(expr(n, path, "object"), expr(n, path, "index"));
            case "SliceExpression" -> new SliceExpr(
                    expr(n, path, "object"), optionalExpr(n, path, "start"), optionalExpr(n, path, "end"));
            case "Literal" -> readLiteral(n, path);
            case "Identifier" -> new VarExpr(identifier(n, path, "name"));
            case "ArrayLiteral" -> new ArrayLiteral(exprList(n, path, "elements"));
            default -> throw misplaced(kind, "an expression", path);
        };
        return remember(e, path);
    }

    private Expr readLiteral(Map<String, Object> n, String path) {
        if (!n.containsKey("value")) throw CodegenException.malformed("Missing required field 'value'", path);
        Object v = n.get("value");
        if (v == null) return new NullLiteral();
        if (v instanceof String s) return new StringLiteral(s);
        if (v instanceof Boolean b) return new BoolLiteral(b);
        if (v instanceof BigDecimal d) return new NumberLiteral(d.toString());
        throw CodegenException.malformed("Literal value must be a string, number, boolean or null", path + ".value");
    }

    private Expr expr(Map<String, Object> n, String path, String name) {
        return readExpr(required(n, path, name), path + "." + name);
    }

    private Expr optionalExpr(Map<String, Object> n, String path, String name) {
        Object v = field(n, name);
        return v == null ? null : readExpr(v, path + "." + name);
    }

    private List<Expr> exprList(Map<String, Object> n, String path, String name) {
        List<Expr> out = new ArrayList<>();
        List<Object> raw = list(n, name, path);
        for (int i = 0; i < raw.size(); i++) out.add(readExpr(raw.get(i), path + "." + name + "[" + i + "]"));
        return out;
    }

    // ---------- fields ----------

    private static CodegenException misplaced(String kind, String expected, String path) {
        if (TOP_LEVEL_ONLY.contains(kind)) {
            return CodegenException.unsupported(kind + " is only allowed at top level, not as " + expected, path);
        }
        if (STATEMENTS.contains(kind) || EXPRESSIONS.contains(kind)) {
            return CodegenException.unsupported(kind + " cannot be used as " + expected, path);
        }
        return CodegenException.unrecognized(kind, path);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Object json, String path) {
        if (json instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw CodegenException.malformed("Expected a node object", path);
    }

    private static String kindOf(Map<String, Object> n, String path) {
        if (n.get("type") instanceof String s) return s;
        throw CodegenException.malformed("Node has no string 'type' tag", path);
    }

    /** First non-null value among the alias spellings, or {@code null}. */
    private static Object field(Map<String, Object> n, String... names) {
        for (String name : names) {
            Object v = n.get(name);
            if (v != null) return v;
        }
        return null;
    }

    private static Object required(Map<String, Object> n, String path, String name) {
        Object v = n.get(name);
        if (v == null) throw CodegenException.malformed("Missing required field '" + name + "'", path);
        return v;
    }

    private static String string(Map<String, Object> n, String path, String name) {
        if (required(n, path, name) instanceof String s) return s;
        throw CodegenException.malformed("Field '" + name + "' must be a string", path);
    }

    private static String identifier(Map<String, Object> n, String path, String name) {
        String s = string(n, path, name);
        if (!IDENTIFIER.matcher(s).matches()) {
            throw CodegenException.malformed("Invalid identifier '" + s + "' in field '" + name + "'", path);
        }
        return s;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Map<String, Object> n, String name, String path) {
        if (required(n, path, name) instanceof List<?> l) return (List<Object>) l;
        throw CodegenException.malformed("Field '" + name + "' must be an array", path);
    }

    private static TypeRef typeAnnotation(Map<String, Object> n, String path, String... names) {
        Object v = field(n, names);
        if (v == null) return null;
        if (v instanceof String s) return TypeAnnotationParser.parse(s, path);
        throw CodegenException.malformed("Type annotation '" + names[0] + "' must be a string", path);
    }

    private <T> T remember(T node, String path) {
        locations.put(node, path);
        return node;
    }
}
