package faxc.ast.decl;

import java.util.List;

public record StructDecl(
        String name,
        List<FieldDecl> fields,
        List<FunctionDecl> methods
) implements Decl {}
