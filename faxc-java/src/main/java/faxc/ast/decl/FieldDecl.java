package faxc.ast.decl;

import faxc.ast.type.TypeRef;

public record FieldDecl(
        String name,
        TypeRef type
) {}
