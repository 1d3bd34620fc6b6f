package faxc.ast.type;

public sealed interface TypeRef
        permits ArrayTypeRef, PointerTypeRef, ReferenceTypeRef, NamedTypeRef {

    /** The annotation as written in the source, e.g. {@code ptr<int>[]}. */
    String spelling();
}
