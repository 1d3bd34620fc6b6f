package faxc.ast.type;

public record NamedTypeRef(String name) implements TypeRef {
    @Override
    public String spelling() { return name; }
}
