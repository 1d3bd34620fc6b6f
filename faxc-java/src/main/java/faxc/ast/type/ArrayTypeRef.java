package faxc.ast.type;

public record ArrayTypeRef(TypeRef element) implements TypeRef {
    @Override
    public String spelling() { return element.spelling() + "[]"; }
}
