package faxc.ast.type;

public record PointerTypeRef(TypeRef target) implements TypeRef {
    @Override
    public String spelling() { return "ptr<" + target.spelling() + ">"; }
}
