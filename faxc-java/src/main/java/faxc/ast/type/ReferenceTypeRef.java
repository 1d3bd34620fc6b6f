package faxc.ast.type;

public record ReferenceTypeRef(TypeRef target) implements TypeRef {
    @Override
    public String spelling() { return "ref<" + target.spelling() + ">"; }
}
