package faxc.ast.decl;

public record ImportDecl(String path) {}
