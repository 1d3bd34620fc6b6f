package faxc.ast.decl;

public sealed interface Decl
        permits FunctionDecl, StructDecl, GlobalVarDecl {}
