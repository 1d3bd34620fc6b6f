package faxc.ast.decl;

import faxc.ast.stmt.VarDeclStmt;

// переменная верхнего уровня: живёт в namespace программы, а не в main
public record GlobalVarDecl(VarDeclStmt variable) implements Decl {}
