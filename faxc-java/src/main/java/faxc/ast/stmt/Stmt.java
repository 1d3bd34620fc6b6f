package faxc.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, ExprStmt, VarDeclStmt, IfStmt, WhileStmt, ForStmt,
        BreakStmt, ContinueStmt, ReturnStmt {}
