package faxc.ast.stmt;

public record BreakStmt() implements Stmt {}
