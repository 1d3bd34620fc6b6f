package faxc.ast.stmt;

public record ContinueStmt() implements Stmt {}
