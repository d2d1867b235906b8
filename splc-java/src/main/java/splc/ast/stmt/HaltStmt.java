package splc.ast.stmt;

public record HaltStmt() implements Stmt {}
