package splc.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, AssignStmt, PrintStmt, CallStmt,
        IfStmt, WhileStmt, DoUntilStmt, HaltStmt {}
