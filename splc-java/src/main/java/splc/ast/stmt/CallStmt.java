package splc.ast.stmt;

import splc.ast.expr.CallExpr;

public record CallStmt(CallExpr call) implements Stmt {}
