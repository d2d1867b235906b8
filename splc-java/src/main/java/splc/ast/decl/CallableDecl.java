package splc.ast.decl;

import splc.ast.expr.Expr;
import splc.ast.stmt.BlockStmt;

import java.util.List;

public record CallableDecl(
        String name,
        Kind kind,
        List<String> params,
        List<String> locals,
        BlockStmt body,
        Expr returnValue     // null for procedures
) {
    public enum Kind {
        PROCEDURE, FUNCTION
    }

    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }
}
