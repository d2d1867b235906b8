package splc.ast.expr;

import java.util.List;

public record CallExpr(
        String callee,
        List<Expr> args,
        int line
) implements Expr {}
