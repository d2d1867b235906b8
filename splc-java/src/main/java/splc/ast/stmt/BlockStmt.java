package splc.ast.stmt;

import java.util.List;

public record BlockStmt(List<Stmt> statements) implements Stmt {
    public static BlockStmt empty() {
        return new BlockStmt(List.of());
    }
}
