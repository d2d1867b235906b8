package splc.lower;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import splc.ast.expr.*;
import splc.ast.stmt.*;
import splc.sema.CallableSymbol;
import splc.sema.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class CallGraphBuilder {
    private static final Logger LOGGER = Logger.getLogger(CallGraphBuilder.class.getName());

    private final SymbolTable table;

    // Tarjan state
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final List<List<String>> components = new ArrayList<>();
    private ImmutableSetMultimap<String, String> callees;
    private int nextIndex;

    public CallGraphBuilder(SymbolTable table) {
        this.table = table;
    }

    public CallGraph build() {
        ImmutableSetMultimap.Builder<String, String> edges = ImmutableSetMultimap.builder();
        for (CallableSymbol c : table.callables()) {
            List<String> calls = new ArrayList<>();
            collectBlock(c.decl().body(), calls);
            if (c.decl().returnValue() != null) collectExpr(c.decl().returnValue(), calls);
            edges.putAll(c.name(), calls);
        }
        callees = edges.build();

        for (CallableSymbol c : table.callables()) {
            if (!index.containsKey(c.name())) strongConnect(c.name());
        }

        ImmutableList.Builder<String> order = ImmutableList.builder();
        for (List<String> scc : components) {
            String first = scc.get(0);
            if (scc.size() > 1 || callees.containsEntry(first, first)) {
                Collections.reverse(scc);
                String cycle = Joiner.on(" -> ").join(scc) + " -> " + scc.get(0);
                throw new LoweringException(ErrorKind.RECURSIVE_DEFINITION,
                        "Recursive definition is not supported: " + cycle, Joiner.on(", ").join(scc));
            }
            order.add(first);
        }

        CallGraph graph = new CallGraph(callees, order.build());
        LOGGER.fine(() -> "Call graph: " + graph.reverseTopologicalOrder().size() + " callables, "
                + callees.size() + " edges");
        return graph;
    }

    private void strongConnect(String v) {
        index.put(v, nextIndex);
        lowLink.put(v, nextIndex);
        nextIndex++;
        stack.push(v);

        for (String w : callees.get(v)) {
            if (!index.containsKey(w)) {
                strongConnect(w);
                lowLink.put(v, Math.min(lowLink.get(v), lowLink.get(w)));
            } else if (stack.contains(w)) {
                lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
            }
        }

        if (lowLink.get(v).equals(index.get(v))) {
            List<String> scc = new ArrayList<>();
            String w;
            do {
                w = stack.pop();
                scc.add(w);
            } while (!w.equals(v));
            components.add(scc);
        }
    }

    // ---------- call collection ----------
    private static void collectBlock(BlockStmt b, List<String> out) {
        for (Stmt s : b.statements()) collectStmt(s, out);
    }

    private static void collectStmt(Stmt s, List<String> out) {
        if (s instanceof CallStmt c) {
            collectExpr(c.call(), out);
        } else if (s instanceof AssignStmt a) {
            collectExpr(a.value(), out);
        } else if (s instanceof PrintStmt p) {
            collectExpr(p.value(), out);
        } else if (s instanceof IfStmt i) {
            collectExpr(i.condition(), out);
            collectBlock(i.thenBlock(), out);
            if (i.elseBlock() != null) collectBlock(i.elseBlock(), out);
        } else if (s instanceof WhileStmt w) {
            collectExpr(w.condition(), out);
            collectBlock(w.body(), out);
        } else if (s instanceof DoUntilStmt d) {
            collectBlock(d.body(), out);
            collectExpr(d.condition(), out);
        } else if (s instanceof BlockStmt b) {
            collectBlock(b, out);
        }
    }

    private static void collectExpr(Expr e, List<String> out) {
        if (e instanceof CallExpr c) {
            out.add(c.callee());
            for (Expr arg : c.args()) collectExpr(arg, out);
        } else if (e instanceof UnaryExpr u) {
            collectExpr(u.expr(), out);
        } else if (e instanceof BinaryExpr b) {
            collectExpr(b.left(), out);
            collectExpr(b.right(), out);
        }
    }
}
