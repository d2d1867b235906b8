package splc.lower;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import splc.ast.decl.MainDecl;
import splc.ast.expr.*;
import splc.ast.stmt.*;
import splc.lower.InstructionNode.Assign;
import splc.lower.InstructionNode.DoUntil;
import splc.lower.InstructionNode.Halt;
import splc.lower.InstructionNode.If;
import splc.lower.InstructionNode.InlinedCall;
import splc.lower.InstructionNode.Print;
import splc.lower.InstructionNode.Sequence;
import splc.lower.InstructionNode.While;
import splc.sema.CallableSymbol;
import splc.sema.Declaration;
import splc.sema.Scope;
import splc.sema.SymbolTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Replaces every call with a fresh copy of the callee.
 *
 * <p>Callables are expanded callees first, so each one is expanded exactly once into
 * an {@link ExpandedCallable} template with no calls left in it. A call site then
 * evaluates its arguments left to right, each into the matching parameter slot of a
 * new {@link ExpandedCallable.Instance}, and runs the copied body. A function call used
 * as a value is replaced by the copy's result slot.
 */
public final class Inliner {
    private static final Logger LOGGER = Logger.getLogger(Inliner.class.getName());

    private final SymbolTable table;
    private final SymbolFlattener flattener;
    private final int maxDepth;
    private final Map<String, ExpandedCallable> expanded = new HashMap<>();

    public Inliner(SymbolTable table, SymbolFlattener flattener, int maxDepth) {
        this.table = table;
        this.flattener = flattener;
        this.maxDepth = maxDepth;
    }

    /**
     * Expands all callables in {@code graph} order, then lowers the main program.
     *
     * @throws LoweringException {@link ErrorKind#INLINING_DEPTH_EXCEEDED} when a call
     *                           chain is deeper than the configured maximum
     */
    public InstructionNode inline(MainDecl main, CallGraph graph) {
        for (String name : graph.reverseTopologicalOrder()) {
            CallableSymbol sym = table.lookupCallable(name);
            Verify.verifyNotNull(sym, "call graph names unknown callable %s", name);
            expand(sym, graph);
        }
        BodyLowering lowering = new BodyLowering(
                CallFrame.unit(SymbolFlattener.MAIN_UNIT), table.mainScope(), Map.of());
        InstructionNode body = lowering.block(main.body());
        LOGGER.fine(() -> "Expanded " + expanded.size() + " callables, lowered " + SymbolFlattener.MAIN_UNIT);
        return body;
    }

    ExpandedCallable expanded(String name) {
        return expanded.get(name);
    }

    private void expand(CallableSymbol sym, CallGraph graph) {
        int depth = 1;
        String chain = sym.name();
        for (String callee : graph.callees(sym.name())) {
            ExpandedCallable e = expanded.get(callee);
            Verify.verifyNotNull(e, "%s expanded before its callee %s", sym.name(), callee);
            if (e.depth() + 1 > depth) {
                depth = e.depth() + 1;
                chain = sym.name() + " -> " + e.chain();
            }
        }
        if (depth > maxDepth) {
            throw new LoweringException(ErrorKind.INLINING_DEPTH_EXCEEDED,
                    "Inlining depth " + depth + " exceeds the maximum of " + maxDepth + ": " + chain,
                    sym.name());
        }

        CallFrame frame = CallFrame.of(sym.name());
        Map<Declaration, Storage> own = new HashMap<>();
        ImmutableList.Builder<FrameSlot> params = ImmutableList.builder();
        for (Declaration d : sym.frame()) {
            FrameSlot slot = new FrameSlot(frame, d, d.name());
            own.put(d, slot);
            if (d.kind() == Declaration.Kind.PARAM) params.add(slot);
        }

        BodyLowering lowering = new BodyLowering(frame, sym.localScope(), own);
        List<InstructionNode> body = new ArrayList<>();
        body.add(lowering.block(sym.decl().body()));
        FrameSlot result = null;
        if (sym.isFunction()) {
            Lowered value = lowering.expr(sym.decl().returnValue());
            body.addAll(value.prelude());
            result = new FrameSlot(frame, null, SymbolFlattener.RESULT);
            body.add(new Assign(result, value.expr()));
        }

        ExpandedCallable e = new ExpandedCallable(sym.name(), frame, params.build(),
                Sequence.of(body), result, depth, chain);
        expanded.put(sym.name(), e);
        LOGGER.finer(() -> "Expanded " + e.name() + " (depth " + e.depth() + ")");
    }

    record Lowered(List<InstructionNode> prelude, FlatExpr expr) {
        static Lowered pure(FlatExpr expr) {
            return new Lowered(List.of(), expr);
        }

        boolean hasCalls() {
            return !prelude.isEmpty();
        }
    }

    private final class BodyLowering {
        private final CallFrame frame;
        private final Scope scope;
        private final Map<Declaration, Storage> own;

        BodyLowering(CallFrame frame, Scope scope, Map<Declaration, Storage> own) {
            this.frame = frame;
            this.scope = scope;
            this.own = own;
        }

        InstructionNode block(BlockStmt b) {
            List<InstructionNode> out = new ArrayList<>();
            for (Stmt s : b.statements()) stmt(s, out);
            return Sequence.of(out);
        }

        private void stmt(Stmt s, List<InstructionNode> out) {
            if (s instanceof AssignStmt a) {
                Lowered value = expr(a.value());
                out.addAll(value.prelude());
                out.add(new Assign(variable(a.target()), value.expr()));
            } else if (s instanceof PrintStmt p) {
                Lowered value = expr(p.value());
                out.addAll(value.prelude());
                out.add(new Print(value.expr()));
            } else if (s instanceof CallStmt c) {
                call(c.call(), out);
            } else if (s instanceof IfStmt i) {
                Lowered cond = expr(i.condition());
                out.addAll(cond.prelude());
                InstructionNode then = block(i.thenBlock());
                InstructionNode orElse = i.elseBlock() == null ? null : block(i.elseBlock());
                out.add(new If(cond.expr(), then, orElse));
            } else if (s instanceof WhileStmt w) {
                Lowered cond = expr(w.condition());
                out.add(new While(Sequence.of(cond.prelude()), cond.expr(), block(w.body())));
            } else if (s instanceof DoUntilStmt d) {
                InstructionNode body = block(d.body());
                Lowered cond = expr(d.condition());
                out.add(new DoUntil(body, Sequence.of(cond.prelude()), cond.expr()));
            } else if (s instanceof HaltStmt) {
                out.add(new Halt());
            } else if (s instanceof BlockStmt b) {
                out.add(block(b));
            } else {
                throw new IllegalStateException("Unknown stmt: " + s.getClass().getSimpleName());
            }
        }

        Lowered expr(Expr e) {
            if (e instanceof NumberLiteral n) return Lowered.pure(new FlatExpr.Num(n.value()));
            if (e instanceof StringLiteral s) return Lowered.pure(new FlatExpr.Text(s.value()));
            if (e instanceof VarExpr v) return Lowered.pure(new FlatExpr.Ref(variable(v.name())));
            if (e instanceof UnaryExpr u) {
                Lowered operand = expr(u.expr());
                FlatExpr.UnOp op = u.op() == UnaryExpr.Operator.NEG ? FlatExpr.UnOp.NEG : FlatExpr.UnOp.NOT;
                return new Lowered(operand.prelude(), new FlatExpr.Unary(op, operand.expr()));
            }
            if (e instanceof BinaryExpr b) return binary(b);
            if (e instanceof CallExpr c) {
                List<InstructionNode> prelude = new ArrayList<>();
                FrameSlot result = call(c, prelude);
                Verify.verifyNotNull(result, "procedure %s used as a value", c.callee());
                return new Lowered(prelude, new FlatExpr.Ref(result));
            }
            throw new IllegalStateException("Unknown expr: " + e.getClass().getSimpleName());
        }

        private Lowered binary(BinaryExpr b) {
            Lowered left = expr(b.left());
            Lowered right = expr(b.right());
            FlatExpr.BinOp op = FlatExpr.BinOp.valueOf(b.op().name());
            if (!right.hasCalls()) {
                return new Lowered(left.prelude(), new FlatExpr.Binary(left.expr(), op, right.expr()));
            }

            // the right operand's calls run first at run time: pin the left value
            List<InstructionNode> prelude = new ArrayList<>(left.prelude());
            FlatExpr leftValue = left.expr();
            if (!(leftValue instanceof FlatExpr.Num)) {
                FrameSlot spill = new FrameSlot(frame, null, SymbolFlattener.TEMP);
                prelude.add(new Assign(spill, leftValue));
                leftValue = new FlatExpr.Ref(spill);
            }
            prelude.addAll(right.prelude());
            return new Lowered(prelude, new FlatExpr.Binary(leftValue, op, right.expr()));
        }

        private FrameSlot call(CallExpr c, List<InstructionNode> out) {
            ExpandedCallable callee = expanded.get(c.callee());
            Verify.verifyNotNull(callee, "callee %s not expanded", c.callee());
            ExpandedCallable.Instance copy = callee.instantiate();
            Verify.verify(copy.params().size() == c.args().size(),
                    "arity of %s: %s params, %s args", c.callee(), copy.params().size(), c.args().size());

            for (int i = 0; i < c.args().size(); i++) {
                Lowered arg = expr(c.args().get(i));
                out.addAll(arg.prelude());
                out.add(new Assign(copy.params().get(i), arg.expr()));
            }
            out.add(new InlinedCall(callee.name(), copy.frame(), callee.depth(), copy.body()));
            LOGGER.finer(() -> "Inlined " + callee.name() + " into " + frame.owner());
            return copy.result();
        }

        private Storage variable(String name) {
            Declaration d = table.resolveVariable(scope, name);
            Verify.verifyNotNull(d, "unresolved variable %s in %s", name, scope);
            Storage s = own.get(d);
            return s != null ? s : flattener.slotFor(d);
        }
    }
}
