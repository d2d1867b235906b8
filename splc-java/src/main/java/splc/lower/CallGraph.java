package splc.lower;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;

public final class CallGraph {
    private final ImmutableSetMultimap<String, String> callees;
    private final ImmutableList<String> reverseTopologicalOrder;

    CallGraph(ImmutableSetMultimap<String, String> callees, ImmutableList<String> reverseTopologicalOrder) {
        this.callees = callees;
        this.reverseTopologicalOrder = reverseTopologicalOrder;
    }

    public ImmutableSet<String> callees(String caller) {
        return callees.get(caller);
    }

    public ImmutableSet<CallGraphEdge> edges() {
        ImmutableSet.Builder<CallGraphEdge> out = ImmutableSet.builder();
        callees.forEach((caller, callee) -> out.add(new CallGraphEdge(caller, callee)));
        return out.build();
    }

    // callees before callers
    public ImmutableList<String> reverseTopologicalOrder() {
        return reverseTopologicalOrder;
    }
}
