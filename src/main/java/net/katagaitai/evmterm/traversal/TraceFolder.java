package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.trace.FrameContext;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.TraceData;
import net.katagaitai.evmterm.trace.TraceTree;
import net.katagaitai.evmterm.trace.Traces;

class TraceFolder<B> implements TraceData.Visitor<Void, RuntimeException>,
        FrameContext.Visitor<Void, RuntimeException> {
    private final ExprFolder<B> exprs;
    private final ContractFolder<B> contracts;
    private final SubStateFolder<B> subStates;

    TraceFolder(ExprFolder<B> exprs, ContractFolder<B> contracts, SubStateFolder<B> subStates) {
        this.exprs = exprs;
        this.contracts = contracts;
        this.subStates = subStates;
    }

    void foldTraces(Traces traces) {
        for (TraceTree tree : traces.getForest()) {
            foldTree(tree);
        }
        exprs.foldAll(traces.getContracts().keySet());
        contracts.foldAll(traces.getContracts().values());
    }

    void foldTree(TraceTree tree) {
        exprs.guard().enter();
        try {
            foldTrace(tree.getLabel());
            for (TraceTree child : tree.getChildren()) {
                foldTree(child);
            }
        } finally {
            exprs.guard().exit();
        }
    }

    void foldTrace(Trace trace) {
        contracts.foldContract(trace.getContract());
        trace.getData().accept(this);
    }

    void foldContext(FrameContext context) {
        context.accept(this);
    }

    @Override
    public Void visitEventTrace(TraceData.EventTrace data) {
        exprs.fold(data.getAddress());
        exprs.fold(data.getData());
        exprs.foldAll(data.getTopics());
        return null;
    }

    @Override
    public Void visitFrameTrace(TraceData.FrameTrace data) {
        foldContext(data.getContext());
        return null;
    }

    @Override
    public Void visitErrorTrace(TraceData.ErrorTrace data) {
        return null;
    }

    @Override
    public Void visitEntryTrace(TraceData.EntryTrace data) {
        return null;
    }

    @Override
    public Void visitReturnTrace(TraceData.ReturnTrace data) {
        exprs.fold(data.getOutput());
        foldContext(data.getContext());
        return null;
    }

    @Override
    public Void visitCreationContext(FrameContext.CreationContext context) {
        exprs.fold(context.getAddress());
        exprs.fold(context.getCodehash());
        exprs.foldAll(context.getCreateReversion().keySet());
        contracts.foldAll(context.getCreateReversion().values());
        subStates.foldSubState(context.getSubState());
        return null;
    }

    @Override
    public Void visitCallContext(FrameContext.CallContext context) {
        exprs.fold(context.getTarget());
        exprs.fold(context.getContext());
        exprs.fold(context.getCodehash());
        exprs.fold(context.getCalldata());
        exprs.foldAll(context.getCallReversion().keySet());
        contracts.foldAll(context.getCallReversion().values());
        subStates.foldSubState(context.getSubState());
        return null;
    }
}
