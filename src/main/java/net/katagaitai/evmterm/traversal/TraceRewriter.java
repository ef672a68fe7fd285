package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.state.SubState;
import net.katagaitai.evmterm.trace.FrameContext;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.TraceData;
import net.katagaitai.evmterm.trace.TraceTree;
import net.katagaitai.evmterm.trace.Traces;

import java.util.Map;

class TraceRewriter<X extends Exception> implements TraceData.Visitor<TraceData, X>,
        FrameContext.Visitor<FrameContext, X> {
    private final ExprRewriter<X> exprs;
    private final ContractRewriter<X> contracts;
    private final SubStateRewriter<X> subStates;

    TraceRewriter(ExprRewriter<X> exprs, ContractRewriter<X> contracts, SubStateRewriter<X> subStates) {
        this.exprs = exprs;
        this.contracts = contracts;
        this.subStates = subStates;
    }

    Traces mapTraces(Traces traces) throws X {
        ImmutableList.Builder<TraceTree> forest = ImmutableList.builder();
        for (TraceTree tree : traces.getForest()) {
            forest.add(mapTree(tree));
        }
        Map<Expr<EAddr>, Contract> newContracts = contracts.mapContracts(traces.getContracts());
        return new Traces(forest.build(), newContracts);
    }

    TraceTree mapTree(TraceTree tree) throws X {
        exprs.guard().enter();
        try {
            Trace label = mapTrace(tree.getLabel());
            ImmutableList.Builder<TraceTree> children = ImmutableList.builder();
            for (TraceTree child : tree.getChildren()) {
                children.add(mapTree(child));
            }
            return new TraceTree(label, children.build());
        } finally {
            exprs.guard().exit();
        }
    }

    Trace mapTrace(Trace trace) throws X {
        Contract contract = contracts.mapContract(trace.getContract());
        TraceData data = trace.getData().accept(this);
        return new Trace(trace.getOpIx(), contract, data);
    }

    FrameContext mapContext(FrameContext context) throws X {
        return context.accept(this);
    }

    @Override
    public TraceData visitEventTrace(TraceData.EventTrace data) throws X {
        Expr<EWord> address = exprs.map(data.getAddress());
        Expr<EBuf> buf = exprs.map(data.getData());
        return new TraceData.EventTrace(address, buf, exprs.mapAll(data.getTopics()));
    }

    @Override
    public TraceData visitFrameTrace(TraceData.FrameTrace data) throws X {
        return new TraceData.FrameTrace(mapContext(data.getContext()));
    }

    @Override
    public TraceData visitErrorTrace(TraceData.ErrorTrace data) {
        return data;
    }

    @Override
    public TraceData visitEntryTrace(TraceData.EntryTrace data) {
        return data;
    }

    @Override
    public TraceData visitReturnTrace(TraceData.ReturnTrace data) throws X {
        Expr<EBuf> output = exprs.map(data.getOutput());
        return new TraceData.ReturnTrace(output, mapContext(data.getContext()));
    }

    @Override
    public FrameContext visitCreationContext(FrameContext.CreationContext context) throws X {
        Expr<EAddr> address = exprs.map(context.getAddress());
        Expr<EWord> codehash = exprs.map(context.getCodehash());
        Map<Expr<EAddr>, Contract> reversion = contracts.mapContracts(context.getCreateReversion());
        SubState subState = subStates.mapSubState(context.getSubState());
        return new FrameContext.CreationContext(address, codehash, reversion, subState);
    }

    @Override
    public FrameContext visitCallContext(FrameContext.CallContext context) throws X {
        Expr<EAddr> target = exprs.map(context.getTarget());
        Expr<EAddr> caller = exprs.map(context.getContext());
        Expr<EWord> codehash = exprs.map(context.getCodehash());
        Expr<EBuf> calldata = exprs.map(context.getCalldata());
        Map<Expr<EAddr>, Contract> reversion = contracts.mapContracts(context.getCallReversion());
        SubState subState = subStates.mapSubState(context.getSubState());
        return new FrameContext.CallContext(target, caller, context.getOffset(), context.getSize(), codehash,
                context.getAbi(), calldata, reversion, subState);
    }
}
