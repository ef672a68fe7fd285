package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.expr.ExprVisitor;

import java.util.function.Function;

public class ExprFolder<B> implements ExprVisitor<Void, RuntimeException> {
    private final Function<? super Expr<?>, ? extends B> f;
    private final Monoid<B> monoid;
    private final DepthGuard guard;
    private final PropFolder<B> props;
    private final ContractFolder<B> contracts;
    private final TraceFolder<B> traces;
    private final SubStateFolder<B> subStates;
    private B acc;

    public ExprFolder(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc, int maxDepth) {
        this.f = f;
        this.monoid = monoid;
        this.acc = acc;
        this.guard = new DepthGuard(maxDepth);
        this.props = new PropFolder<>(this);
        this.contracts = new ContractFolder<>(this);
        this.subStates = new SubStateFolder<>(this);
        this.traces = new TraceFolder<>(this, contracts, subStates);
    }

    public B getResult() {
        return acc;
    }

    public void fold(Expr<?> expr) {
        guard.enter();
        try {
            expr.accept(this);
        } finally {
            guard.exit();
        }
    }

    public void foldAll(Iterable<? extends Expr<?>> exprs) {
        for (Expr<?> expr : exprs) {
            fold(expr);
        }
    }

    DepthGuard guard() {
        return guard;
    }

    PropFolder<B> props() {
        return props;
    }

    ContractFolder<B> contracts() {
        return contracts;
    }

    TraceFolder<B> traces() {
        return traces;
    }

    SubStateFolder<B> subStates() {
        return subStates;
    }

    private void emit(Expr<?> expr) {
        acc = monoid.combine(acc, f.apply(expr));
    }

    // 書き込みの連鎖はループで辿り、深さを消費しない
    private void foldBuffer(Expr<EBuf> top) {
        Expr<EBuf> current = top;
        while (true) {
            if (current instanceof Expr.WriteWord) {
                Expr.WriteWord write = (Expr.WriteWord) current;
                emit(write);
                fold(write.getIndex());
                fold(write.getValue());
                current = write.getBuffer();
            } else if (current instanceof Expr.WriteByte) {
                Expr.WriteByte write = (Expr.WriteByte) current;
                emit(write);
                fold(write.getIndex());
                fold(write.getValue());
                current = write.getBuffer();
            } else if (current instanceof Expr.CopySlice) {
                Expr.CopySlice copy = (Expr.CopySlice) current;
                emit(copy);
                fold(copy.getSrcOffset());
                fold(copy.getDstOffset());
                fold(copy.getSize());
                fold(copy.getSrc());
                current = copy.getDst();
            } else {
                break;
            }
        }
        fold(current);
    }

    private void foldStorage(Expr.SStore top) {
        Expr<EStorage> current = top;
        while (current instanceof Expr.SStore) {
            Expr.SStore store = (Expr.SStore) current;
            emit(store);
            fold(store.getSlot());
            fold(store.getValue());
            current = store.getStorage();
        }
        fold(current);
    }

    // literals & variables

    @Override
    public Void visitLit(Expr.Lit expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitLitByte(Expr.LitByte expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitVar(Expr.Var expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitGVar(Expr.GVar<?> expr) {
        emit(expr);
        return null;
    }

    // contracts

    @Override
    public Void visitC(Expr.C expr) {
        emit(expr);
        contracts.foldCode(expr.getCode());
        fold(expr.getStorage());
        fold(expr.getBalance());
        return null;
    }

    // bytes

    @Override
    public Void visitIndexWord(Expr.IndexWord expr) {
        emit(expr);
        fold(expr.getIndex());
        fold(expr.getWord());
        return null;
    }

    @Override
    public Void visitEqByte(Expr.EqByte expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitJoinBytes(Expr.JoinBytes expr) {
        emit(expr);
        foldAll(expr.getBytes());
        return null;
    }

    // control flow

    @Override
    public Void visitSuccess(Expr.Success expr) {
        emit(expr);
        props.foldAll(expr.getProps());
        traces.foldTraces(expr.getTraces());
        fold(expr.getReturnData());
        foldAll(expr.getContracts().keySet());
        foldAll(expr.getContracts().values());
        return null;
    }

    @Override
    public Void visitFailure(Expr.Failure expr) {
        emit(expr);
        props.foldAll(expr.getProps());
        traces.foldTraces(expr.getTraces());
        return null;
    }

    @Override
    public Void visitPartial(Expr.Partial expr) {
        emit(expr);
        props.foldAll(expr.getProps());
        traces.foldTraces(expr.getTraces());
        return null;
    }

    @Override
    public Void visitITE(Expr.ITE expr) {
        emit(expr);
        fold(expr.getCondition());
        fold(expr.getWhenTrue());
        fold(expr.getWhenFalse());
        return null;
    }

    // arithmetic

    @Override
    public Void visitAdd(Expr.Add expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitSub(Expr.Sub expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitMul(Expr.Mul expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitDiv(Expr.Div expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitSDiv(Expr.SDiv expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitMod(Expr.Mod expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitSMod(Expr.SMod expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitAddMod(Expr.AddMod expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        fold(expr.getModulus());
        return null;
    }

    @Override
    public Void visitMulMod(Expr.MulMod expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        fold(expr.getModulus());
        return null;
    }

    @Override
    public Void visitExp(Expr.Exp expr) {
        emit(expr);
        fold(expr.getBase());
        fold(expr.getExponent());
        return null;
    }

    @Override
    public Void visitSEx(Expr.SEx expr) {
        emit(expr);
        fold(expr.getBytes());
        fold(expr.getValue());
        return null;
    }

    @Override
    public Void visitMin(Expr.Min expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitMax(Expr.Max expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    // comparisons

    @Override
    public Void visitLT(Expr.LT expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitGT(Expr.GT expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitLEq(Expr.LEq expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitGEq(Expr.GEq expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitSLT(Expr.SLT expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitSGT(Expr.SGT expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitEq(Expr.Eq expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitIsZero(Expr.IsZero expr) {
        emit(expr);
        fold(expr.getValue());
        return null;
    }

    // bits

    @Override
    public Void visitAnd(Expr.And expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitOr(Expr.Or expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitXor(Expr.Xor expr) {
        emit(expr);
        fold(expr.getLhs());
        fold(expr.getRhs());
        return null;
    }

    @Override
    public Void visitNot(Expr.Not expr) {
        emit(expr);
        fold(expr.getValue());
        return null;
    }

    @Override
    public Void visitSHL(Expr.SHL expr) {
        emit(expr);
        fold(expr.getShift());
        fold(expr.getValue());
        return null;
    }

    @Override
    public Void visitSHR(Expr.SHR expr) {
        emit(expr);
        fold(expr.getShift());
        fold(expr.getValue());
        return null;
    }

    @Override
    public Void visitSAR(Expr.SAR expr) {
        emit(expr);
        fold(expr.getShift());
        fold(expr.getValue());
        return null;
    }

    // hashes

    @Override
    public Void visitKeccak(Expr.Keccak expr) {
        emit(expr);
        fold(expr.getBuffer());
        return null;
    }

    @Override
    public Void visitSHA256(Expr.SHA256 expr) {
        emit(expr);
        fold(expr.getBuffer());
        return null;
    }

    // block context

    @Override
    public Void visitOrigin(Expr.Origin expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitCoinbase(Expr.Coinbase expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitTimestamp(Expr.Timestamp expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitBlockNumber(Expr.BlockNumber expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitPrevRandao(Expr.PrevRandao expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitGasLimit(Expr.GasLimit expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitChainId(Expr.ChainId expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitBaseFee(Expr.BaseFee expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitBlockHash(Expr.BlockHash expr) {
        emit(expr);
        fold(expr.getNumber());
        return null;
    }

    // tx context

    @Override
    public Void visitTxValue(Expr.TxValue expr) {
        emit(expr);
        return null;
    }

    // frame context

    @Override
    public Void visitGas(Expr.Gas expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitBalance(Expr.Balance expr) {
        emit(expr);
        return null;
    }

    // code

    @Override
    public Void visitCodeSize(Expr.CodeSize expr) {
        emit(expr);
        fold(expr.getAddress());
        return null;
    }

    @Override
    public Void visitCodeHash(Expr.CodeHash expr) {
        emit(expr);
        fold(expr.getAddress());
        return null;
    }

    // logs

    @Override
    public Void visitLogEntry(Expr.LogEntry expr) {
        emit(expr);
        fold(expr.getAddress());
        fold(expr.getData());
        foldAll(expr.getTopics());
        return null;
    }

    // contract creation

    @Override
    public Void visitCreate(Expr.Create expr) {
        emit(expr);
        fold(expr.getValue());
        fold(expr.getOffset());
        fold(expr.getSize());
        fold(expr.getInitCode());
        foldAll(expr.getLogs());
        fold(expr.getContinuation());
        return null;
    }

    @Override
    public Void visitCreate2(Expr.Create2 expr) {
        emit(expr);
        fold(expr.getValue());
        fold(expr.getOffset());
        fold(expr.getSize());
        fold(expr.getSalt());
        fold(expr.getInitCode());
        foldAll(expr.getLogs());
        fold(expr.getContinuation());
        return null;
    }

    // calls

    @Override
    public Void visitCall(Expr.Call expr) {
        emit(expr);
        fold(expr.getGas());
        expr.getTarget().ifPresent(this::fold);
        fold(expr.getValue());
        fold(expr.getInOffset());
        fold(expr.getInSize());
        fold(expr.getOutOffset());
        fold(expr.getOutSize());
        foldAll(expr.getLogs());
        fold(expr.getContinuation());
        return null;
    }

    @Override
    public Void visitCallCode(Expr.CallCode expr) {
        emit(expr);
        fold(expr.getGas());
        fold(expr.getTarget());
        fold(expr.getValue());
        fold(expr.getInOffset());
        fold(expr.getInSize());
        fold(expr.getOutOffset());
        fold(expr.getOutSize());
        foldAll(expr.getLogs());
        fold(expr.getContinuation());
        return null;
    }

    @Override
    public Void visitDelegateCall(Expr.DelegateCall expr) {
        emit(expr);
        fold(expr.getGas());
        fold(expr.getTarget());
        fold(expr.getValue());
        fold(expr.getInOffset());
        fold(expr.getInSize());
        fold(expr.getOutOffset());
        fold(expr.getOutSize());
        foldAll(expr.getLogs());
        fold(expr.getContinuation());
        return null;
    }

    // addresses

    @Override
    public Void visitLitAddr(Expr.LitAddr expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitSymAddr(Expr.SymAddr expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitWAddr(Expr.WAddr expr) {
        emit(expr);
        fold(expr.getWord());
        return null;
    }

    // storage

    @Override
    public Void visitConcreteStore(Expr.ConcreteStore expr) {
        emit(expr);
        fold(expr.getAddress());
        return null;
    }

    @Override
    public Void visitAbstractStore(Expr.AbstractStore expr) {
        emit(expr);
        fold(expr.getAddress());
        return null;
    }

    @Override
    public Void visitSLoad(Expr.SLoad expr) {
        emit(expr);
        fold(expr.getSlot());
        fold(expr.getStorage());
        return null;
    }

    @Override
    public Void visitSStore(Expr.SStore expr) {
        foldStorage(expr);
        return null;
    }

    // buffers

    @Override
    public Void visitConcreteBuf(Expr.ConcreteBuf expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitAbstractBuf(Expr.AbstractBuf expr) {
        emit(expr);
        return null;
    }

    @Override
    public Void visitReadWord(Expr.ReadWord expr) {
        emit(expr);
        fold(expr.getIndex());
        fold(expr.getBuffer());
        return null;
    }

    @Override
    public Void visitReadByte(Expr.ReadByte expr) {
        emit(expr);
        fold(expr.getIndex());
        fold(expr.getBuffer());
        return null;
    }

    @Override
    public Void visitWriteWord(Expr.WriteWord expr) {
        foldBuffer(expr);
        return null;
    }

    @Override
    public Void visitWriteByte(Expr.WriteByte expr) {
        foldBuffer(expr);
        return null;
    }

    @Override
    public Void visitCopySlice(Expr.CopySlice expr) {
        foldBuffer(expr);
        return null;
    }

    @Override
    public Void visitBufLength(Expr.BufLength expr) {
        emit(expr);
        fold(expr.getBuffer());
        return null;
    }
}
