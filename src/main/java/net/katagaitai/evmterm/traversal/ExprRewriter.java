package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EByte;
import net.katagaitai.evmterm.expr.EContract;
import net.katagaitai.evmterm.expr.EEnd;
import net.katagaitai.evmterm.expr.ELog;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.expr.ExprVisitor;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.trace.Traces;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bottom-up rewrite of one expression tree. Operands are rewritten first, left to right; the node is rebuilt from
 * them with the same shape and only then handed to the mapper. Leaves go to the mapper directly.
 * <p>
 * A mapper failure propagates out of {@link #map} untouched, so nothing above the failing node is rebuilt. The pure
 * map is this class with an {@link ExprMapper}, which cannot throw.
 * <p>
 * Not thread-safe; create one per rewrite.
 */
public class ExprRewriter<X extends Exception> implements ExprVisitor<Expr<?>, X> {
    private final ExprMapperM<X> mapper;
    private final DepthGuard guard;
    private final PropRewriter<X> props;
    private final ContractRewriter<X> contracts;
    private final TraceRewriter<X> traces;
    private final SubStateRewriter<X> subStates;

    public ExprRewriter(ExprMapperM<X> mapper, int maxDepth) {
        this.mapper = mapper;
        this.guard = new DepthGuard(maxDepth);
        this.props = new PropRewriter<>(this);
        this.contracts = new ContractRewriter<>(this);
        this.subStates = new SubStateRewriter<>(this);
        this.traces = new TraceRewriter<>(this, contracts, subStates);
    }

    public <A> Expr<A> map(Expr<A> expr) throws X {
        guard.enter();
        try {
            @SuppressWarnings("unchecked")
            Expr<A> result = (Expr<A>) expr.accept(this);
            return result;
        } finally {
            guard.exit();
        }
    }

    public <A> ImmutableList<Expr<A>> mapAll(List<? extends Expr<A>> exprs) throws X {
        ImmutableList.Builder<Expr<A>> builder = ImmutableList.builder();
        for (Expr<A> expr : exprs) {
            builder.add(map(expr));
        }
        return builder.build();
    }

    public <A> Optional<Expr<A>> mapOptional(Optional<? extends Expr<A>> expr) throws X {
        if (expr.isPresent()) {
            return Optional.of(map(expr.get()));
        }
        return Optional.empty();
    }

    DepthGuard guard() {
        return guard;
    }

    PropRewriter<X> props() {
        return props;
    }

    ContractRewriter<X> contracts() {
        return contracts;
    }

    TraceRewriter<X> traces() {
        return traces;
    }

    SubStateRewriter<X> subStates() {
        return subStates;
    }

    private <A> Expr<A> apply(Expr<A> rebuilt) throws X {
        Expr<?> result = mapper.apply(rebuilt);
        if (result == null) {
            throw new IllegalStateException("mapper returned null for " + rebuilt);
        }
        if (result.getKind() != rebuilt.getKind()) {
            throw new IllegalStateException(
                    String.format("mapper changed kind %s to %s: %s", rebuilt.getKind(), result.getKind(), result));
        }
        @SuppressWarnings("unchecked")
        Expr<A> typed = (Expr<A>) result;
        return typed;
    }

    // 書き込みの連鎖は上から下へオペランドを書き換え、下から上へ組み直す
    private Expr<EBuf> mapBuffer(Expr<EBuf> top) throws X {
        List<Expr<EBuf>> spine = new ArrayList<>();
        List<Expr<?>[]> operands = new ArrayList<>();
        Expr<EBuf> current = top;
        while (true) {
            if (current instanceof Expr.WriteWord) {
                Expr.WriteWord write = (Expr.WriteWord) current;
                spine.add(write);
                operands.add(new Expr<?>[]{map(write.getIndex()), map(write.getValue())});
                current = write.getBuffer();
            } else if (current instanceof Expr.WriteByte) {
                Expr.WriteByte write = (Expr.WriteByte) current;
                spine.add(write);
                operands.add(new Expr<?>[]{map(write.getIndex()), map(write.getValue())});
                current = write.getBuffer();
            } else if (current instanceof Expr.CopySlice) {
                Expr.CopySlice copy = (Expr.CopySlice) current;
                spine.add(copy);
                operands.add(new Expr<?>[]{
                        map(copy.getSrcOffset()), map(copy.getDstOffset()), map(copy.getSize()), map(copy.getSrc())});
                current = copy.getDst();
            } else {
                break;
            }
        }
        Expr<EBuf> result = map(current);
        for (int i = spine.size() - 1; i >= 0; i--) {
            result = apply(rebuildBuffer(spine.get(i), operands.get(i), result));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Expr<EBuf> rebuildBuffer(Expr<EBuf> node, Expr<?>[] ops, Expr<EBuf> buffer) {
        if (node instanceof Expr.WriteWord) {
            return new Expr.WriteWord((Expr<EWord>) ops[0], (Expr<EWord>) ops[1], buffer);
        }
        if (node instanceof Expr.WriteByte) {
            return new Expr.WriteByte((Expr<EWord>) ops[0], (Expr<EByte>) ops[1], buffer);
        }
        return new Expr.CopySlice((Expr<EWord>) ops[0], (Expr<EWord>) ops[1], (Expr<EWord>) ops[2],
                (Expr<EBuf>) ops[3], buffer);
    }

    private Expr<EStorage> mapStorage(Expr.SStore top) throws X {
        List<Expr<EWord>> slots = new ArrayList<>();
        List<Expr<EWord>> values = new ArrayList<>();
        Expr<EStorage> current = top;
        while (current instanceof Expr.SStore) {
            Expr.SStore store = (Expr.SStore) current;
            slots.add(map(store.getSlot()));
            values.add(map(store.getValue()));
            current = store.getStorage();
        }
        Expr<EStorage> result = map(current);
        for (int i = slots.size() - 1; i >= 0; i--) {
            result = apply(new Expr.SStore(slots.get(i), values.get(i), result));
        }
        return result;
    }

    // literals & variables

    @Override
    public Expr<?> visitLit(Expr.Lit expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitLitByte(Expr.LitByte expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitVar(Expr.Var expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitGVar(Expr.GVar<?> expr) throws X {
        return apply(expr);
    }

    // contracts

    @Override
    public Expr<?> visitC(Expr.C expr) throws X {
        ContractCode code = contracts.mapCode(expr.getCode());
        Expr<EStorage> storage = map(expr.getStorage());
        Expr<EWord> balance = map(expr.getBalance());
        return apply(new Expr.C(code, storage, balance, expr.getNonce()));
    }

    // bytes

    @Override
    public Expr<?> visitIndexWord(Expr.IndexWord expr) throws X {
        Expr<EWord> index = map(expr.getIndex());
        Expr<EWord> word = map(expr.getWord());
        return apply(new Expr.IndexWord(index, word));
    }

    @Override
    public Expr<?> visitEqByte(Expr.EqByte expr) throws X {
        Expr<EByte> lhs = map(expr.getLhs());
        Expr<EByte> rhs = map(expr.getRhs());
        return apply(new Expr.EqByte(lhs, rhs));
    }

    @Override
    public Expr<?> visitJoinBytes(Expr.JoinBytes expr) throws X {
        return apply(new Expr.JoinBytes(mapAll(expr.getBytes())));
    }

    // control flow

    @Override
    public Expr<?> visitSuccess(Expr.Success expr) throws X {
        ImmutableList<Prop> newProps = props.mapAll(expr.getProps());
        Traces newTraces = traces.mapTraces(expr.getTraces());
        Expr<EBuf> returnData = map(expr.getReturnData());
        Map<Expr<EAddr>, Expr<EContract>> newContracts = Maps.newLinkedHashMap();
        for (Map.Entry<Expr<EAddr>, Expr<EContract>> entry : expr.getContracts().entrySet()) {
            Expr<EAddr> key = map(entry.getKey());
            newContracts.put(key, map(entry.getValue()));
        }
        return apply(new Expr.Success(newProps, newTraces, returnData, newContracts));
    }

    @Override
    public Expr<?> visitFailure(Expr.Failure expr) throws X {
        ImmutableList<Prop> newProps = props.mapAll(expr.getProps());
        Traces newTraces = traces.mapTraces(expr.getTraces());
        return apply(new Expr.Failure(newProps, newTraces, expr.getError()));
    }

    @Override
    public Expr<?> visitPartial(Expr.Partial expr) throws X {
        ImmutableList<Prop> newProps = props.mapAll(expr.getProps());
        Traces newTraces = traces.mapTraces(expr.getTraces());
        return apply(new Expr.Partial(newProps, newTraces, expr.getReason()));
    }

    @Override
    public Expr<?> visitITE(Expr.ITE expr) throws X {
        Expr<EWord> condition = map(expr.getCondition());
        Expr<EEnd> whenTrue = map(expr.getWhenTrue());
        Expr<EEnd> whenFalse = map(expr.getWhenFalse());
        return apply(new Expr.ITE(condition, whenTrue, whenFalse));
    }

    // arithmetic

    @Override
    public Expr<?> visitAdd(Expr.Add expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Add(lhs, rhs));
    }

    @Override
    public Expr<?> visitSub(Expr.Sub expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Sub(lhs, rhs));
    }

    @Override
    public Expr<?> visitMul(Expr.Mul expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Mul(lhs, rhs));
    }

    @Override
    public Expr<?> visitDiv(Expr.Div expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Div(lhs, rhs));
    }

    @Override
    public Expr<?> visitSDiv(Expr.SDiv expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.SDiv(lhs, rhs));
    }

    @Override
    public Expr<?> visitMod(Expr.Mod expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Mod(lhs, rhs));
    }

    @Override
    public Expr<?> visitSMod(Expr.SMod expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.SMod(lhs, rhs));
    }

    @Override
    public Expr<?> visitAddMod(Expr.AddMod expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        Expr<EWord> modulus = map(expr.getModulus());
        return apply(new Expr.AddMod(lhs, rhs, modulus));
    }

    @Override
    public Expr<?> visitMulMod(Expr.MulMod expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        Expr<EWord> modulus = map(expr.getModulus());
        return apply(new Expr.MulMod(lhs, rhs, modulus));
    }

    @Override
    public Expr<?> visitExp(Expr.Exp expr) throws X {
        Expr<EWord> base = map(expr.getBase());
        Expr<EWord> exponent = map(expr.getExponent());
        return apply(new Expr.Exp(base, exponent));
    }

    @Override
    public Expr<?> visitSEx(Expr.SEx expr) throws X {
        Expr<EWord> bytes = map(expr.getBytes());
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.SEx(bytes, value));
    }

    @Override
    public Expr<?> visitMin(Expr.Min expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Min(lhs, rhs));
    }

    @Override
    public Expr<?> visitMax(Expr.Max expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Max(lhs, rhs));
    }

    // comparisons

    @Override
    public Expr<?> visitLT(Expr.LT expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.LT(lhs, rhs));
    }

    @Override
    public Expr<?> visitGT(Expr.GT expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.GT(lhs, rhs));
    }

    @Override
    public Expr<?> visitLEq(Expr.LEq expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.LEq(lhs, rhs));
    }

    @Override
    public Expr<?> visitGEq(Expr.GEq expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.GEq(lhs, rhs));
    }

    @Override
    public Expr<?> visitSLT(Expr.SLT expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.SLT(lhs, rhs));
    }

    @Override
    public Expr<?> visitSGT(Expr.SGT expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.SGT(lhs, rhs));
    }

    @Override
    public Expr<?> visitEq(Expr.Eq expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Eq(lhs, rhs));
    }

    @Override
    public Expr<?> visitIsZero(Expr.IsZero expr) throws X {
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.IsZero(value));
    }

    // bits

    @Override
    public Expr<?> visitAnd(Expr.And expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.And(lhs, rhs));
    }

    @Override
    public Expr<?> visitOr(Expr.Or expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Or(lhs, rhs));
    }

    @Override
    public Expr<?> visitXor(Expr.Xor expr) throws X {
        Expr<EWord> lhs = map(expr.getLhs());
        Expr<EWord> rhs = map(expr.getRhs());
        return apply(new Expr.Xor(lhs, rhs));
    }

    @Override
    public Expr<?> visitNot(Expr.Not expr) throws X {
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.Not(value));
    }

    @Override
    public Expr<?> visitSHL(Expr.SHL expr) throws X {
        Expr<EWord> shift = map(expr.getShift());
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.SHL(shift, value));
    }

    @Override
    public Expr<?> visitSHR(Expr.SHR expr) throws X {
        Expr<EWord> shift = map(expr.getShift());
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.SHR(shift, value));
    }

    @Override
    public Expr<?> visitSAR(Expr.SAR expr) throws X {
        Expr<EWord> shift = map(expr.getShift());
        Expr<EWord> value = map(expr.getValue());
        return apply(new Expr.SAR(shift, value));
    }

    // hashes

    @Override
    public Expr<?> visitKeccak(Expr.Keccak expr) throws X {
        Expr<EBuf> buffer = map(expr.getBuffer());
        return apply(new Expr.Keccak(buffer));
    }

    @Override
    public Expr<?> visitSHA256(Expr.SHA256 expr) throws X {
        Expr<EBuf> buffer = map(expr.getBuffer());
        return apply(new Expr.SHA256(buffer));
    }

    // block context

    @Override
    public Expr<?> visitOrigin(Expr.Origin expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitCoinbase(Expr.Coinbase expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitTimestamp(Expr.Timestamp expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitBlockNumber(Expr.BlockNumber expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitPrevRandao(Expr.PrevRandao expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitGasLimit(Expr.GasLimit expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitChainId(Expr.ChainId expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitBaseFee(Expr.BaseFee expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitBlockHash(Expr.BlockHash expr) throws X {
        Expr<EWord> number = map(expr.getNumber());
        return apply(new Expr.BlockHash(number));
    }

    // tx context

    @Override
    public Expr<?> visitTxValue(Expr.TxValue expr) throws X {
        return apply(expr);
    }

    // frame context

    @Override
    public Expr<?> visitGas(Expr.Gas expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitBalance(Expr.Balance expr) throws X {
        return apply(expr);
    }

    // code

    @Override
    public Expr<?> visitCodeSize(Expr.CodeSize expr) throws X {
        Expr<EAddr> address = map(expr.getAddress());
        return apply(new Expr.CodeSize(address));
    }

    @Override
    public Expr<?> visitCodeHash(Expr.CodeHash expr) throws X {
        Expr<EAddr> address = map(expr.getAddress());
        return apply(new Expr.CodeHash(address));
    }

    // logs

    @Override
    public Expr<?> visitLogEntry(Expr.LogEntry expr) throws X {
        Expr<EWord> address = map(expr.getAddress());
        Expr<EBuf> data = map(expr.getData());
        ImmutableList<Expr<EWord>> topics = mapAll(expr.getTopics());
        return apply(new Expr.LogEntry(address, data, topics));
    }

    // contract creation

    @Override
    public Expr<?> visitCreate(Expr.Create expr) throws X {
        Expr<EWord> value = map(expr.getValue());
        Expr<EWord> offset = map(expr.getOffset());
        Expr<EWord> size = map(expr.getSize());
        Expr<EBuf> initCode = map(expr.getInitCode());
        ImmutableList<Expr<ELog>> logs = mapAll(expr.getLogs());
        Expr<EStorage> continuation = map(expr.getContinuation());
        return apply(new Expr.Create(value, offset, size, initCode, logs, continuation));
    }

    @Override
    public Expr<?> visitCreate2(Expr.Create2 expr) throws X {
        Expr<EWord> value = map(expr.getValue());
        Expr<EWord> offset = map(expr.getOffset());
        Expr<EWord> size = map(expr.getSize());
        Expr<EWord> salt = map(expr.getSalt());
        Expr<EBuf> initCode = map(expr.getInitCode());
        ImmutableList<Expr<ELog>> logs = mapAll(expr.getLogs());
        Expr<EStorage> continuation = map(expr.getContinuation());
        return apply(new Expr.Create2(value, offset, size, salt, initCode, logs, continuation));
    }

    // calls

    @Override
    public Expr<?> visitCall(Expr.Call expr) throws X {
        Expr<EWord> gas = map(expr.getGas());
        Optional<Expr<EAddr>> target = mapOptional(expr.getTarget());
        Expr<EWord> value = map(expr.getValue());
        Expr<EWord> inOffset = map(expr.getInOffset());
        Expr<EWord> inSize = map(expr.getInSize());
        Expr<EWord> outOffset = map(expr.getOutOffset());
        Expr<EWord> outSize = map(expr.getOutSize());
        ImmutableList<Expr<ELog>> logs = mapAll(expr.getLogs());
        Expr<EStorage> continuation = map(expr.getContinuation());
        return apply(new Expr.Call(gas, target, value, inOffset, inSize, outOffset, outSize, logs, continuation));
    }

    @Override
    public Expr<?> visitCallCode(Expr.CallCode expr) throws X {
        Expr<EWord> gas = map(expr.getGas());
        Expr<EWord> target = map(expr.getTarget());
        Expr<EWord> value = map(expr.getValue());
        Expr<EWord> inOffset = map(expr.getInOffset());
        Expr<EWord> inSize = map(expr.getInSize());
        Expr<EWord> outOffset = map(expr.getOutOffset());
        Expr<EWord> outSize = map(expr.getOutSize());
        ImmutableList<Expr<ELog>> logs = mapAll(expr.getLogs());
        Expr<EStorage> continuation = map(expr.getContinuation());
        return apply(new Expr.CallCode(gas, target, value, inOffset, inSize, outOffset, outSize, logs, continuation));
    }

    @Override
    public Expr<?> visitDelegateCall(Expr.DelegateCall expr) throws X {
        Expr<EWord> gas = map(expr.getGas());
        Expr<EWord> target = map(expr.getTarget());
        Expr<EWord> value = map(expr.getValue());
        Expr<EWord> inOffset = map(expr.getInOffset());
        Expr<EWord> inSize = map(expr.getInSize());
        Expr<EWord> outOffset = map(expr.getOutOffset());
        Expr<EWord> outSize = map(expr.getOutSize());
        ImmutableList<Expr<ELog>> logs = mapAll(expr.getLogs());
        Expr<EStorage> continuation = map(expr.getContinuation());
        return apply(new Expr.DelegateCall(gas, target, value, inOffset, inSize, outOffset, outSize, logs, continuation));
    }

    // addresses

    @Override
    public Expr<?> visitLitAddr(Expr.LitAddr expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitSymAddr(Expr.SymAddr expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitWAddr(Expr.WAddr expr) throws X {
        Expr<EWord> word = map(expr.getWord());
        return apply(new Expr.WAddr(word));
    }

    // storage

    @Override
    public Expr<?> visitConcreteStore(Expr.ConcreteStore expr) throws X {
        Expr<EAddr> address = map(expr.getAddress());
        return apply(new Expr.ConcreteStore(address, expr.getSlots()));
    }

    @Override
    public Expr<?> visitAbstractStore(Expr.AbstractStore expr) throws X {
        Expr<EAddr> address = map(expr.getAddress());
        return apply(new Expr.AbstractStore(address));
    }

    @Override
    public Expr<?> visitSLoad(Expr.SLoad expr) throws X {
        Expr<EWord> slot = map(expr.getSlot());
        Expr<EStorage> storage = map(expr.getStorage());
        return apply(new Expr.SLoad(slot, storage));
    }

    @Override
    public Expr<?> visitSStore(Expr.SStore expr) throws X {
        return mapStorage(expr);
    }

    // buffers

    @Override
    public Expr<?> visitConcreteBuf(Expr.ConcreteBuf expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitAbstractBuf(Expr.AbstractBuf expr) throws X {
        return apply(expr);
    }

    @Override
    public Expr<?> visitReadWord(Expr.ReadWord expr) throws X {
        Expr<EWord> index = map(expr.getIndex());
        Expr<EBuf> buffer = map(expr.getBuffer());
        return apply(new Expr.ReadWord(index, buffer));
    }

    @Override
    public Expr<?> visitReadByte(Expr.ReadByte expr) throws X {
        Expr<EWord> index = map(expr.getIndex());
        Expr<EBuf> buffer = map(expr.getBuffer());
        return apply(new Expr.ReadByte(index, buffer));
    }

    @Override
    public Expr<?> visitWriteWord(Expr.WriteWord expr) throws X {
        return mapBuffer(expr);
    }

    @Override
    public Expr<?> visitWriteByte(Expr.WriteByte expr) throws X {
        return mapBuffer(expr);
    }

    @Override
    public Expr<?> visitCopySlice(Expr.CopySlice expr) throws X {
        return mapBuffer(expr);
    }

    @Override
    public Expr<?> visitBufLength(Expr.BufLength expr) throws X {
        Expr<EBuf> buffer = map(expr.getBuffer());
        return apply(new Expr.BufLength(buffer));
    }
}
