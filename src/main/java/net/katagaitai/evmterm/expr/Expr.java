package net.katagaitai.evmterm.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.trace.EvmError;
import net.katagaitai.evmterm.trace.PartialExec;
import net.katagaitai.evmterm.trace.Traces;
import net.katagaitai.evmterm.traversal.ExprMapper;
import net.katagaitai.evmterm.traversal.Monoid;
import net.katagaitai.evmterm.traversal.Term;
import net.katagaitai.evmterm.traversal.Traversals;
import net.katagaitai.evmterm.util.Constants;
import net.katagaitai.evmterm.util.Util;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Symbolic value tree. {@code A} is one of the marker types ({@link EWord}, {@link EBuf}, ...) and matches
 * {@link #getKind()}; node constructors only accept operands of the kinds they need.
 * <p>
 * The set of nodes is closed: every node is nested here, the constructor is package-private, and
 * {@link ExprVisitor} has one method per node. Operands are listed in declaration order, which is the order
 * fold and map visit them.
 */
public abstract class Expr<A> implements Term<Expr<A>> {
    Expr() {
    }

    public abstract Kind getKind();

    public abstract <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X;

    @Override
    public Expr<A> mapTerm(ExprMapper mapper) {
        return Traversals.mapExpr(mapper, this);
    }

    @Override
    public <B> B foldTerm(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc) {
        return Traversals.foldExpr(f, monoid, acc, this);
    }

    public abstract static class WordExpr extends Expr<EWord> {
        WordExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.WORD;
        }
    }

    public abstract static class ByteExpr extends Expr<EByte> {
        ByteExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.BYTE;
        }
    }

    public abstract static class AddrExpr extends Expr<EAddr> {
        AddrExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.ADDR;
        }
    }

    public abstract static class BufExpr extends Expr<EBuf> {
        BufExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.BUF;
        }
    }

    public abstract static class StorageExpr extends Expr<EStorage> {
        StorageExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.STORAGE;
        }
    }

    public abstract static class ContractExpr extends Expr<EContract> {
        ContractExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.CONTRACT;
        }
    }

    public abstract static class EndExpr extends Expr<EEnd> {
        EndExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.END;
        }
    }

    public abstract static class LogExpr extends Expr<ELog> {
        LogExpr() {
        }

        @Override
        public Kind getKind() {
            return Kind.LOG;
        }
    }

    // literals & variables

    @Value
    public static class Lit extends WordExpr {
        BigInteger value;

        public Lit(@NonNull BigInteger value) {
            Preconditions.checkArgument(Util.isWord(value), "word out of range: %s", value);
            this.value = value;
        }

        public static Lit of(long value) {
            return new Lit(BigInteger.valueOf(value));
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLit(this);
        }
    }

    @Value
    public static class LitByte extends ByteExpr {
        int value;

        public LitByte(int value) {
            Preconditions.checkArgument(0 <= value && value <= 0xff, "byte out of range: %s", value);
            this.value = value;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLitByte(this);
        }
    }

    @Value
    public static class Var extends WordExpr {
        @NonNull
        String name;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitVar(this);
        }
    }

    /**
     * Numbered placeholder for a value that is not known yet. It can stand for any kind and has no children:
     * traversals hand it to the visitor once and never look inside.
     */
    @Value
    public static class GVar<A> extends Expr<A> {
        Kind kind;
        int id;

        private GVar(@NonNull Kind kind, int id) {
            this.kind = kind;
            this.id = id;
        }

        public static GVar<EWord> word(int id) {
            return new GVar<>(Kind.WORD, id);
        }

        public static GVar<EBuf> buf(int id) {
            return new GVar<>(Kind.BUF, id);
        }

        public static GVar<EStorage> storage(int id) {
            return new GVar<>(Kind.STORAGE, id);
        }

        public static GVar<EAddr> addr(int id) {
            return new GVar<>(Kind.ADDR, id);
        }

        public static GVar<EContract> contract(int id) {
            return new GVar<>(Kind.CONTRACT, id);
        }

        // byteは予約語
        public static GVar<EByte> ofByte(int id) {
            return new GVar<>(Kind.BYTE, id);
        }

        public static GVar<EEnd> end(int id) {
            return new GVar<>(Kind.END, id);
        }

        public static GVar<ELog> log(int id) {
            return new GVar<>(Kind.LOG, id);
        }

        @Override
        public Kind getKind() {
            return kind;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitGVar(this);
        }
    }

    // contracts

    @Value
    public static class C extends ContractExpr {
        @NonNull
        ContractCode code;
        @NonNull
        Expr<EStorage> storage;
        @NonNull
        Expr<EWord> balance;
        @NonNull
        Optional<Long> nonce;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitC(this);
        }
    }

    // bytes

    // 上位バイトから数える
    @Value
    public static class IndexWord extends ByteExpr {
        @NonNull
        Expr<EWord> index;
        @NonNull
        Expr<EWord> word;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitIndexWord(this);
        }
    }

    @Value
    public static class EqByte extends WordExpr {
        @NonNull
        Expr<EByte> lhs;
        @NonNull
        Expr<EByte> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitEqByte(this);
        }
    }

    @Value
    public static class JoinBytes extends WordExpr {
        ImmutableList<Expr<EByte>> bytes;

        public JoinBytes(@NonNull List<? extends Expr<EByte>> bytes) {
            Preconditions.checkArgument(bytes.size() == Constants.JOIN_BYTES_ARITY,
                    "JoinBytes takes %s bytes, got %s", Constants.JOIN_BYTES_ARITY, bytes.size());
            this.bytes = ImmutableList.copyOf(bytes);
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitJoinBytes(this);
        }
    }

    // control flow

    @Value
    public static class Success extends EndExpr {
        ImmutableList<Prop> props;
        Traces traces;
        Expr<EBuf> returnData;
        ImmutableMap<Expr<EAddr>, Expr<EContract>> contracts;

        public Success(@NonNull List<Prop> props, @NonNull Traces traces, @NonNull Expr<EBuf> returnData,
                       @NonNull Map<? extends Expr<EAddr>, ? extends Expr<EContract>> contracts) {
            this.props = ImmutableList.copyOf(props);
            this.traces = traces;
            this.returnData = returnData;
            this.contracts = ImmutableMap.copyOf(contracts);
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSuccess(this);
        }
    }

    @Value
    public static class Failure extends EndExpr {
        ImmutableList<Prop> props;
        Traces traces;
        EvmError error;

        public Failure(@NonNull List<Prop> props, @NonNull Traces traces, @NonNull EvmError error) {
            this.props = ImmutableList.copyOf(props);
            this.traces = traces;
            this.error = error;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitFailure(this);
        }
    }

    @Value
    public static class Partial extends EndExpr {
        ImmutableList<Prop> props;
        Traces traces;
        PartialExec reason;

        public Partial(@NonNull List<Prop> props, @NonNull Traces traces, @NonNull PartialExec reason) {
            this.props = ImmutableList.copyOf(props);
            this.traces = traces;
            this.reason = reason;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitPartial(this);
        }
    }

    @Value
    public static class ITE extends EndExpr {
        @NonNull
        Expr<EWord> condition;
        @NonNull
        Expr<EEnd> whenTrue;
        @NonNull
        Expr<EEnd> whenFalse;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitITE(this);
        }
    }

    // arithmetic

    @Value
    public static class Add extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitAdd(this);
        }
    }

    @Value
    public static class Sub extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSub(this);
        }
    }

    @Value
    public static class Mul extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitMul(this);
        }
    }

    @Value
    public static class Div extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitDiv(this);
        }
    }

    @Value
    public static class SDiv extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSDiv(this);
        }
    }

    @Value
    public static class Mod extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitMod(this);
        }
    }

    @Value
    public static class SMod extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSMod(this);
        }
    }

    @Value
    public static class AddMod extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;
        @NonNull
        Expr<EWord> modulus;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitAddMod(this);
        }
    }

    @Value
    public static class MulMod extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;
        @NonNull
        Expr<EWord> modulus;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitMulMod(this);
        }
    }

    @Value
    public static class Exp extends WordExpr {
        @NonNull
        Expr<EWord> base;
        @NonNull
        Expr<EWord> exponent;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitExp(this);
        }
    }

    @Value
    public static class SEx extends WordExpr {
        @NonNull
        Expr<EWord> bytes;
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSEx(this);
        }
    }

    @Value
    public static class Min extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitMin(this);
        }
    }

    @Value
    public static class Max extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitMax(this);
        }
    }

    // comparisons

    @Value
    public static class LT extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLT(this);
        }
    }

    @Value
    public static class GT extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitGT(this);
        }
    }

    @Value
    public static class LEq extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLEq(this);
        }
    }

    @Value
    public static class GEq extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitGEq(this);
        }
    }

    @Value
    public static class SLT extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSLT(this);
        }
    }

    @Value
    public static class SGT extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSGT(this);
        }
    }

    @Value
    public static class Eq extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitEq(this);
        }
    }

    @Value
    public static class IsZero extends WordExpr {
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitIsZero(this);
        }
    }

    // bits

    @Value
    public static class And extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitAnd(this);
        }
    }

    @Value
    public static class Or extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitOr(this);
        }
    }

    @Value
    public static class Xor extends WordExpr {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitXor(this);
        }
    }

    @Value
    public static class Not extends WordExpr {
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitNot(this);
        }
    }

    @Value
    public static class SHL extends WordExpr {
        @NonNull
        Expr<EWord> shift;
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSHL(this);
        }
    }

    @Value
    public static class SHR extends WordExpr {
        @NonNull
        Expr<EWord> shift;
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSHR(this);
        }
    }

    @Value
    public static class SAR extends WordExpr {
        @NonNull
        Expr<EWord> shift;
        @NonNull
        Expr<EWord> value;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSAR(this);
        }
    }

    // hashes

    @Value
    public static class Keccak extends WordExpr {
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitKeccak(this);
        }
    }

    @Value
    public static class SHA256 extends WordExpr {
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSHA256(this);
        }
    }

    // block context

    @Value
    public static class Origin extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitOrigin(this);
        }
    }

    @Value
    public static class Coinbase extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCoinbase(this);
        }
    }

    @Value
    public static class Timestamp extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitTimestamp(this);
        }
    }

    @Value
    public static class BlockNumber extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitBlockNumber(this);
        }
    }

    @Value
    public static class PrevRandao extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitPrevRandao(this);
        }
    }

    @Value
    public static class GasLimit extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitGasLimit(this);
        }
    }

    @Value
    public static class ChainId extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitChainId(this);
        }
    }

    @Value
    public static class BaseFee extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitBaseFee(this);
        }
    }

    @Value
    public static class BlockHash extends WordExpr {
        @NonNull
        Expr<EWord> number;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitBlockHash(this);
        }
    }

    // tx context

    @Value
    public static class TxValue extends WordExpr {
        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitTxValue(this);
        }
    }

    // frame context

    // frameとfreshは読み出しの識別子で、式ではない
    @Value
    public static class Gas extends WordExpr {
        int frame;
        int fresh;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitGas(this);
        }
    }

    @Value
    public static class Balance extends WordExpr {
        int frame;
        int fresh;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitBalance(this);
        }
    }

    // code

    @Value
    public static class CodeSize extends WordExpr {
        @NonNull
        Expr<EAddr> address;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCodeSize(this);
        }
    }

    @Value
    public static class CodeHash extends WordExpr {
        @NonNull
        Expr<EAddr> address;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCodeHash(this);
        }
    }

    // logs

    @Value
    public static class LogEntry extends LogExpr {
        Expr<EWord> address;
        Expr<EBuf> data;
        ImmutableList<Expr<EWord>> topics;

        public LogEntry(@NonNull Expr<EWord> address, @NonNull Expr<EBuf> data,
                        @NonNull List<? extends Expr<EWord>> topics) {
            this.address = address;
            this.data = data;
            this.topics = ImmutableList.copyOf(topics);
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLogEntry(this);
        }
    }

    // contract creation

    @Value
    public static class Create extends WordExpr {
        Expr<EWord> value;
        Expr<EWord> offset;
        Expr<EWord> size;
        Expr<EBuf> initCode;
        ImmutableList<Expr<ELog>> logs;
        Expr<EStorage> continuation;

        public Create(@NonNull Expr<EWord> value, @NonNull Expr<EWord> offset, @NonNull Expr<EWord> size,
                      @NonNull Expr<EBuf> initCode, @NonNull List<? extends Expr<ELog>> logs,
                      @NonNull Expr<EStorage> continuation) {
            this.value = value;
            this.offset = offset;
            this.size = size;
            this.initCode = initCode;
            this.logs = ImmutableList.copyOf(logs);
            this.continuation = continuation;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCreate(this);
        }
    }

    @Value
    public static class Create2 extends WordExpr {
        Expr<EWord> value;
        Expr<EWord> offset;
        Expr<EWord> size;
        Expr<EWord> salt;
        Expr<EBuf> initCode;
        ImmutableList<Expr<ELog>> logs;
        Expr<EStorage> continuation;

        public Create2(@NonNull Expr<EWord> value, @NonNull Expr<EWord> offset, @NonNull Expr<EWord> size,
                       @NonNull Expr<EWord> salt, @NonNull Expr<EBuf> initCode,
                       @NonNull List<? extends Expr<ELog>> logs, @NonNull Expr<EStorage> continuation) {
            this.value = value;
            this.offset = offset;
            this.size = size;
            this.salt = salt;
            this.initCode = initCode;
            this.logs = ImmutableList.copyOf(logs);
            this.continuation = continuation;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCreate2(this);
        }
    }

    // calls

    // 宛先が解決できないときtargetは空
    @Value
    public static class Call extends WordExpr {
        Expr<EWord> gas;
        Optional<Expr<EAddr>> target;
        Expr<EWord> value;
        Expr<EWord> inOffset;
        Expr<EWord> inSize;
        Expr<EWord> outOffset;
        Expr<EWord> outSize;
        ImmutableList<Expr<ELog>> logs;
        Expr<EStorage> continuation;

        public Call(@NonNull Expr<EWord> gas, @NonNull Optional<Expr<EAddr>> target, @NonNull Expr<EWord> value,
                     @NonNull Expr<EWord> inOffset, @NonNull Expr<EWord> inSize,
                     @NonNull Expr<EWord> outOffset, @NonNull Expr<EWord> outSize,
                     @NonNull List<? extends Expr<ELog>> logs, @NonNull Expr<EStorage> continuation) {
            this.gas = gas;
            this.target = target;
            this.value = value;
            this.inOffset = inOffset;
            this.inSize = inSize;
            this.outOffset = outOffset;
            this.outSize = outSize;
            this.logs = ImmutableList.copyOf(logs);
            this.continuation = continuation;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCall(this);
        }
    }

    @Value
    public static class CallCode extends WordExpr {
        Expr<EWord> gas;
        Expr<EWord> target;
        Expr<EWord> value;
        Expr<EWord> inOffset;
        Expr<EWord> inSize;
        Expr<EWord> outOffset;
        Expr<EWord> outSize;
        ImmutableList<Expr<ELog>> logs;
        Expr<EStorage> continuation;

        public CallCode(@NonNull Expr<EWord> gas, @NonNull Expr<EWord> target, @NonNull Expr<EWord> value,
                         @NonNull Expr<EWord> inOffset, @NonNull Expr<EWord> inSize,
                         @NonNull Expr<EWord> outOffset, @NonNull Expr<EWord> outSize,
                         @NonNull List<? extends Expr<ELog>> logs, @NonNull Expr<EStorage> continuation) {
            this.gas = gas;
            this.target = target;
            this.value = value;
            this.inOffset = inOffset;
            this.inSize = inSize;
            this.outOffset = outOffset;
            this.outSize = outSize;
            this.logs = ImmutableList.copyOf(logs);
            this.continuation = continuation;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCallCode(this);
        }
    }

    @Value
    public static class DelegateCall extends WordExpr {
        Expr<EWord> gas;
        Expr<EWord> target;
        Expr<EWord> value;
        Expr<EWord> inOffset;
        Expr<EWord> inSize;
        Expr<EWord> outOffset;
        Expr<EWord> outSize;
        ImmutableList<Expr<ELog>> logs;
        Expr<EStorage> continuation;

        public DelegateCall(@NonNull Expr<EWord> gas, @NonNull Expr<EWord> target, @NonNull Expr<EWord> value,
                             @NonNull Expr<EWord> inOffset, @NonNull Expr<EWord> inSize,
                             @NonNull Expr<EWord> outOffset, @NonNull Expr<EWord> outSize,
                             @NonNull List<? extends Expr<ELog>> logs, @NonNull Expr<EStorage> continuation) {
            this.gas = gas;
            this.target = target;
            this.value = value;
            this.inOffset = inOffset;
            this.inSize = inSize;
            this.outOffset = outOffset;
            this.outSize = outSize;
            this.logs = ImmutableList.copyOf(logs);
            this.continuation = continuation;
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitDelegateCall(this);
        }
    }

    // addresses

    @Value
    public static class LitAddr extends AddrExpr {
        BigInteger value;

        public LitAddr(@NonNull BigInteger value) {
            Preconditions.checkArgument(Util.isAddress(value), "address out of range: %s", value);
            this.value = value;
        }

        public static LitAddr of(long value) {
            return new LitAddr(BigInteger.valueOf(value));
        }

        @Override
        public String toString() {
            return "Expr.LitAddr(" + Util.addressToHex(value) + ")";
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitLitAddr(this);
        }
    }

    @Value
    public static class SymAddr extends AddrExpr {
        @NonNull
        String name;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSymAddr(this);
        }
    }

    @Value
    public static class WAddr extends AddrExpr {
        @NonNull
        Expr<EWord> word;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitWAddr(this);
        }
    }

    // storage

    // 無いスロットは0として読む
    @Value
    public static class ConcreteStore extends StorageExpr {
        Expr<EAddr> address;
        ImmutableMap<BigInteger, BigInteger> slots;

        public ConcreteStore(@NonNull Expr<EAddr> address, @NonNull Map<BigInteger, BigInteger> slots) {
            this.address = address;
            this.slots = ImmutableMap.copyOf(slots);
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitConcreteStore(this);
        }
    }

    @Value
    public static class AbstractStore extends StorageExpr {
        @NonNull
        Expr<EAddr> address;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitAbstractStore(this);
        }
    }

    @Value
    public static class SLoad extends WordExpr {
        @NonNull
        Expr<EWord> slot;
        @NonNull
        Expr<EStorage> storage;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSLoad(this);
        }
    }

    @Value
    public static class SStore extends StorageExpr {
        @NonNull
        Expr<EWord> slot;
        @NonNull
        Expr<EWord> value;
        @NonNull
        Expr<EStorage> storage;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitSStore(this);
        }
    }

    // buffers

    @Value
    public static class ConcreteBuf extends BufExpr {
        byte[] bytes;

        public ConcreteBuf(@NonNull byte[] bytes) {
            this.bytes = bytes.clone();
        }

        public static ConcreteBuf ofHex(String hex) {
            return new ConcreteBuf(Util.hexStringToBytes(hex));
        }

        public byte[] getBytes() {
            return bytes.clone();
        }

        @Override
        public String toString() {
            return "Expr.ConcreteBuf(" + Util.addHexPrefix(Util.toHexString(bytes)) + ")";
        }

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitConcreteBuf(this);
        }
    }

    @Value
    public static class AbstractBuf extends BufExpr {
        @NonNull
        String name;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitAbstractBuf(this);
        }
    }

    @Value
    public static class ReadWord extends WordExpr {
        @NonNull
        Expr<EWord> index;
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitReadWord(this);
        }
    }

    @Value
    public static class ReadByte extends ByteExpr {
        @NonNull
        Expr<EWord> index;
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitReadByte(this);
        }
    }

    @Value
    public static class WriteWord extends BufExpr {
        @NonNull
        Expr<EWord> index;
        @NonNull
        Expr<EWord> value;
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitWriteWord(this);
        }
    }

    @Value
    public static class WriteByte extends BufExpr {
        @NonNull
        Expr<EWord> index;
        @NonNull
        Expr<EByte> value;
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitWriteByte(this);
        }
    }

    @Value
    public static class CopySlice extends BufExpr {
        @NonNull
        Expr<EWord> srcOffset;
        @NonNull
        Expr<EWord> dstOffset;
        @NonNull
        Expr<EWord> size;
        @NonNull
        Expr<EBuf> src;
        @NonNull
        Expr<EBuf> dst;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitCopySlice(this);
        }
    }

    @Value
    public static class BufLength extends WordExpr {
        @NonNull
        Expr<EBuf> buffer;

        @Override
        public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
            return visitor.visitBufLength(this);
        }
    }
}
