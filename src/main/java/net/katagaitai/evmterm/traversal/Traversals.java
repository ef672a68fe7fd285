package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.state.SubState;
import net.katagaitai.evmterm.trace.FrameContext;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.Traces;
import net.katagaitai.evmterm.util.Constants;

import java.util.Optional;
import java.util.function.Function;

/**
 * Entry points of the traversal engine.
 * <p>
 * {@code fold*} visit every expression reachable from the argument in pre-order and combine {@code f} of each
 * with the monoid, starting from {@code acc}. {@code map*M} rewrite bottom-up and stop at the first exception
 * the mapper throws. {@code map*} are the same rewrite with a mapper that cannot throw.
 * <p>
 * Every call uses a fresh folder or rewriter, so the methods are safe to call from several threads.
 */
public final class Traversals {
    private Traversals() {
    }

    // fold

    public static <B> B foldExpr(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc, Expr<?> expr) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.fold(expr);
        return folder.getResult();
    }

    public static <B> B foldProp(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc, Prop prop) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.props().fold(prop);
        return folder.getResult();
    }

    public static <B> B foldContract(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc,
                                     Contract contract) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.contracts().foldContract(contract);
        return folder.getResult();
    }

    public static <B> B foldCode(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc,
                                 ContractCode code) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.contracts().foldCode(code);
        return folder.getResult();
    }

    public static <B> B foldTrace(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc, Trace trace) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.traces().foldTrace(trace);
        return folder.getResult();
    }

    public static <B> B foldTraces(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc,
                                   Traces traces) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.traces().foldTraces(traces);
        return folder.getResult();
    }

    public static <B> B foldContext(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc,
                                    FrameContext context) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.traces().foldContext(context);
        return folder.getResult();
    }

    public static <B> B foldSubState(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc,
                                     SubState subState) {
        ExprFolder<B> folder = newFolder(f, monoid, acc);
        folder.subStates().foldSubState(subState);
        return folder.getResult();
    }

    // effectful map

    public static <A, X extends Exception> Expr<A> mapExprM(ExprMapperM<X> mapper, Expr<A> expr) throws X {
        return newRewriter(mapper).map(expr);
    }

    public static <X extends Exception> Prop mapPropM(ExprMapperM<X> mapper, Prop prop) throws X {
        return newRewriter(mapper).props().map(prop);
    }

    public static <X extends Exception> Contract mapContractM(ExprMapperM<X> mapper, Contract contract) throws X {
        return newRewriter(mapper).contracts().mapContract(contract);
    }

    public static <X extends Exception> ContractCode mapCodeM(ExprMapperM<X> mapper, ContractCode code) throws X {
        return newRewriter(mapper).contracts().mapCode(code);
    }

    public static <X extends Exception> Trace mapTraceM(ExprMapperM<X> mapper, Trace trace) throws X {
        return newRewriter(mapper).traces().mapTrace(trace);
    }

    public static <X extends Exception> Traces mapTracesM(ExprMapperM<X> mapper, Traces traces) throws X {
        return newRewriter(mapper).traces().mapTraces(traces);
    }

    public static <X extends Exception> FrameContext mapContextM(ExprMapperM<X> mapper, FrameContext context)
            throws X {
        return newRewriter(mapper).traces().mapContext(context);
    }

    public static <X extends Exception> SubState mapSubStateM(ExprMapperM<X> mapper, SubState subState) throws X {
        return newRewriter(mapper).subStates().mapSubState(subState);
    }

    // pure map

    public static <A> Expr<A> mapExpr(ExprMapper mapper, Expr<A> expr) {
        return Traversals.<A, RuntimeException>mapExprM(mapper, expr);
    }

    public static Prop mapProp(ExprMapper mapper, Prop prop) {
        return Traversals.<RuntimeException>mapPropM(mapper, prop);
    }

    public static Contract mapContract(ExprMapper mapper, Contract contract) {
        return Traversals.<RuntimeException>mapContractM(mapper, contract);
    }

    public static ContractCode mapCode(ExprMapper mapper, ContractCode code) {
        return Traversals.<RuntimeException>mapCodeM(mapper, code);
    }

    public static Trace mapTrace(ExprMapper mapper, Trace trace) {
        return Traversals.<RuntimeException>mapTraceM(mapper, trace);
    }

    public static Traces mapTraces(ExprMapper mapper, Traces traces) {
        return Traversals.<RuntimeException>mapTracesM(mapper, traces);
    }

    public static FrameContext mapContext(ExprMapper mapper, FrameContext context) {
        return Traversals.<RuntimeException>mapContextM(mapper, context);
    }

    public static SubState mapSubState(ExprMapper mapper, SubState subState) {
        return Traversals.<RuntimeException>mapSubStateM(mapper, subState);
    }

    // optional map

    public static <A> Optional<Expr<A>> mapExprOptional(Function<? super Expr<?>, Optional<Expr<?>>> mapper,
                                                        Expr<A> expr) {
        try {
            return Optional.of(Traversals.<A, Abort>mapExprM(abortOnEmpty(mapper), expr));
        } catch (Abort e) {
            return Optional.empty();
        }
    }

    public static Optional<Prop> mapPropOptional(Function<? super Expr<?>, Optional<Expr<?>>> mapper, Prop prop) {
        try {
            return Optional.of(Traversals.<Abort>mapPropM(abortOnEmpty(mapper), prop));
        } catch (Abort e) {
            return Optional.empty();
        }
    }

    private static ExprMapperM<Abort> abortOnEmpty(Function<? super Expr<?>, Optional<Expr<?>>> mapper) {
        return expr -> {
            Optional<Expr<?>> result = mapper.apply(expr);
            if (!result.isPresent()) {
                throw Abort.INSTANCE;
            }
            return result.get();
        };
    }

    private static <B> ExprFolder<B> newFolder(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc) {
        return new ExprFolder<>(f, monoid, acc, Constants.MAX_TRAVERSAL_DEPTH);
    }

    private static <X extends Exception> ExprRewriter<X> newRewriter(ExprMapperM<X> mapper) {
        return new ExprRewriter<>(mapper, Constants.MAX_TRAVERSAL_DEPTH);
    }

    // 空の結果で書き換えを打ち切る
    private static final class Abort extends Exception {
        private static final Abort INSTANCE = new Abort();

        private Abort() {
            super(null, null, false, false);
        }
    }
}
