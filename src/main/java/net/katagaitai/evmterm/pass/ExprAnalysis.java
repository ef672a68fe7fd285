package net.katagaitai.evmterm.pass;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.expr.Kind;
import net.katagaitai.evmterm.state.SubState;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.Traces;
import net.katagaitai.evmterm.traversal.Monoids;
import net.katagaitai.evmterm.traversal.Term;
import net.katagaitai.evmterm.traversal.Traversals;

import java.math.BigInteger;
import java.util.function.Function;
import java.util.function.Predicate;

public final class ExprAnalysis {
    private ExprAnalysis() {
    }

    public static int countNodes(Term<?> term) {
        return term.foldTerm(expr -> 1, Monoids.intSum(), 0);
    }

    public static boolean containsNode(Term<?> term, Predicate<? super Expr<?>> predicate) {
        return term.foldTerm(predicate::test, Monoids.any(), false);
    }

    public static ImmutableList<BigInteger> collectLiterals(Term<?> term) {
        return term.foldTerm(ExprAnalysis::literal, Monoids.<BigInteger>list(), ImmutableList.of());
    }

    public static ImmutableSet<String> collectVars(Term<?> term) {
        return term.foldTerm(ExprAnalysis::varName, Monoids.<String>set(), ImmutableSet.of());
    }

    // アドレス種別の式をすべて集める

    public static ImmutableSet<Expr<EAddr>> collectAddresses(Term<?> term) {
        return term.foldTerm(ADDRESS, Monoids.<Expr<EAddr>>set(), ImmutableSet.of());
    }

    public static ImmutableSet<Expr<EAddr>> collectAddresses(Contract contract) {
        return Traversals.foldContract(ADDRESS, Monoids.<Expr<EAddr>>set(), ImmutableSet.of(), contract);
    }

    public static ImmutableSet<Expr<EAddr>> collectAddresses(Trace trace) {
        return Traversals.foldTrace(ADDRESS, Monoids.<Expr<EAddr>>set(), ImmutableSet.of(), trace);
    }

    public static ImmutableSet<Expr<EAddr>> collectAddresses(Traces traces) {
        return Traversals.foldTraces(ADDRESS, Monoids.<Expr<EAddr>>set(), ImmutableSet.of(), traces);
    }

    public static ImmutableSet<Expr<EAddr>> collectAddresses(SubState subState) {
        return Traversals.foldSubState(ADDRESS, Monoids.<Expr<EAddr>>set(), ImmutableSet.of(), subState);
    }

    public static boolean isConcrete(Term<?> term) {
        return !containsNode(term, ExprAnalysis::isSymbolicLeaf);
    }

    public static boolean hasPlaceholder(Term<?> term) {
        return containsNode(term, expr -> expr instanceof Expr.GVar);
    }

    private static final Function<Expr<?>, ImmutableSet<Expr<EAddr>>> ADDRESS = expr -> {
        if (expr.getKind() != Kind.ADDR) {
            return ImmutableSet.of();
        }
        @SuppressWarnings("unchecked")
        Expr<EAddr> address = (Expr<EAddr>) expr;
        return ImmutableSet.of(address);
    };

    private static ImmutableList<BigInteger> literal(Expr<?> expr) {
        if (expr instanceof Expr.Lit) {
            return ImmutableList.of(((Expr.Lit) expr).getValue());
        }
        return ImmutableList.of();
    }

    private static ImmutableSet<String> varName(Expr<?> expr) {
        if (expr instanceof Expr.Var) {
            return ImmutableSet.of(((Expr.Var) expr).getName());
        }
        return ImmutableSet.of();
    }

    private static boolean isSymbolicLeaf(Expr<?> expr) {
        return expr instanceof Expr.Var
                || expr instanceof Expr.GVar
                || expr instanceof Expr.SymAddr
                || expr instanceof Expr.AbstractBuf
                || expr instanceof Expr.AbstractStore;
    }
}
