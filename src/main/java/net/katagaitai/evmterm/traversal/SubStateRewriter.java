package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.state.Refund;
import net.katagaitai.evmterm.state.StorageKey;
import net.katagaitai.evmterm.state.SubState;

class SubStateRewriter<X extends Exception> {
    private final ExprRewriter<X> exprs;

    SubStateRewriter(ExprRewriter<X> exprs) {
        this.exprs = exprs;
    }

    SubState mapSubState(SubState subState) throws X {
        ImmutableList<Expr<EAddr>> selfdestructs = exprs.mapAll(subState.getSelfdestructs());
        ImmutableList<Expr<EAddr>> touchedAccounts = exprs.mapAll(subState.getTouchedAccounts());
        ImmutableSet<Expr<EAddr>> accessedAddresses =
                ImmutableSet.copyOf(exprs.mapAll(subState.getAccessedAddresses().asList()));
        ImmutableSet.Builder<StorageKey> accessedStorageKeys = ImmutableSet.builder();
        for (StorageKey key : subState.getAccessedStorageKeys()) {
            accessedStorageKeys.add(new StorageKey(exprs.map(key.getAddress()), key.getSlot()));
        }
        ImmutableList.Builder<Refund> refunds = ImmutableList.builder();
        for (Refund refund : subState.getRefunds()) {
            refunds.add(new Refund(exprs.map(refund.getAddress()), refund.getAmount()));
        }
        return new SubState(selfdestructs, touchedAccounts, accessedAddresses, accessedStorageKeys.build(),
                refunds.build());
    }
}
