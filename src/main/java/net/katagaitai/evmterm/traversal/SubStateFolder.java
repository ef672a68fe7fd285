package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.state.Refund;
import net.katagaitai.evmterm.state.StorageKey;
import net.katagaitai.evmterm.state.SubState;

class SubStateFolder<B> {
    private final ExprFolder<B> exprs;

    SubStateFolder(ExprFolder<B> exprs) {
        this.exprs = exprs;
    }

    void foldSubState(SubState subState) {
        exprs.foldAll(subState.getSelfdestructs());
        exprs.foldAll(subState.getTouchedAccounts());
        exprs.foldAll(subState.getAccessedAddresses());
        for (StorageKey key : subState.getAccessedStorageKeys()) {
            exprs.fold(key.getAddress());
        }
        for (Refund refund : subState.getRefunds()) {
            exprs.fold(refund.getAddress());
        }
    }
}
