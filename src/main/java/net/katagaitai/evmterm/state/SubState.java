package net.katagaitai.evmterm.state;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.Expr;

import java.util.Collection;
import java.util.List;

@Value
public class SubState {
    public static final SubState EMPTY = new SubState(
            ImmutableList.of(), ImmutableList.of(), ImmutableSet.of(), ImmutableSet.of(), ImmutableList.of());

    ImmutableList<Expr<EAddr>> selfdestructs;
    ImmutableList<Expr<EAddr>> touchedAccounts;
    ImmutableSet<Expr<EAddr>> accessedAddresses;
    ImmutableSet<StorageKey> accessedStorageKeys;
    ImmutableList<Refund> refunds;

    public SubState(@NonNull List<? extends Expr<EAddr>> selfdestructs,
                    @NonNull List<? extends Expr<EAddr>> touchedAccounts,
                    @NonNull Collection<? extends Expr<EAddr>> accessedAddresses,
                    @NonNull Collection<StorageKey> accessedStorageKeys,
                    @NonNull List<Refund> refunds) {
        this.selfdestructs = ImmutableList.copyOf(selfdestructs);
        this.touchedAccounts = ImmutableList.copyOf(touchedAccounts);
        this.accessedAddresses = ImmutableSet.copyOf(accessedAddresses);
        this.accessedStorageKeys = ImmutableSet.copyOf(accessedStorageKeys);
        this.refunds = ImmutableList.copyOf(refunds);
    }

    public SubState withSelfdestruct(Expr<EAddr> address) {
        return new SubState(
                ImmutableList.<Expr<EAddr>>builder().addAll(selfdestructs).add(address).build(),
                touchedAccounts, accessedAddresses, accessedStorageKeys, refunds);
    }

    public SubState withRefund(Refund refund) {
        return new SubState(selfdestructs, touchedAccounts, accessedAddresses, accessedStorageKeys,
                ImmutableList.<Refund>builder().addAll(refunds).add(refund).build());
    }
}
