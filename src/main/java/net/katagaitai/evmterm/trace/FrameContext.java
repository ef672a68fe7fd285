package net.katagaitai.evmterm.trace;

import com.google.common.collect.ImmutableMap;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.state.SubState;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

public abstract class FrameContext {
    FrameContext() {
    }

    public abstract <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    public interface Visitor<R, X extends Exception> {
        R visitCreationContext(CreationContext context) throws X;

        R visitCallContext(CallContext context) throws X;
    }

    @Value
    public static class CreationContext extends FrameContext {
        Expr<EAddr> address;
        Expr<EWord> codehash;
        ImmutableMap<Expr<EAddr>, Contract> createReversion;
        SubState subState;

        public CreationContext(@NonNull Expr<EAddr> address, @NonNull Expr<EWord> codehash,
                               @NonNull Map<? extends Expr<EAddr>, Contract> createReversion,
                               @NonNull SubState subState) {
            this.address = address;
            this.codehash = codehash;
            this.createReversion = ImmutableMap.copyOf(createReversion);
            this.subState = subState;
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitCreationContext(this);
        }
    }

    @Value
    public static class CallContext extends FrameContext {
        Expr<EAddr> target;
        Expr<EAddr> context;
        BigInteger offset;
        BigInteger size;
        Expr<EWord> codehash;
        Optional<BigInteger> abi;
        Expr<EBuf> calldata;
        ImmutableMap<Expr<EAddr>, Contract> callReversion;
        SubState subState;

        public CallContext(@NonNull Expr<EAddr> target, @NonNull Expr<EAddr> context,
                           @NonNull BigInteger offset, @NonNull BigInteger size, @NonNull Expr<EWord> codehash,
                           @NonNull Optional<BigInteger> abi, @NonNull Expr<EBuf> calldata,
                           @NonNull Map<? extends Expr<EAddr>, Contract> callReversion,
                           @NonNull SubState subState) {
            this.target = target;
            this.context = context;
            this.offset = offset;
            this.size = size;
            this.codehash = codehash;
            this.abi = abi;
            this.calldata = calldata;
            this.callReversion = ImmutableMap.copyOf(callReversion);
            this.subState = subState;
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitCallContext(this);
        }
    }
}
