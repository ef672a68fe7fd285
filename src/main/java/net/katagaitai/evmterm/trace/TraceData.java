package net.katagaitai.evmterm.trace;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;

import java.util.List;

public abstract class TraceData {
    TraceData() {
    }

    public abstract <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    public interface Visitor<R, X extends Exception> {
        R visitEventTrace(EventTrace data) throws X;

        R visitFrameTrace(FrameTrace data) throws X;

        R visitErrorTrace(ErrorTrace data) throws X;

        R visitEntryTrace(EntryTrace data) throws X;

        R visitReturnTrace(ReturnTrace data) throws X;
    }

    @Value
    public static class EventTrace extends TraceData {
        Expr<EWord> address;
        Expr<EBuf> data;
        ImmutableList<Expr<EWord>> topics;

        public EventTrace(@NonNull Expr<EWord> address, @NonNull Expr<EBuf> data,
                          @NonNull List<? extends Expr<EWord>> topics) {
            this.address = address;
            this.data = data;
            this.topics = ImmutableList.copyOf(topics);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitEventTrace(this);
        }
    }

    @Value
    public static class FrameTrace extends TraceData {
        @NonNull
        FrameContext context;

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitFrameTrace(this);
        }
    }

    @Value
    public static class ErrorTrace extends TraceData {
        @NonNull
        EvmError error;

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitErrorTrace(this);
        }
    }

    @Value
    public static class EntryTrace extends TraceData {
        @NonNull
        String message;

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitEntryTrace(this);
        }
    }

    @Value
    public static class ReturnTrace extends TraceData {
        @NonNull
        Expr<EBuf> output;
        @NonNull
        FrameContext context;

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitReturnTrace(this);
        }
    }
}
