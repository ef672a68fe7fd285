package net.katagaitai.evmterm.prop;

import com.google.common.base.Preconditions;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.traversal.ExprMapper;
import net.katagaitai.evmterm.traversal.Monoid;
import net.katagaitai.evmterm.traversal.Term;
import net.katagaitai.evmterm.traversal.Traversals;

import java.util.function.Function;

public abstract class Prop implements Term<Prop> {
    Prop() {
    }

    public abstract <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X;

    @Override
    public Prop mapTerm(ExprMapper mapper) {
        return Traversals.mapProp(mapper, this);
    }

    @Override
    public <B> B foldTerm(Function<? super Expr<?>, ? extends B> f, Monoid<B> monoid, B acc) {
        return Traversals.foldProp(f, monoid, acc, this);
    }

    @Value
    public static class PBool extends Prop {
        boolean value;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPBool(this);
        }
    }

    @Value
    public static class PEq extends Prop {
        Expr<?> lhs;
        Expr<?> rhs;

        public PEq(@NonNull Expr<?> lhs, @NonNull Expr<?> rhs) {
            Preconditions.checkArgument(lhs.getKind() == rhs.getKind(),
                    "PEq over different kinds: %s and %s", lhs.getKind(), rhs.getKind());
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPEq(this);
        }
    }

    @Value
    public static class PLT extends Prop {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPLT(this);
        }
    }

    @Value
    public static class PGT extends Prop {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPGT(this);
        }
    }

    @Value
    public static class PLEq extends Prop {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPLEq(this);
        }
    }

    @Value
    public static class PGEq extends Prop {
        @NonNull
        Expr<EWord> lhs;
        @NonNull
        Expr<EWord> rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPGEq(this);
        }
    }

    @Value
    public static class PNeg extends Prop {
        @NonNull
        Prop operand;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPNeg(this);
        }
    }

    @Value
    public static class PAnd extends Prop {
        @NonNull
        Prop lhs;
        @NonNull
        Prop rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPAnd(this);
        }
    }

    @Value
    public static class POr extends Prop {
        @NonNull
        Prop lhs;
        @NonNull
        Prop rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPOr(this);
        }
    }

    @Value
    public static class PImpl extends Prop {
        @NonNull
        Prop lhs;
        @NonNull
        Prop rhs;

        @Override
        public <R, X extends Exception> R accept(PropVisitor<R, X> visitor) throws X {
            return visitor.visitPImpl(this);
        }
    }
}
