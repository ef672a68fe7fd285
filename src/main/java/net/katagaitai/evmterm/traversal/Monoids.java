package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.function.BinaryOperator;

public class Monoids {
    private static final Monoid<Integer> INT_SUM = of(0, Integer::sum);
    private static final Monoid<Long> LONG_SUM = of(0L, Long::sum);
    private static final Monoid<Boolean> ANY = of(false, Boolean::logicalOr);
    private static final Monoid<Boolean> ALL = of(true, Boolean::logicalAnd);

    private Monoids() {
    }

    public static <B> Monoid<B> of(B empty, BinaryOperator<B> combine) {
        return new Monoid<B>() {
            @Override
            public B empty() {
                return empty;
            }

            @Override
            public B combine(B lhs, B rhs) {
                return combine.apply(lhs, rhs);
            }
        };
    }

    public static Monoid<Integer> intSum() {
        return INT_SUM;
    }

    public static Monoid<Long> longSum() {
        return LONG_SUM;
    }

    public static Monoid<Boolean> any() {
        return ANY;
    }

    public static Monoid<Boolean> all() {
        return ALL;
    }

    public static <T> Monoid<ImmutableList<T>> list() {
        return of(ImmutableList.of(), (lhs, rhs) -> {
            if (lhs.isEmpty()) {
                return rhs;
            }
            if (rhs.isEmpty()) {
                return lhs;
            }
            return ImmutableList.<T>builder().addAll(lhs).addAll(rhs).build();
        });
    }

    public static <T> Monoid<ImmutableSet<T>> set() {
        return of(ImmutableSet.of(), (lhs, rhs) -> {
            if (rhs.isEmpty()) {
                return lhs;
            }
            return ImmutableSet.<T>builder().addAll(lhs).addAll(rhs).build();
        });
    }
}
