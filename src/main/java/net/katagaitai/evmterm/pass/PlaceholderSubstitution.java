package net.katagaitai.evmterm.pass;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.traversal.ExprMapperM;
import net.katagaitai.evmterm.traversal.Traversals;

import java.util.Map;
import java.util.Optional;

/**
 * Replaces placeholders ({@link Expr.GVar}) with bound expressions. A replacement is inserted as is; it is not
 * traversed again, so a binding that itself contains placeholders leaves them in place.
 */
@Slf4j(topic = "evmterm")
public class PlaceholderSubstitution {
    private final ImmutableMap<Expr.GVar<?>, Expr<?>> bindings;

    public PlaceholderSubstitution(Map<? extends Expr.GVar<?>, ? extends Expr<?>> bindings) {
        for (Map.Entry<? extends Expr.GVar<?>, ? extends Expr<?>> entry : bindings.entrySet()) {
            Preconditions.checkArgument(entry.getKey().getKind() == entry.getValue().getKind(),
                    "kind mismatch: %s -> %s", entry.getKey(), entry.getValue());
        }
        this.bindings = ImmutableMap.copyOf(bindings);
    }

    public <A> Expr<A> substitute(Expr<A> expr) throws UnresolvedPlaceholderException {
        return Traversals.mapExprM(strict(), expr);
    }

    public Prop substitute(Prop prop) throws UnresolvedPlaceholderException {
        return Traversals.mapPropM(strict(), prop);
    }

    public <A> Optional<Expr<A>> trySubstitute(Expr<A> expr) {
        return Traversals.mapExprOptional(node -> {
            if (node instanceof Expr.GVar) {
                return Optional.ofNullable(bindings.get(node));
            }
            return Optional.of(node);
        }, expr);
    }

    public Optional<Prop> trySubstitute(Prop prop) {
        return Traversals.mapPropOptional(node -> {
            if (node instanceof Expr.GVar) {
                return Optional.ofNullable(bindings.get(node));
            }
            return Optional.of(node);
        }, prop);
    }

    public <A> Expr<A> substituteBound(Expr<A> expr) {
        return Traversals.mapExpr(node -> {
            if (node instanceof Expr.GVar) {
                Expr<?> bound = bindings.get(node);
                return bound != null ? bound : node;
            }
            return node;
        }, expr);
    }

    private ExprMapperM<UnresolvedPlaceholderException> strict() {
        return node -> {
            if (!(node instanceof Expr.GVar)) {
                return node;
            }
            Expr<?> bound = bindings.get(node);
            if (bound == null) {
                log.debug("未束縛のプレースホルダ: {}", node);
                throw new UnresolvedPlaceholderException((Expr.GVar<?>) node);
            }
            return bound;
        };
    }
}
