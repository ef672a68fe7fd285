package net.katagaitai.evmterm.pass;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.traversal.ExprMapper;
import net.katagaitai.evmterm.traversal.Traversals;

import java.util.Map;

@Slf4j(topic = "evmterm")
public class FreshNameRenamer implements ExprMapper {
    private final String prefix;
    private final Map<String, String> wordNames = Maps.newLinkedHashMap();
    private final Map<String, String> bufNames = Maps.newLinkedHashMap();
    private int counter;

    public FreshNameRenamer(String prefix) {
        this.prefix = prefix;
    }

    public FreshNameRenamer() {
        this("fresh");
    }

    public <A> Expr<A> rename(Expr<A> expr) {
        return Traversals.mapExpr(this, expr);
    }

    public Prop rename(Prop prop) {
        return Traversals.mapProp(this, prop);
    }

    public ImmutableMap<String, String> getWordNames() {
        return ImmutableMap.copyOf(wordNames);
    }

    public ImmutableMap<String, String> getBufNames() {
        return ImmutableMap.copyOf(bufNames);
    }

    @Override
    public Expr<?> apply(Expr<?> expr) {
        if (expr instanceof Expr.Var) {
            return new Expr.Var(fresh(wordNames, ((Expr.Var) expr).getName()));
        }
        if (expr instanceof Expr.AbstractBuf) {
            return new Expr.AbstractBuf(fresh(bufNames, ((Expr.AbstractBuf) expr).getName()));
        }
        return expr;
    }

    private String fresh(Map<String, String> names, String name) {
        String renamed = names.get(name);
        if (renamed == null) {
            renamed = prefix + counter++;
            names.put(name, renamed);
            log.debug("リネーム: {} -> {}", name, renamed);
        }
        return renamed;
    }
}
