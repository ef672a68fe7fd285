package net.katagaitai.evmterm.prop;

import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.traversal.Monoids;
import org.junit.Test;

import static org.junit.Assert.*;

public class PropTest {
    @Test(expected = IllegalArgumentException.class)
    public void test_PEqで種別が違う() {
        new Prop.PEq(Expr.Lit.of(1), new Expr.SymAddr("a"));
    }

    @Test
    public void test_PEqでアドレス同士() {
        Prop.PEq eq = new Prop.PEq(Expr.LitAddr.of(1), new Expr.SymAddr("a"));
        assertEquals(new Expr.SymAddr("a"), eq.getRhs());
    }

    @Test
    public void test_foldTermでリテラルを数える() {
        Prop prop = new Prop.PAnd(
                new Prop.PEq(Expr.Lit.of(1), Expr.Lit.of(1)),
                new Prop.PLT(Expr.Lit.of(2), Expr.Lit.of(3)));
        int count = prop.foldTerm(expr -> expr instanceof Expr.Lit ? 1 : 0, Monoids.intSum(), 0);
        assertEquals(4, count);
    }

    @Test
    public void test_PBoolは式を持たない() {
        int count = new Prop.PNeg(new Prop.PBool(true)).foldTerm(expr -> 1, Monoids.intSum(), 0);
        assertEquals(0, count);
    }

    @Test
    public void test_mapTerm() {
        Prop prop = new Prop.PImpl(
                new Prop.PGEq(new Expr.Var("x"), Expr.Lit.of(0)),
                new Prop.POr(new Prop.PBool(false), new Prop.PGT(new Expr.Var("x"), Expr.Lit.of(1))));
        Prop mapped = prop.mapTerm(expr -> expr instanceof Expr.Var ? new Expr.Var("y") : expr);
        Prop expected = new Prop.PImpl(
                new Prop.PGEq(new Expr.Var("y"), Expr.Lit.of(0)),
                new Prop.POr(new Prop.PBool(false), new Prop.PGT(new Expr.Var("y"), Expr.Lit.of(1))));
        assertEquals(expected, mapped);
    }
}
