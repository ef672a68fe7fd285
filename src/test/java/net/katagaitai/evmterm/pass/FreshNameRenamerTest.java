package net.katagaitai.evmterm.pass;

import com.google.common.collect.ImmutableMap;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import org.junit.Test;

import static org.junit.Assert.*;

public class FreshNameRenamerTest {
    @Test
    public void test_走査順に名前を振る() {
        Expr<EWord> expr = new Expr.Add(new Expr.Var("b"), new Expr.Mul(new Expr.Var("a"), new Expr.Var("b")));
        FreshNameRenamer renamer = new FreshNameRenamer("v");
        Expr<EWord> renamed = renamer.rename(expr);
        assertEquals(new Expr.Add(new Expr.Var("v0"), new Expr.Mul(new Expr.Var("v1"), new Expr.Var("v0"))),
                renamed);
        assertEquals(ImmutableMap.of("b", "v0", "a", "v1"), renamer.getWordNames());
    }

    @Test
    public void test_バッファとワードは別の表() {
        Expr<EBuf> expr = new Expr.WriteWord(new Expr.Var("x"), new Expr.ReadWord(Expr.Lit.of(0),
                new Expr.AbstractBuf("x")), new Expr.AbstractBuf("x"));
        FreshNameRenamer renamer = new FreshNameRenamer();
        Expr<EBuf> renamed = renamer.rename(expr);
        assertEquals(new Expr.WriteWord(new Expr.Var("fresh0"), new Expr.ReadWord(Expr.Lit.of(0),
                new Expr.AbstractBuf("fresh1")), new Expr.AbstractBuf("fresh1")), renamed);
        assertEquals(ImmutableMap.of("x", "fresh1"), renamer.getBufNames());
    }

    @Test
    public void test_呼び出しをまたいで同じ名前() {
        FreshNameRenamer renamer = new FreshNameRenamer("n");
        Prop prop = renamer.rename(new Prop.PGT(new Expr.Var("x"), new Expr.Var("y")));
        Expr<EWord> expr = renamer.rename(new Expr.Var("y"));
        assertEquals(new Prop.PGT(new Expr.Var("n0"), new Expr.Var("n1")), prop);
        assertEquals(new Expr.Var("n1"), expr);
    }

    @Test
    public void test_他の節は変えない() {
        Expr<EWord> expr = new Expr.Keccak(Expr.ConcreteBuf.ofHex("0xdeadbeef"));
        assertEquals(expr, new FreshNameRenamer().rename(expr));
    }
}
