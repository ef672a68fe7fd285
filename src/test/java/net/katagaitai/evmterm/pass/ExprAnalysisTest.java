package net.katagaitai.evmterm.pass;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.state.Refund;
import net.katagaitai.evmterm.state.SubState;
import net.katagaitai.evmterm.trace.FrameContext;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.TraceData;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;

public class ExprAnalysisTest {
    private static final Expr<EWord> SAMPLE =
            new Expr.Add(Expr.Lit.of(1), new Expr.Mul(Expr.Lit.of(2), Expr.Lit.of(3)));

    @Test
    public void test_countNodes() {
        assertEquals(5, ExprAnalysis.countNodes(SAMPLE));
        assertEquals(1, ExprAnalysis.countNodes(Expr.GVar.word(0)));
    }

    @Test
    public void test_collectLiteralsは前順() {
        Expr<EWord> expr = new Expr.Sub(new Expr.Add(Expr.Lit.of(3), Expr.Lit.of(1)), Expr.Lit.of(3));
        assertEquals(ImmutableList.of(BigInteger.valueOf(3), BigInteger.ONE, BigInteger.valueOf(3)),
                ExprAnalysis.collectLiterals(expr));
    }

    @Test
    public void test_Propのリテラル() {
        Prop prop = new Prop.PAnd(
                new Prop.PEq(Expr.Lit.of(1), Expr.Lit.of(1)),
                new Prop.PLT(Expr.Lit.of(2), Expr.Lit.of(3)));
        assertEquals(4, ExprAnalysis.collectLiterals(prop).size());
        assertEquals(4, ExprAnalysis.countNodes(prop));
    }

    @Test
    public void test_collectVars() {
        Expr<EWord> expr = new Expr.Add(new Expr.Var("x"), new Expr.Mul(new Expr.Var("y"), new Expr.Var("x")));
        assertEquals(ImmutableSet.of("x", "y"), ExprAnalysis.collectVars(expr));
        assertEquals(ImmutableList.of("x", "y"), ExprAnalysis.collectVars(expr).asList());
    }

    @Test
    public void test_containsNode() {
        assertTrue(ExprAnalysis.containsNode(SAMPLE, e -> e instanceof Expr.Mul));
        assertFalse(ExprAnalysis.containsNode(SAMPLE, e -> e instanceof Expr.Div));
    }

    @Test
    public void test_SubStateのアドレス() {
        SubState subState = new SubState(ImmutableList.of(), ImmutableList.of(),
                ImmutableSet.of(new Expr.SymAddr("7")), ImmutableSet.of(),
                ImmutableList.of(new Refund(new Expr.SymAddr("2"), 100)));
        assertEquals(ImmutableSet.of(new Expr.SymAddr("7"), new Expr.SymAddr("2")),
                ExprAnalysis.collectAddresses(subState));
    }

    @Test
    public void test_selfdestructと返金のアドレス() {
        SubState subState = SubState.EMPTY
                .withSelfdestruct(new Expr.SymAddr("1"))
                .withRefund(new Refund(new Expr.SymAddr("2"), 100));
        ImmutableSet<Expr<EAddr>> addresses = ExprAnalysis.collectAddresses(subState);
        assertTrue(addresses.contains(new Expr.SymAddr("1")));
        assertTrue(addresses.contains(new Expr.SymAddr("2")));
    }

    @Test
    public void test_Traceのアドレス() {
        Contract contract = new Contract(new ContractCode.UnknownCode(new Expr.SymAddr("code")),
                new Expr.AbstractStore(Expr.LitAddr.of(9)), new Expr.AbstractStore(Expr.LitAddr.of(9)),
                new Expr.Var("balance"), Optional.empty());
        Map<Expr<EAddr>, Contract> reversion = ImmutableMap.of(Expr.LitAddr.of(5), contract);
        FrameContext context = new FrameContext.CallContext(new Expr.SymAddr("target"), new Expr.SymAddr("caller"),
                BigInteger.ZERO, BigInteger.ZERO, Expr.Lit.of(0), Optional.of(BigInteger.ONE),
                new Expr.AbstractBuf("calldata"), reversion, SubState.EMPTY);
        Trace trace = new Trace(1, contract, new TraceData.FrameTrace(context));
        ImmutableSet<Expr<EAddr>> addresses = ExprAnalysis.collectAddresses(trace);
        assertEquals(ImmutableSet.of(new Expr.SymAddr("code"), Expr.LitAddr.of(9), new Expr.SymAddr("target"),
                new Expr.SymAddr("caller"), Expr.LitAddr.of(5)), addresses);
        assertEquals(ImmutableSet.of(new Expr.SymAddr("code"), Expr.LitAddr.of(9)),
                ExprAnalysis.collectAddresses(contract));
    }

    @Test
    public void test_WAddrもアドレス() {
        Expr<EWord> expr = new Expr.CodeSize(new Expr.WAddr(new Expr.Var("w")));
        assertEquals(ImmutableSet.of(new Expr.WAddr(new Expr.Var("w"))), ExprAnalysis.collectAddresses(expr));
    }

    @Test
    public void test_isConcrete() {
        assertTrue(ExprAnalysis.isConcrete(SAMPLE));
        assertFalse(ExprAnalysis.isConcrete(new Expr.Add(Expr.Lit.of(1), new Expr.Var("x"))));
        assertFalse(ExprAnalysis.isConcrete(new Expr.BufLength(new Expr.AbstractBuf("b"))));
        assertTrue(ExprAnalysis.isConcrete(new Expr.BufLength(Expr.ConcreteBuf.ofHex("0x01"))));
    }

    @Test
    public void test_hasPlaceholder() {
        assertFalse(ExprAnalysis.hasPlaceholder(SAMPLE));
        assertTrue(ExprAnalysis.hasPlaceholder(new Expr.SLoad(Expr.Lit.of(0), Expr.GVar.storage(1))));
        assertTrue(ExprAnalysis.hasPlaceholder(new Prop.PNeg(new Prop.PEq(Expr.GVar.buf(0), new Expr.AbstractBuf("b")))));
    }
}
