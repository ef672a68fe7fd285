package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EByte;
import net.katagaitai.evmterm.expr.EEnd;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.trace.EvmError;
import net.katagaitai.evmterm.trace.PartialExec;
import net.katagaitai.evmterm.trace.Trace;
import net.katagaitai.evmterm.trace.TraceData;
import net.katagaitai.evmterm.trace.TraceTree;
import net.katagaitai.evmterm.trace.Traces;
import org.junit.Test;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

// 全ノードを一つずつ並べ、走査の形と順序を確かめる
public class ExprCatalogueTest {
    private static class Entry {
        final Expr<?> expr;
        final ImmutableList<String> tags;

        Entry(Expr<?> expr, String... tags) {
            this.expr = expr;
            this.tags = ImmutableList.copyOf(tags);
        }
    }

    private static Expr<EWord> v(String name) {
        return new Expr.Var(name);
    }

    private static Expr<EBuf> buf(String name) {
        return new Expr.AbstractBuf(name);
    }

    private static Expr<EAddr> addr(String name) {
        return new Expr.SymAddr(name);
    }

    private static Expr<EStorage> store() {
        return new Expr.AbstractStore(addr("s"));
    }

    private static String tag(Expr<?> expr) {
        if (expr instanceof Expr.Var) {
            return "Var " + ((Expr.Var) expr).getName();
        }
        if (expr instanceof Expr.AbstractBuf) {
            return "Buf " + ((Expr.AbstractBuf) expr).getName();
        }
        if (expr instanceof Expr.SymAddr) {
            return "Addr " + ((Expr.SymAddr) expr).getName();
        }
        return expr.getClass().getSimpleName();
    }

    private static ImmutableList<String> tags(Expr<?> expr) {
        return Traversals.foldExpr(e -> ImmutableList.of(tag(e)), Monoids.<String>list(), ImmutableList.of(), expr);
    }

    private static Expr<?> prime(Expr<?> expr) {
        if (expr instanceof Expr.Var) {
            return new Expr.Var(((Expr.Var) expr).getName() + "'");
        }
        if (expr instanceof Expr.AbstractBuf) {
            return new Expr.AbstractBuf(((Expr.AbstractBuf) expr).getName() + "'");
        }
        if (expr instanceof Expr.SymAddr) {
            return new Expr.SymAddr(((Expr.SymAddr) expr).getName() + "'");
        }
        return expr;
    }

    private static List<String> primed(List<String> tags) {
        List<String> result = new ArrayList<>();
        for (String tag : tags) {
            boolean leaf = tag.startsWith("Var ") || tag.startsWith("Buf ") || tag.startsWith("Addr ");
            result.add(leaf ? tag + "'" : tag);
        }
        return result;
    }

    static List<Entry> catalogue() {
        List<Entry> entries = new ArrayList<>();

        // literals & variables
        entries.add(new Entry(Expr.Lit.of(1), "Lit"));
        entries.add(new Entry(new Expr.LitByte(7), "LitByte"));
        entries.add(new Entry(v("a"), "Var a"));
        entries.add(new Entry(Expr.GVar.word(0), "GVar"));

        // contracts
        entries.add(new Entry(new Expr.C(new ContractCode.UnknownCode(addr("u")), store(), v("b"), Optional.of(1L)),
                "C", "Addr u", "AbstractStore", "Addr s", "Var b"));

        // bytes
        entries.add(new Entry(new Expr.IndexWord(v("a"), v("b")), "IndexWord", "Var a", "Var b"));
        entries.add(new Entry(new Expr.EqByte(new Expr.LitByte(1), Expr.GVar.ofByte(0)), "EqByte", "LitByte", "GVar"));
        List<Expr<EByte>> bytes = new ArrayList<>();
        List<String> joinTags = new ArrayList<>();
        joinTags.add("JoinBytes");
        for (int i = 0; i < 31; i++) {
            bytes.add(new Expr.LitByte(0));
            joinTags.add("LitByte");
        }
        bytes.add(new Expr.IndexWord(v("a"), v("b")));
        joinTags.add("IndexWord");
        joinTags.add("Var a");
        joinTags.add("Var b");
        entries.add(new Entry(new Expr.JoinBytes(bytes), joinTags.toArray(new String[0])));

        // control flow
        entries.add(new Entry(new Expr.Success(ImmutableList.of(new Prop.PEq(v("a"), v("b"))), Traces.EMPTY,
                buf("m"), ImmutableMap.of(addr("k"), Expr.GVar.contract(0))),
                "Success", "Var a", "Var b", "Buf m", "Addr k", "GVar"));
        Expr<EEnd> failure = new Expr.Failure(ImmutableList.of(), Traces.EMPTY, EvmError.STACK_UNDERRUN);
        entries.add(new Entry(failure, "Failure"));
        Contract contract = new Contract(new ContractCode.ConcreteRuntimeCode(new byte[]{0x60, 0x00}),
                store(), store(), v("c"), Optional.empty());
        Traces traces = new Traces(
                ImmutableList.of(TraceTree.leaf(new Trace(0, contract, new TraceData.EntryTrace("entry")))),
                ImmutableMap.of());
        entries.add(new Entry(new Expr.Partial(ImmutableList.of(), traces,
                new PartialExec(PartialExec.Reason.MAX_ITERATIONS_REACHED, 3, "loop")),
                "Partial", "AbstractStore", "Addr s", "AbstractStore", "Addr s", "Var c"));
        entries.add(new Entry(new Expr.ITE(v("a"), failure, Expr.GVar.end(0)), "ITE", "Var a", "Failure", "GVar"));

        // arithmetic, comparisons, bits
        List<Expr<EWord>> binaries = ImmutableList.of(
                new Expr.Add(v("a"), v("b")), new Expr.Sub(v("a"), v("b")), new Expr.Mul(v("a"), v("b")),
                new Expr.Div(v("a"), v("b")), new Expr.SDiv(v("a"), v("b")), new Expr.Mod(v("a"), v("b")),
                new Expr.SMod(v("a"), v("b")), new Expr.Exp(v("a"), v("b")), new Expr.SEx(v("a"), v("b")),
                new Expr.Min(v("a"), v("b")), new Expr.Max(v("a"), v("b")),
                new Expr.LT(v("a"), v("b")), new Expr.GT(v("a"), v("b")), new Expr.LEq(v("a"), v("b")),
                new Expr.GEq(v("a"), v("b")), new Expr.SLT(v("a"), v("b")), new Expr.SGT(v("a"), v("b")),
                new Expr.Eq(v("a"), v("b")),
                new Expr.And(v("a"), v("b")), new Expr.Or(v("a"), v("b")), new Expr.Xor(v("a"), v("b")),
                new Expr.SHL(v("a"), v("b")), new Expr.SHR(v("a"), v("b")), new Expr.SAR(v("a"), v("b")));
        for (Expr<EWord> binary : binaries) {
            entries.add(new Entry(binary, binary.getClass().getSimpleName(), "Var a", "Var b"));
        }
        entries.add(new Entry(new Expr.AddMod(v("a"), v("b"), v("c")), "AddMod", "Var a", "Var b", "Var c"));
        entries.add(new Entry(new Expr.MulMod(v("a"), v("b"), v("c")), "MulMod", "Var a", "Var b", "Var c"));
        entries.add(new Entry(new Expr.IsZero(v("a")), "IsZero", "Var a"));
        entries.add(new Entry(new Expr.Not(v("a")), "Not", "Var a"));

        // hashes
        entries.add(new Entry(new Expr.Keccak(buf("m")), "Keccak", "Buf m"));
        entries.add(new Entry(new Expr.SHA256(buf("m")), "SHA256", "Buf m"));

        // block, tx and frame context
        List<Expr<EWord>> nullaries = ImmutableList.of(
                new Expr.Origin(), new Expr.Coinbase(), new Expr.Timestamp(), new Expr.BlockNumber(),
                new Expr.PrevRandao(), new Expr.GasLimit(), new Expr.ChainId(), new Expr.BaseFee(),
                new Expr.TxValue(), new Expr.Gas(1, 2), new Expr.Balance(1, 2));
        for (Expr<EWord> nullary : nullaries) {
            entries.add(new Entry(nullary, nullary.getClass().getSimpleName()));
        }
        entries.add(new Entry(new Expr.BlockHash(v("a")), "BlockHash", "Var a"));

        // code
        entries.add(new Entry(new Expr.CodeSize(addr("p")), "CodeSize", "Addr p"));
        entries.add(new Entry(new Expr.CodeHash(addr("p")), "CodeHash", "Addr p"));

        // logs
        entries.add(new Entry(new Expr.LogEntry(v("a"), buf("m"), ImmutableList.of(v("b"), v("c"))),
                "LogEntry", "Var a", "Buf m", "Var b", "Var c"));

        // contract creation
        entries.add(new Entry(new Expr.Create(v("a"), v("b"), v("c"), buf("n"),
                ImmutableList.of(new Expr.LogEntry(v("d"), buf("m"), ImmutableList.of(v("e")))), store()),
                "Create", "Var a", "Var b", "Var c", "Buf n",
                "LogEntry", "Var d", "Buf m", "Var e", "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.Create2(v("a"), v("b"), v("c"), v("d"), buf("n"),
                ImmutableList.of(new Expr.LogEntry(v("e"), buf("m"), ImmutableList.of())), store()),
                "Create2", "Var a", "Var b", "Var c", "Var d", "Buf n",
                "LogEntry", "Var e", "Buf m", "AbstractStore", "Addr s"));

        // calls
        entries.add(new Entry(new Expr.Call(v("a"), Optional.of(addr("p")), v("b"), v("c"), v("d"), v("e"), v("f"),
                ImmutableList.of(), store()),
                "Call", "Var a", "Addr p", "Var b", "Var c", "Var d", "Var e", "Var f", "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.Call(v("a"), Optional.empty(), v("b"), v("c"), v("d"), v("e"), v("f"),
                ImmutableList.of(), store()),
                "Call", "Var a", "Var b", "Var c", "Var d", "Var e", "Var f", "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.CallCode(v("a"), v("t"), v("b"), v("c"), v("d"), v("e"), v("f"),
                ImmutableList.of(Expr.GVar.log(0)), store()),
                "CallCode", "Var a", "Var t", "Var b", "Var c", "Var d", "Var e", "Var f", "GVar",
                "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.DelegateCall(v("a"), v("t"), v("b"), v("c"), v("d"), v("e"), v("f"),
                ImmutableList.of(), store()),
                "DelegateCall", "Var a", "Var t", "Var b", "Var c", "Var d", "Var e", "Var f",
                "AbstractStore", "Addr s"));

        // addresses
        entries.add(new Entry(Expr.LitAddr.of(5), "LitAddr"));
        entries.add(new Entry(addr("p"), "Addr p"));
        entries.add(new Entry(new Expr.WAddr(v("a")), "WAddr", "Var a"));

        // storage
        entries.add(new Entry(new Expr.ConcreteStore(addr("p"), ImmutableMap.of(BigInteger.ONE, BigInteger.TEN)),
                "ConcreteStore", "Addr p"));
        entries.add(new Entry(store(), "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.SLoad(v("a"), store()), "SLoad", "Var a", "AbstractStore", "Addr s"));
        entries.add(new Entry(new Expr.SStore(v("a"), v("b"), store()),
                "SStore", "Var a", "Var b", "AbstractStore", "Addr s"));

        // buffers
        entries.add(new Entry(Expr.ConcreteBuf.ofHex("0x6001"), "ConcreteBuf"));
        entries.add(new Entry(buf("m"), "Buf m"));
        entries.add(new Entry(new Expr.ReadWord(v("a"), buf("m")), "ReadWord", "Var a", "Buf m"));
        entries.add(new Entry(new Expr.ReadByte(v("a"), buf("m")), "ReadByte", "Var a", "Buf m"));
        entries.add(new Entry(new Expr.WriteWord(v("a"), v("b"), buf("m")), "WriteWord", "Var a", "Var b", "Buf m"));
        entries.add(new Entry(new Expr.WriteByte(v("a"), new Expr.LitByte(1), buf("m")),
                "WriteByte", "Var a", "LitByte", "Buf m"));
        entries.add(new Entry(new Expr.CopySlice(v("a"), v("b"), v("c"), buf("n"), buf("m")),
                "CopySlice", "Var a", "Var b", "Var c", "Buf n", "Buf m"));
        entries.add(new Entry(new Expr.BufLength(buf("m")), "BufLength", "Buf m"));
        return entries;
    }

    @Test
    public void test_全ノードを網羅している() {
        Set<Class<?>> covered = new HashSet<>();
        for (Entry entry : catalogue()) {
            covered.add(entry.expr.getClass());
        }
        Set<Class<?>> nodes = new HashSet<>();
        for (Class<?> nested : Expr.class.getDeclaredClasses()) {
            if (Expr.class.isAssignableFrom(nested) && !Modifier.isAbstract(nested.getModifiers())) {
                nodes.add(nested);
            }
        }
        assertEquals(77, nodes.size());
        assertEquals(nodes, covered);
    }

    @Test
    public void test_恒等写像() {
        for (Entry entry : catalogue()) {
            assertEquals(tag(entry.expr), entry.expr, Traversals.mapExpr(ExprMapper.identity(), entry.expr));
        }
    }

    @Test
    public void test_ノード数() {
        for (Entry entry : catalogue()) {
            int count = Traversals.foldExpr(e -> 1, Monoids.intSum(), 0, entry.expr);
            assertEquals(tag(entry.expr), entry.tags.size(), count);
        }
    }

    @Test
    public void test_前順の並び() {
        for (Entry entry : catalogue()) {
            assertEquals(entry.tags, tags(entry.expr));
        }
    }

    @Test
    public void test_失敗しないmapExprMはmapExprと一致() throws IOException {
        ExprMapperM<IOException> mapper = ExprCatalogueTest::prime;
        for (Entry entry : catalogue()) {
            assertEquals(tag(entry.expr), Traversals.mapExpr(ExprCatalogueTest::prime, entry.expr),
                    Traversals.mapExprM(mapper, entry.expr));
        }
    }

    @Test
    public void test_葉の書き換えは形を保つ() {
        for (Entry entry : catalogue()) {
            Expr<?> mapped = Traversals.mapExpr(ExprCatalogueTest::prime, entry.expr);
            assertEquals(entry.expr.getClass(), mapped.getClass());
            assertEquals(primed(entry.tags), tags(mapped));
        }
    }
}
