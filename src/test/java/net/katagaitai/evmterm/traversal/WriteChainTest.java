package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class WriteChainTest {
    private static final int LENGTH = 5000;

    private static Expr<EBuf> wordWrites(int length) {
        Expr<EBuf> buffer = new Expr.AbstractBuf("m");
        for (int i = 0; i < length; i++) {
            buffer = new Expr.WriteWord(Expr.Lit.of(i), new Expr.Var("v"), buffer);
        }
        return buffer;
    }

    private static Expr<?> renameBuffer(Expr<?> expr) {
        if (expr instanceof Expr.AbstractBuf) {
            return new Expr.AbstractBuf(((Expr.AbstractBuf) expr).getName() + "'");
        }
        return expr;
    }

    private static String name(Expr<?> expr) {
        if (expr instanceof Expr.Var) {
            return ((Expr.Var) expr).getName();
        }
        if (expr instanceof Expr.AbstractBuf) {
            return ((Expr.AbstractBuf) expr).getName();
        }
        return expr.getClass().getSimpleName();
    }

    @Test
    public void test_長い書き込みの連鎖を畳み込む() {
        int count = Traversals.foldExpr(e -> 1, Monoids.intSum(), 0, wordWrites(LENGTH));
        assertEquals(LENGTH * 3 + 1, count);
    }

    @Test
    public void test_長い書き込みの連鎖を書き換える() {
        Expr<EBuf> current = Traversals.mapExpr(WriteChainTest::renameBuffer, wordWrites(LENGTH));
        int writes = 0;
        while (current instanceof Expr.WriteWord) {
            Expr.WriteWord write = (Expr.WriteWord) current;
            assertEquals(Expr.Lit.of(LENGTH - 1 - writes), write.getIndex());
            writes++;
            current = write.getBuffer();
        }
        assertEquals(LENGTH, writes);
        assertEquals(new Expr.AbstractBuf("m'"), current);
    }

    @Test
    public void test_長いSStoreの連鎖() {
        Expr<EStorage> storage = new Expr.AbstractStore(new Expr.SymAddr("s"));
        for (int i = 0; i < LENGTH; i++) {
            storage = new Expr.SStore(Expr.Lit.of(i), new Expr.Var("x"), storage);
        }
        assertEquals(LENGTH * 3 + 2, Traversals.foldExpr(e -> 1, Monoids.intSum(), 0, storage).intValue());

        Expr<EStorage> current = Traversals.mapExpr(
                e -> e instanceof Expr.Var ? new Expr.Var("y") : e, storage);
        int stores = 0;
        while (current instanceof Expr.SStore) {
            Expr.SStore store = (Expr.SStore) current;
            assertEquals(new Expr.Var("y"), store.getValue());
            stores++;
            current = store.getStorage();
        }
        assertEquals(LENGTH, stores);
        assertEquals(new Expr.AbstractStore(new Expr.SymAddr("s")), current);
    }

    @Test
    public void test_CopySliceとWriteByteの混ざった連鎖() {
        Expr<EBuf> buffer = new Expr.AbstractBuf("m");
        for (int i = 0; i < LENGTH; i++) {
            if (i % 2 == 0) {
                buffer = new Expr.CopySlice(Expr.Lit.of(0), Expr.Lit.of(i), Expr.Lit.of(32),
                        new Expr.AbstractBuf("src"), buffer);
            } else {
                buffer = new Expr.WriteByte(Expr.Lit.of(i), new Expr.LitByte(1), buffer);
            }
        }
        // CopySliceは5個、WriteByteは3個
        int count = Traversals.foldExpr(e -> 1, Monoids.intSum(), 0, buffer);
        assertEquals(LENGTH / 2 * 5 + LENGTH / 2 * 3 + 1, count);

        Expr<EBuf> current = Traversals.mapExpr(WriteChainTest::renameBuffer, buffer);
        int nodes = 0;
        while (true) {
            if (current instanceof Expr.CopySlice) {
                assertEquals(new Expr.AbstractBuf("src'"), ((Expr.CopySlice) current).getSrc());
                current = ((Expr.CopySlice) current).getDst();
            } else if (current instanceof Expr.WriteByte) {
                current = ((Expr.WriteByte) current).getBuffer();
            } else {
                break;
            }
            nodes++;
        }
        assertEquals(LENGTH, nodes);
        assertEquals(new Expr.AbstractBuf("m'"), current);
    }

    @Test
    public void test_連鎖の訪問順() {
        Expr<EBuf> buffer = new Expr.WriteWord(new Expr.Var("a1"), new Expr.Var("b1"),
                new Expr.WriteWord(new Expr.Var("a2"), new Expr.Var("b2"), new Expr.AbstractBuf("m")));
        List<String> folded = Traversals.foldExpr(e -> ImmutableList.of(name(e)), Monoids.<String>list(),
                ImmutableList.of(), buffer);
        assertEquals(ImmutableList.of("WriteWord", "a1", "b1", "WriteWord", "a2", "b2", "m"), folded);

        List<String> mapped = new ArrayList<>();
        Traversals.mapExpr(e -> {
            mapped.add(name(e));
            return e;
        }, buffer);
        assertEquals(ImmutableList.of("a1", "b1", "a2", "b2", "m", "WriteWord", "WriteWord"), mapped);
    }

    @Test
    public void test_連鎖の途中で失敗() {
        try {
            Traversals.mapExprM(e -> {
                if (e.equals(Expr.Lit.of(10))) {
                    throw new IOException("10");
                }
                return e;
            }, wordWrites(LENGTH));
            fail();
        } catch (IOException e) {
            assertEquals("10", e.getMessage());
        }
    }

    @Test
    public void test_オペランドの入れ子は深さを数える() {
        Expr<EWord> deep = Expr.Lit.of(0);
        for (int i = 0; i < 2000; i++) {
            deep = new Expr.Not(deep);
        }
        Expr<EBuf> buffer = new Expr.WriteWord(Expr.Lit.of(0), deep, new Expr.AbstractBuf("m"));
        try {
            Traversals.foldExpr(e -> 1, Monoids.intSum(), 0, buffer);
            fail();
        } catch (TraversalDepthException e) {
            assertEquals(1024, e.getMaxDepth());
        }
        try {
            Traversals.mapExpr(ExprMapper.identity(), buffer);
            fail();
        } catch (TraversalDepthException e) {
            assertEquals(1024, e.getMaxDepth());
        }
    }
}
