package net.katagaitai.evmterm;

import net.katagaitai.evmterm.expr.ExprTest;
import net.katagaitai.evmterm.pass.ExprAnalysisTest;
import net.katagaitai.evmterm.pass.FreshNameRenamerTest;
import net.katagaitai.evmterm.pass.PlaceholderSubstitutionTest;
import net.katagaitai.evmterm.prop.PropTest;
import net.katagaitai.evmterm.traversal.AuxiliaryTraversalTest;
import net.katagaitai.evmterm.traversal.ExprCatalogueTest;
import net.katagaitai.evmterm.traversal.TraversalsTest;
import net.katagaitai.evmterm.traversal.WriteChainTest;
import net.katagaitai.evmterm.util.UtilTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({
        ExprTest.class,
        PropTest.class,
        TraversalsTest.class,
        AuxiliaryTraversalTest.class,
        ExprCatalogueTest.class,
        WriteChainTest.class,
        ExprAnalysisTest.class,
        PlaceholderSubstitutionTest.class,
        FreshNameRenamerTest.class,
        UtilTest.class,
})
public class AllTests {
}
