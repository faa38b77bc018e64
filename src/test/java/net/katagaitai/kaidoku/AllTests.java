package net.katagaitai.kaidoku;

import net.katagaitai.kaidoku.act.ActJsonTest;
import net.katagaitai.kaidoku.act.EnricherTest;
import net.katagaitai.kaidoku.act.ExpTest;
import net.katagaitai.kaidoku.decompile.SafetyNormalizerTest;
import net.katagaitai.kaidoku.decompile.SimplifierTest;
import net.katagaitai.kaidoku.decompile.StoragePartitionerTest;
import net.katagaitai.kaidoku.decompile.SummarizerTest;
import net.katagaitai.kaidoku.decompile.TranslatorTest;
import net.katagaitai.kaidoku.evm.MachineTest;
import net.katagaitai.kaidoku.evm.expr.ExprTest;
import net.katagaitai.kaidoku.smt.Z3SolverPoolTest;
import net.katagaitai.kaidoku.solidity.AbiTypeTest;
import net.katagaitai.kaidoku.solidity.ArtifactReaderTest;
import net.katagaitai.kaidoku.solidity.SelectorsTest;
import net.katagaitai.kaidoku.verify.EquivalenceCheckerTest;
import net.katagaitai.kaidoku.verify.SpecCompilerTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({
        ExprTest.class,
        MachineTest.class,
        Z3SolverPoolTest.class,
        AbiTypeTest.class,
        SelectorsTest.class,
        ArtifactReaderTest.class,
        SafetyNormalizerTest.class,
        StoragePartitionerTest.class,
        SimplifierTest.class,
        SummarizerTest.class,
        TranslatorTest.class,
        ExpTest.class,
        EnricherTest.class,
        ActJsonTest.class,
        SpecCompilerTest.class,
        EquivalenceCheckerTest.class,
        DecompilerTest.class,
})
public class AllTests {
}
