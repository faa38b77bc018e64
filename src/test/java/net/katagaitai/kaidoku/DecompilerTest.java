package net.katagaitai.kaidoku;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActJson;
import net.katagaitai.kaidoku.act.ActType;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.Contract;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.act.StorageItem;
import net.katagaitai.kaidoku.act.StorageUpdate;
import net.katagaitai.kaidoku.act.Timing;
import net.katagaitai.kaidoku.act.ValueType;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.util.Constants;
import net.katagaitai.kaidoku.verify.VerificationFailure;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import static junit.framework.TestCase.*;

public class DecompilerTest {
    private static final AbiType UINT256 = AbiType.uint(256);

    private static Decompiler decompiler;

    private final StorageItem x = StorageItem.of(ActType.INTEGER, ValueType.primitive(UINT256), "Store", "x");

    @BeforeClass
    public static void setup() {
        decompiler = new Decompiler(2, 30_000);
    }

    @AfterClass
    public static void tearDown() {
        decompiler.close();
    }

    @Test
    public void test_逆コンパイルと検証() throws DecompileException {
        Act act = decompiler.decompile(Contracts.store());
        assertEquals(1, act.getContracts().size());
        Contract contract = act.getContracts().get(0);

        Constructor ctor = contract.getConstructor();
        assertEquals("Store", ctor.getName());
        assertEquals(ImmutableList.of(new StorageUpdate(x, Exp.var(ActType.INTEGER, UINT256, "init"))),
                ctor.getInitialStorage());

        ImmutableList<Behaviour> behaviours = contract.getBehaviours();
        assertEquals(3, behaviours.size());
        Behaviour add = behaviours.get(0);
        Behaviour get = behaviours.get(1);
        Behaviour set = behaviours.get(2);

        assertEquals("add", add.getName());
        assertTrue(add.getPreconditions().toString(),
                add.getPreconditions().stream().anyMatch(p -> p.is(Exp.Kind.IN_RANGE)));
        assertTrue(add.getStateUpdates().isEmpty());

        assertEquals("get", get.getName());
        assertEquals(Exp.tEntry(Timing.PRE, x), get.getReturns());

        assertEquals("set", set.getName());
        assertNull(set.getReturns());
        assertEquals(ImmutableList.of(new StorageUpdate(x, Exp.var(ActType.INTEGER, UINT256, "v"))),
                set.getStateUpdates());
    }

    @Test
    public void test_範囲条件は返す仕様に含めない() throws DecompileException {
        Act act = decompiler.decompile(Contracts.store());
        Behaviour get = act.getContracts().get(0).getBehaviours().get(1);
        assertTrue(get.getPreconditions().isEmpty());
        assertTrue(ActJson.write(act).contains("\"Behaviour\""));
    }

    @Test
    public void test_ABIにない関数は検証で見つかる() {
        try {
            decompiler.decompile(Contracts.storeWithHiddenSetter());
            fail();
        } catch (DecompileException e) {
            assertEquals(ErrorKind.VERIFICATION_COUNTEREXAMPLE, e.getKind());
            VerificationFailure failure = e.getFailures().stream()
                    .filter(f -> f.getLocation().equals("abi"))
                    .findFirst()
                    .orElse(null);
            assertNotNull(e.getMessage(), failure);
            assertTrue(failure.getMessage(), failure.getMessage().startsWith(
                    "The following function selector results in behaviors not covered by the Act spec:"));
            assertTrue(failure.getMessage(), failure.getMessage().contains("selector = 0x60fe47b1"));
        }
    }

    @Test
    public void test_検査のない加算は剰余で表す() throws DecompileException {
        Act act = decompiler.decompile(Contracts.uncheckedAdder());
        ImmutableList<Behaviour> behaviours = act.getContracts().get(0).getBehaviours();
        assertEquals(1, behaviours.size());
        Behaviour add = behaviours.get(0);
        assertTrue(add.getPreconditions().toString(), add.getPreconditions().isEmpty());

        Exp returns = add.getReturns();
        assertTrue(returns.toString(), returns.is(Exp.Kind.MOD));
        assertEquals(Exp.litInt(Constants.TWO_256), returns.getArgs().get(1));
        Exp sum = returns.getArgs().get(0);
        assertTrue(sum.toString(), sum.is(Exp.Kind.ADD));
        assertEquals(ImmutableSet.of(Exp.var(ActType.INTEGER, UINT256, "a"), Exp.var(ActType.INTEGER, UINT256, "b")),
                ImmutableSet.copyOf(sum.getArgs()));
    }

    @Test
    public void test_レイアウトがなければ失敗() {
        try {
            decompiler.decompile(Contracts.store().withoutStorageLayout());
            fail();
        } catch (DecompileException e) {
            assertEquals(ErrorKind.MISSING_LAYOUT, e.getKind());
        }
    }
}
