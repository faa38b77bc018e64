package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import net.katagaitai.kaidoku.Contracts;
import net.katagaitai.kaidoku.DecompileException;
import net.katagaitai.kaidoku.ErrorKind;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActType;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.EthEnv;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.act.StorageItem;
import net.katagaitai.kaidoku.act.StorageUpdate;
import net.katagaitai.kaidoku.act.Timing;
import net.katagaitai.kaidoku.act.ValueType;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.solidity.LayoutItem;
import net.katagaitai.kaidoku.solidity.Method;
import net.katagaitai.kaidoku.solidity.Param;
import net.katagaitai.kaidoku.solidity.StorageType;
import net.katagaitai.kaidoku.util.Constants;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;

import static junit.framework.TestCase.*;

public class TranslatorTest {
    private static final AbiType UINT256 = AbiType.uint(256);
    private static final Expr STORAGE = Expr.abstractStore("storage");

    private final Expr a = Expr.var("a");
    private final Expr b = Expr.var("b");
    private final Exp aExp = Exp.var(ActType.INTEGER, UINT256, "a");
    private final Exp bExp = Exp.var(ActType.INTEGER, UINT256, "b");
    private final StorageItem x = StorageItem.of(ActType.INTEGER, ValueType.primitive(UINT256), "Store", "x");

    private static Expr creation() {
        return Expr.success(ImmutableList.of(), Expr.bytes(new byte[]{0x00}),
                Expr.sstore(Expr.ZERO, Expr.var("init"), Expr.concreteStore(ImmutableMap.of())));
    }

    private static Expr success(List<Prop> props, Expr ret, Expr storage) {
        return Expr.success(props, ret == null ? Expr.EMPTY_BUF : Expr.wordBytes(ret), storage);
    }

    private static ContractSummary summary(ImmutableMap<String, LayoutItem> layout, Method method,
                                           ImmutableSet<Expr> outcomes, ImmutableSet<Expr> creation) {
        return new ContractSummary("Store", layout, ImmutableSortedMap.of(method, outcomes),
                Interface.of("constructor", ImmutableList.of(Contracts.uint256("init"))), creation);
    }

    private static ContractSummary summary(Method method, Expr... outcomes) {
        return summary(Contracts.layout(), method, ImmutableSet.copyOf(outcomes), ImmutableSet.of(creation()));
    }

    private static Behaviour single(ContractSummary summary) throws DecompileException {
        ImmutableList<Behaviour> behaviours = new Translator(summary).mkBehaviours();
        assertEquals(1, behaviours.size());
        return behaviours.get(0);
    }

    private static void assertUnsupported(ContractSummary summary, String message) {
        try {
            new Translator(summary).translate();
            fail();
        } catch (DecompileException e) {
            assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.getKind());
            assertTrue(e.getMessage(), e.getMessage().startsWith(message));
        }
    }

    @Test
    public void test_コンストラクタ() throws DecompileException {
        Act act = new Translator(summary(Contracts.GET, success(ImmutableList.of(), Expr.ZERO, STORAGE)))
                .translate();
        Constructor ctor = act.getContracts().get(0).getConstructor();
        assertEquals("Store", ctor.getName());
        assertEquals("constructor(uint256 init)", ctor.getIface().toString());
        assertEquals(ImmutableList.of(new StorageUpdate(x, Exp.var(ActType.INTEGER, UINT256, "init"))),
                ctor.getInitialStorage());
        assertTrue(ctor.getPreconditions().isEmpty());
        assertEquals(BigInteger.ZERO, act.getStore().get("Store").get("x").getRight());
    }

    @Test
    public void test_ストレージの読み込みを返す() throws DecompileException {
        Behaviour behaviour = single(summary(Contracts.GET,
                success(ImmutableList.of(), Expr.sload(Expr.ZERO, STORAGE), STORAGE)));
        assertEquals("get", behaviour.getName());
        assertEquals(Exp.tEntry(Timing.PRE, x), behaviour.getReturns());
        assertTrue(behaviour.getStateUpdates().isEmpty());
    }

    @Test
    public void test_書き込みは更新になる() throws DecompileException {
        Expr v = Expr.var("v");
        Behaviour behaviour = single(summary(Contracts.SET,
                success(ImmutableList.of(), null, Expr.sstore(Expr.ZERO, v, STORAGE))));
        assertNull(behaviour.getReturns());
        assertEquals(ImmutableList.of(new StorageUpdate(x, Exp.var(ActType.INTEGER, UINT256, "v"))),
                behaviour.getStateUpdates());
    }

    @Test
    public void test_加算のオーバーフロー検査() throws DecompileException {
        // a > ~b ならREVERT
        Prop noRevert = Prop.peq(Expr.lt(Expr.not(b), a), Expr.ZERO);
        Expr sum = Expr.wrap(Expr.add(b, a));
        Behaviour behaviour = single(summary(Contracts.ADD, success(ImmutableList.of(noRevert), sum, STORAGE)));
        assertEquals(ImmutableList.of(Exp.inRange(UINT256, Exp.add(bExp, aExp))), behaviour.getPreconditions());
        assertEquals(Exp.mod(Exp.add(bExp, aExp), Exp.litInt(Constants.TWO_256)), behaviour.getReturns());
    }

    @Test
    public void test_乗算のオーバーフロー検査() throws DecompileException {
        // a == 0 || b == (a * b) / a
        Expr check = Expr.or(Expr.iszero(a), Expr.eq(b, Expr.div(Expr.wrap(Expr.mul(a, b)), a)));
        Prop ok = Prop.pneg(Prop.peq(check, Expr.ZERO));
        Behaviour behaviour = single(summary(Contracts.ADD,
                success(ImmutableList.of(ok), Expr.wrap(Expr.mul(a, b)), STORAGE)));
        assertEquals(ImmutableList.of(Exp.inRange(UINT256, Exp.mul(aExp, bExp))), behaviour.getPreconditions());
    }

    @Test
    public void test_古い乗算のオーバーフロー検査() throws DecompileException {
        // a != 0 && MAX / a < b ならREVERT
        Expr check = Expr.and(Expr.iszero(Expr.iszero(a)), Expr.lt(Expr.div(Expr.MAX, a), b));
        Prop ok = Prop.peq(check, Expr.ZERO);
        Behaviour behaviour = single(summary(Contracts.ADD,
                success(ImmutableList.of(ok), Expr.wrap(Expr.mul(a, b)), STORAGE)));
        assertEquals(ImmutableList.of(Exp.inRange(UINT256, Exp.mul(aExp, bExp))), behaviour.getPreconditions());
    }

    @Test
    public void test_連言は分解して重複を除く() throws DecompileException {
        Prop p = Prop.plt(a, b);
        Prop q = Prop.pgt(a, Expr.ONE);
        Behaviour behaviour = single(summary(Contracts.ADD,
                success(ImmutableList.of(Prop.pand(p, q), p), a, STORAGE)));
        assertEquals(ImmutableList.of(Exp.lt(aExp, bExp), Exp.gt(aExp, Exp.ONE)), behaviour.getPreconditions());
    }

    @Test
    public void test_下位ビットのマスクは剰余() throws DecompileException {
        Behaviour behaviour = single(summary(Contracts.ADD,
                success(ImmutableList.of(), Expr.and(Expr.lit(0xff), a), STORAGE)));
        assertEquals(Exp.mod(aExp, Exp.litInt(256)), behaviour.getReturns());
    }

    @Test
    public void test_環境変数() throws DecompileException {
        Prop p = Prop.peq(Expr.env("callvalue"), Expr.ZERO);
        Behaviour behaviour = single(summary(Contracts.GET,
                success(ImmutableList.of(p), Expr.env("caller"), STORAGE)));
        assertEquals(ImmutableList.of(Exp.eq(Exp.intEnv(EthEnv.CALLVALUE), Exp.ZERO)), behaviour.getPreconditions());
        assertEquals(Exp.intEnv(EthEnv.CALLER), behaviour.getReturns());
    }

    @Test
    public void test_ABIにない名前はbytes32() throws DecompileException {
        Behaviour behaviour = single(summary(Contracts.GET,
                success(ImmutableList.of(), Expr.var("unknown"), STORAGE)));
        assertEquals(Exp.var(ActType.INTEGER, AbiType.fixedBytes(32), "unknown"), behaviour.getReturns());
    }

    @Test
    public void test_複数分岐のコンストラクタは扱えない() {
        Expr other = Expr.success(ImmutableList.of(Prop.peq(Expr.var("init"), Expr.ZERO)),
                Expr.bytes(new byte[]{0x00}), Expr.concreteStore(ImmutableMap.of()));
        ContractSummary summary = summary(Contracts.layout(), Contracts.GET, ImmutableSet.of(),
                ImmutableSet.of(creation(), other));
        assertUnsupported(summary, "decompile constructors with multiple branches");
    }

    @Test
    public void test_成功しないコンストラクタは扱えない() {
        ContractSummary summary = summary(Contracts.layout(), Contracts.GET, ImmutableSet.of(),
                ImmutableSet.of());
        assertUnsupported(summary, "cannot decompile constructors that always revert");
    }

    @Test
    public void test_bytes32の変数を読む() throws DecompileException {
        AbiType bytes32 = AbiType.fixedBytes(32);
        ImmutableMap<String, LayoutItem> layout = ImmutableMap.of("h",
                new LayoutItem(StorageType.value(bytes32), 0, BigInteger.ZERO));
        Behaviour behaviour = single(summary(layout, Contracts.GET, ImmutableSet.of(
                success(ImmutableList.of(), Expr.sload(Expr.ZERO, STORAGE), STORAGE)), ImmutableSet.of(creation())));
        StorageItem h = StorageItem.of(ActType.INTEGER, ValueType.primitive(bytes32), "Store", "h");
        assertEquals(Exp.tEntry(Timing.PRE, h), behaviour.getReturns());
    }

    @Test
    public void test_動的な型の変数は読めない() {
        ImmutableMap<String, LayoutItem> layout = ImmutableMap.of("s",
                new LayoutItem(StorageType.value(AbiType.string()), 0, BigInteger.ZERO));
        ContractSummary summary = summary(layout, Contracts.GET, ImmutableSet.of(
                success(ImmutableList.of(), Expr.sload(Expr.ZERO, STORAGE), STORAGE)), ImmutableSet.of(creation()));
        try {
            new Translator(summary).mkBehaviours();
            fail();
        } catch (DecompileException e) {
            assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.getKind());
            assertTrue(e.getMessage(), e.getMessage().startsWith(
                    "unable to handle storage reads for variables of type: "));
        }
    }

    @Test
    public void test_mappingへの書き込みは扱えない() {
        ImmutableMap<String, LayoutItem> layout = ImmutableMap.of("m", new LayoutItem(
                StorageType.mapping(ImmutableList.of(AbiType.address()), UINT256), 0, BigInteger.ZERO));
        Expr outcome = success(ImmutableList.of(), null, Expr.sstore(Expr.ZERO, a, STORAGE));
        Expr ctor = Expr.success(ImmutableList.of(), Expr.EMPTY_BUF, Expr.concreteStore(ImmutableMap.of()));
        assertUnsupported(summary(layout, Contracts.SET, ImmutableSet.of(outcome), ImmutableSet.of(ctor)),
                "cannot decompile contracts that write to mappings");
    }

    @Test
    public void test_レイアウトにないスロットへの書き込み() {
        Expr outcome = success(ImmutableList.of(), null, Expr.sstore(Expr.lit(5), a, STORAGE));
        assertUnsupported(summary(Contracts.SET, outcome),
                "write to a storage location that is not mentioned in the solc layout: 5");
    }

    @Test
    public void test_レイアウトにないスロットの読み込み() {
        Expr outcome = success(ImmutableList.of(), Expr.sload(Expr.lit(5), STORAGE), STORAGE);
        assertUnsupported(summary(Contracts.GET, outcome),
                "read from a storage location that is not present in the solc layout");
    }

    @Test
    public void test_複数の戻り値は扱えない() {
        Method pair = new Method("pair", ImmutableList.of(),
                ImmutableList.of(Contracts.uint256("x"), Contracts.uint256("y")));
        assertUnsupported(summary(pair, success(ImmutableList.of(), a, STORAGE)),
                "cannot decompile methods with multiple return types");
    }

    @Test
    public void test_可変長の戻り値は扱えない() {
        Method name = new Method("name", ImmutableList.of(), ImmutableList.of(new Param("", AbiType.string())));
        assertUnsupported(summary(name, success(ImmutableList.of(), a, STORAGE)),
                "cannot decompile methods that return dynamically sized types");
    }

    @Test
    public void test_ワード以外の等式は扱えない() {
        Prop p = Prop.peq(Expr.abstractBuf("txdata"), Expr.EMPTY_BUF);
        assertUnsupported(summary(Contracts.GET, success(ImmutableList.of(p), a, STORAGE)),
                "cannot decompile props comparing equality of non word terms");
    }

    @Test
    public void test_変換できない式() {
        Expr xor = Expr.xor(a, b);
        assertUnsupported(summary(Contracts.GET, success(ImmutableList.of(), xor, STORAGE)),
                "unable to convert to integer: " + xor);
    }
}
