package net.katagaitai.kaidoku.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActType;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.EthEnv;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.act.SlotType;
import net.katagaitai.kaidoku.act.StorageItem;
import net.katagaitai.kaidoku.act.StorageUpdate;
import net.katagaitai.kaidoku.act.Timing;
import net.katagaitai.kaidoku.act.ValueType;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.solidity.Param;
import net.katagaitai.kaidoku.util.Constants;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;

import static junit.framework.TestCase.*;

public class SpecCompilerTest {
    private static final AbiType UINT256 = AbiType.uint(256);
    private static final Expr STORAGE = Expr.abstractStore("storage");

    private final StorageItem x = StorageItem.of(ActType.INTEGER, ValueType.primitive(UINT256), "Store", "x");
    private final StorageItem y = StorageItem.of(ActType.INTEGER, ValueType.primitive(UINT256), "Store", "y");
    private final Exp a = Exp.var(ActType.INTEGER, UINT256, "a");
    private final Exp b = Exp.var(ActType.INTEGER, UINT256, "b");
    private final SpecCompiler compiler = new SpecCompiler(act());

    private static Act act() {
        SlotType slotType = SlotType.storageValue(ValueType.primitive(UINT256));
        return new Act(ImmutableMap.of("Store", ImmutableMap.of(
                "x", Pair.of(slotType, BigInteger.ZERO), "y", Pair.of(slotType, BigInteger.ONE))),
                ImmutableList.of());
    }

    private static Behaviour behaviour(List<Exp> pres, List<StorageUpdate> updates, Exp ret) {
        Interface iface = Interface.of("f", ImmutableList.of(new Param("a", UINT256), new Param("b", UINT256)));
        return new Behaviour("f", "Store", iface, ImmutableList.copyOf(pres), ImmutableList.of(),
                ImmutableList.of(), ImmutableList.copyOf(updates), ret);
    }

    private static Expr returned(Expr success) {
        return Expr.readWord(Expr.ZERO, success.getReturnData());
    }

    @Test
    public void test_事前状態の読み込み() {
        Expr success = compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(),
                Exp.tEntry(Timing.PRE, x)));
        assertTrue(success.is(Expr.Kind.SUCCESS));
        assertTrue(success.getProps().isEmpty());
        assertEquals(Expr.sload(Expr.ZERO, STORAGE), returned(success));
        assertEquals(STORAGE, success.getStorage());
    }

    @Test
    public void test_戻り値がなければ空のバッファ() {
        Expr success = compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(), null));
        assertEquals(Expr.EMPTY_BUF, success.getReturnData());
    }

    @Test
    public void test_書き込みは事前状態の値を使う() {
        // x := y, y := x の入れ替え
        Expr success = compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(
                new StorageUpdate(x, Exp.tEntry(Timing.PRE, y)),
                new StorageUpdate(y, Exp.tEntry(Timing.PRE, x))), Exp.tEntry(Timing.POST, x)));
        Expr oldX = Expr.sload(Expr.ZERO, STORAGE);
        Expr oldY = Expr.sload(Expr.ONE, STORAGE);
        assertEquals(Expr.sstore(Expr.ONE, oldX, Expr.sstore(Expr.ZERO, oldY, STORAGE)), success.getStorage());
        assertEquals(oldY, returned(success));
    }

    @Test
    public void test_2の256乗の剰余はワード演算() {
        Exp sum = Exp.mod(Exp.add(a, b), Exp.litInt(Constants.TWO_256));
        Expr success = compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(), sum));
        assertEquals(Expr.add(Expr.var("a"), Expr.var("b")), returned(success));
    }

    @Test
    public void test_加算の範囲() {
        Expr success = compiler.compile(behaviour(ImmutableList.of(Exp.inRange(UINT256, Exp.add(a, b))),
                ImmutableList.of(), null));
        Expr va = Expr.var("a");
        assertEquals(ImmutableList.of(Prop.pgeq(Expr.add(va, Expr.var("b")), va)), success.getProps());
    }

    @Test
    public void test_減算と乗算の範囲() {
        Expr va = Expr.var("a");
        Expr vb = Expr.var("b");
        Expr sub = compiler.compile(behaviour(ImmutableList.of(Exp.inRange(UINT256, Exp.sub(a, b))),
                ImmutableList.of(), null));
        assertEquals(Prop.pleq(Expr.sub(va, vb), va), sub.getProps().get(0));

        Expr mul = compiler.compile(behaviour(ImmutableList.of(Exp.inRange(UINT256, Exp.mul(a, b))),
                ImmutableList.of(), null));
        Prop expected = Prop.por(Prop.peq(va, Expr.ZERO), Prop.peq(Expr.div(Expr.mul(va, vb), va), vb));
        assertEquals(expected, mul.getProps().get(0));
    }

    @Test
    public void test_剰余の下は範囲を見ない() {
        Exp wrapped = Exp.mod(Exp.add(a, b), Exp.litInt(Constants.TWO_256));
        Expr success = compiler.compile(behaviour(ImmutableList.of(Exp.inRange(UINT256, wrapped)),
                ImmutableList.of(), null));
        assertTrue(success.getProps().isEmpty() || success.getProps().get(0).equals(Prop.TRUE));
    }

    @Test
    public void test_小さい型の範囲() {
        Expr va = Expr.var("a");
        Behaviour uint8 = behaviour(ImmutableList.of(Exp.inRange(AbiType.uint(8), a)), ImmutableList.of(), null);
        assertEquals(Prop.pleq(va, Expr.lit(255)), compiler.compile(uint8).getProps().get(0));

        Behaviour address = behaviour(ImmutableList.of(Exp.inRange(AbiType.address(), a)), ImmutableList.of(),
                null);
        assertEquals(Prop.pleq(va, Expr.lit(BigInteger.ONE.shiftLeft(160).subtract(BigInteger.ONE))),
                compiler.compile(address).getProps().get(0));

        Behaviour int16 = behaviour(ImmutableList.of(Exp.inRange(AbiType.sint(16), a)), ImmutableList.of(), null);
        assertEquals(Prop.peq(Expr.sex(Expr.ONE, va), va), compiler.compile(int16).getProps().get(0));
    }

    @Test
    public void test_環境変数と否定() {
        Exp callvalue = Exp.neq(Exp.intEnv(EthEnv.CALLVALUE), Exp.ZERO);
        Expr success = compiler.compile(behaviour(ImmutableList.of(callvalue), ImmutableList.of(), null));
        assertEquals(Prop.pneg(Prop.peq(Expr.env("callvalue"), Expr.ZERO)), success.getProps().get(0));
    }

    @Test
    public void test_負の定数はワードに直す() {
        Expr success = compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(), Exp.intMin(256)));
        assertEquals(Expr.lit(BigInteger.ONE.shiftLeft(255)), returned(success));
    }

    @Test
    public void test_コンストラクタ() {
        Interface iface = Interface.of("constructor", ImmutableList.of(new Param("init", UINT256)));
        Constructor ctor = new Constructor("Store", iface, ImmutableList.of(), ImmutableList.of(),
                ImmutableList.of(), ImmutableList.of(new StorageUpdate(x, Exp.var(ActType.INTEGER, UINT256, "init"))));
        byte[] runtime = {0x60, 0x00};
        Expr success = compiler.compile(ctor, runtime);
        assertEquals(Expr.bytes(runtime), success.getReturnData());
        assertEquals(Expr.sstore(Expr.ZERO, Expr.var("init"), Expr.concreteStore(ImmutableMap.of())),
                success.getStorage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_レイアウトにない変数() {
        StorageItem z = StorageItem.of(ActType.INTEGER, ValueType.primitive(UINT256), "Store", "z");
        compiler.compile(behaviour(ImmutableList.of(), ImmutableList.of(), Exp.tEntry(Timing.PRE, z)));
    }
}
