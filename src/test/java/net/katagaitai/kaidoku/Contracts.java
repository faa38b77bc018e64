package net.katagaitai.kaidoku;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.kaidoku.evm.OpCode;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.solidity.CompiledContract;
import net.katagaitai.kaidoku.solidity.LayoutItem;
import net.katagaitai.kaidoku.solidity.Method;
import net.katagaitai.kaidoku.solidity.Param;
import net.katagaitai.kaidoku.solidity.Selectors;
import net.katagaitai.kaidoku.solidity.StorageType;

import java.math.BigInteger;
import java.util.List;

import static net.katagaitai.kaidoku.evm.OpCode.*;

/**
 * テストで使うコントラクト。solc の出力を模したバイトコードを組み立てる。
 * <pre>
 * contract Store {
 *     uint256 x;
 *     constructor(uint256 init) { x = init; }
 *     function get() returns (uint256) { return x; }
 *     function set(uint256 v) { x = v; }
 *     function add(uint256 a, uint256 b) returns (uint256) { return a + b; }
 * }
 * </pre>
 */
public class Contracts {
    public static final Method GET = new Method("get", ImmutableList.of(), outputs());
    public static final Method SET = new Method("set", ImmutableList.of(uint256("v")), ImmutableList.of());
    public static final Method ADD = new Method("add", ImmutableList.of(uint256("a"), uint256("b")), outputs());

    public static Param uint256(String name) {
        return new Param(name, AbiType.uint(256));
    }

    private static List<Param> outputs() {
        return ImmutableList.of(uint256(""));
    }

    public static ImmutableMap<String, LayoutItem> layout() {
        return ImmutableMap.of("x", new LayoutItem(StorageType.value(AbiType.uint(256)), 0, BigInteger.ZERO));
    }

    /**
     * セレクタで分岐し、どれにも一致しなければ REVERT する。
     */
    public static Assembler dispatcher(Method... methods) {
        Assembler asm = new Assembler()
                .push(0).op(CALLDATALOAD).push(0xe0).op(SHR);
        for (Method method : methods) {
            asm.op(DUP1).push(Selectors.selector(method.getSignature())).op(EQ)
                    .pushLabel(method.getName()).op(JUMPI);
        }
        return asm.label("revert").push(0).op(DUP1, REVERT);
    }

    public static Assembler get(Assembler asm) {
        return asm.label("get").op(POP)
                .push(0).op(SLOAD)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
    }

    public static Assembler set(Assembler asm) {
        return asm.label("set").op(POP)
                .push(4).op(CALLDATALOAD)
                .push(0).op(SSTORE)
                .op(STOP);
    }

    // if (a > ~b) revert
    public static Assembler add(Assembler asm) {
        return asm.label("add").op(POP)
                .push(4).op(CALLDATALOAD)
                .push(0x24).op(CALLDATALOAD)
                .op(DUP1, NOT, DUP3, GT)
                .pushLabel("revert").op(JUMPI)
                .op(OpCode.ADD)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
    }

    // 検査せずに a + b を返す
    public static Assembler uncheckedAdd(Assembler asm) {
        return asm.label("add").op(POP)
                .push(4).op(CALLDATALOAD)
                .push(0x24).op(CALLDATALOAD)
                .op(OpCode.ADD)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
    }

    // 末尾の32バイトを x に書き込む
    public static Assembler storeArgument() {
        return new Assembler()
                .push(0x20).push(0x20).op(CODESIZE, SUB).push(0).op(CODECOPY)
                .push(0).op(MLOAD)
                .push(0).op(SSTORE);
    }

    public static CompiledContract store() {
        byte[] runtime = add(set(get(dispatcher(ADD, GET, SET)))).assemble();
        byte[] creation = Assembler.creation(storeArgument(), runtime);
        return new CompiledContract("Store.sol:Store", creation, runtime, ImmutableList.of(uint256("init")),
                ImmutableList.of(ADD, GET, SET), layout());
    }

    /**
     * set を ABI から隠したコントラクト。実行コードは set を受け付ける。
     */
    public static CompiledContract storeWithHiddenSetter() {
        byte[] runtime = add(set(get(dispatcher(ADD, GET, SET)))).assemble();
        byte[] creation = Assembler.creation(storeArgument(), runtime);
        return new CompiledContract("Store", creation, runtime, ImmutableList.of(uint256("init")),
                ImmutableList.of(ADD, GET), layout());
    }

    /**
     * add がオーバーフローを検査しないコントラクト。
     */
    public static CompiledContract uncheckedAdder() {
        byte[] runtime = uncheckedAdd(dispatcher(ADD)).assemble();
        byte[] creation = Assembler.creation(storeArgument(), runtime);
        return new CompiledContract("Adder", creation, runtime, ImmutableList.of(uint256("init")),
                ImmutableList.of(ADD), layout());
    }

    public static byte[] runtime(OpCode... body) {
        return new Assembler().op(body).assemble();
    }
}
