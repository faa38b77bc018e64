package net.katagaitai.kaidoku.evm;

import com.google.common.collect.ImmutableList;
import net.katagaitai.kaidoku.Assembler;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.List;

import static junit.framework.TestCase.*;
import static net.katagaitai.kaidoku.evm.OpCode.*;

public class MachineTest {
    private static MachineManager manager;

    @BeforeClass
    public static void setup() {
        // ソルバなしでは両方の分岐を実行する
        manager = new MachineManager(null, 1);
    }

    @AfterClass
    public static void tearDown() {
        manager.close();
    }

    private static Expr run(Assembler asm, Expr calldata) {
        return manager.execute(asm.assemble(), calldata, false);
    }

    private static Expr calldata(String... args) {
        return Calldata.forMethod(new byte[]{1, 2, 3, 4}, ImmutableList.copyOf(args));
    }

    @Test
    public void test_空のコードはSTOPと同じ() {
        Expr result = run(new Assembler(), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.SUCCESS));
        assertEquals(Expr.EMPTY_BUF, result.getReturnData());
    }

    @Test
    public void test_ADDの結果を返す() {
        Assembler asm = new Assembler()
                .push(2).push(1).op(ADD)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
        Expr result = run(asm, Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.SUCCESS));
        assertEquals(Expr.lit(3), Expr.readWord(Expr.ZERO, result.getReturnData()));
    }

    @Test
    public void test_引数を読む() {
        Assembler asm = new Assembler()
                .push(0x24).op(CALLDATALOAD)
                .push(4).op(CALLDATALOAD)
                .op(SUB)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
        Expr result = run(asm, calldata("a", "b"));
        assertEquals(Expr.sub(Expr.var("a"), Expr.var("b")), Expr.readWord(Expr.ZERO, result.getReturnData()));
    }

    @Test
    public void test_REVERTはFailure() {
        Expr result = run(new Assembler().push(0).op(DUP1, REVERT), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.FAILURE));
    }

    @Test
    public void test_未定義の命令はFailure() {
        Expr result = run(new Assembler().data(new byte[]{(byte) 0xef}), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.FAILURE));
    }

    @Test
    public void test_スタック不足はFailure() {
        Expr result = run(new Assembler().op(ADD), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.FAILURE));
    }

    @Test
    public void test_外部呼び出しはPartial() {
        Assembler asm = new Assembler();
        for (int i = 0; i < 7; i++) {
            asm.push(0);
        }
        Expr result = run(asm.op(CALL), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.PARTIAL));
        assertEquals("unsupported opcode: CALL", result.getName());
    }

    @Test
    public void test_記号的なジャンプ先はPartial() {
        Expr result = run(new Assembler().push(4).op(CALLDATALOAD, JUMP), calldata("a"));
        assertTrue(result.is(Expr.Kind.PARTIAL));
    }

    @Test
    public void test_JUMPDESTでない場所へのジャンプはFailure() {
        Expr result = run(new Assembler().push(3).op(JUMP, STOP), Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.FAILURE));
    }

    @Test
    public void test_記号的な条件では両方に分岐する() {
        Assembler asm = new Assembler()
                .push(4).op(CALLDATALOAD)
                .pushLabel("then").op(JUMPI)
                .push(0).op(DUP1, REVERT)
                .label("then").op(STOP);
        Expr result = run(asm, calldata("a"));
        assertTrue(result.is(Expr.Kind.ITE));
        List<Expr> leaves = Expr.flatten(result);
        assertEquals(2, leaves.size());

        Expr success = leaves.get(0);
        assertTrue(success.is(Expr.Kind.SUCCESS));
        assertEquals(ImmutableList.of(Prop.pneg(Prop.peq(Expr.var("a"), Expr.ZERO))), success.getProps());
        Expr failure = leaves.get(1);
        assertTrue(failure.is(Expr.Kind.FAILURE));
        assertEquals(ImmutableList.of(Prop.peq(Expr.var("a"), Expr.ZERO)), failure.getProps());
    }

    @Test
    public void test_後ろへのジャンプは上限でPartial() {
        Assembler asm = new Assembler()
                .label("loop")
                .pushLabel("loop").op(JUMP);
        Expr result = run(asm, Expr.EMPTY_BUF);
        assertTrue(result.is(Expr.Kind.PARTIAL));
        assertEquals("max iterations reached", result.getName());
    }

    @Test
    public void test_ストレージへの書き込みと読み込み() {
        Assembler asm = new Assembler()
                .push(4).op(CALLDATALOAD)
                .push(1).op(SSTORE)
                .push(1).op(SLOAD)
                .push(0).op(SLOAD)
                .op(ADD)
                .push(0).op(MSTORE)
                .push(0x20).push(0).op(RETURN);
        Expr result = run(asm, calldata("a"));
        Expr stored = Expr.sload(Expr.ZERO, Expr.abstractStore("storage"));
        assertEquals(Expr.add(stored, Expr.var("a")), Expr.readWord(Expr.ZERO, result.getReturnData()));
        assertEquals(Expr.sstore(Expr.ONE, Expr.var("a"), Expr.abstractStore("storage")), result.getStorage());
    }

    @Test
    public void test_作成時は引数がコードの後ろに付く() {
        Assembler asm = new Assembler()
                .push(0x20).push(0x20).op(CODESIZE, SUB).push(0).op(CODECOPY)
                .push(0x20).push(0).op(RETURN);
        byte[] code = asm.assemble();
        Expr result = manager.execute(code, Calldata.forConstructor(ImmutableList.of("init")), true);
        assertTrue(result.is(Expr.Kind.SUCCESS));
        assertEquals(Expr.var("init"), Expr.readWord(Expr.ZERO, result.getReturnData()));
        assertEquals(Expr.Kind.CONCRETE_STORE, result.getStorage().getKind());
    }
}
