package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import net.katagaitai.kaidoku.util.Util;
import org.junit.Test;

import java.math.BigInteger;

import static junit.framework.TestCase.*;

public class SelectorsTest {
    @Test
    public void test_既知のセレクタ() {
        assertEquals("0x6d4ce63c", Selectors.selectorHex("get()"));
        assertEquals("0x60fe47b1", Selectors.selectorHex("set(uint256)"));
        assertEquals("0x771602f7", Selectors.selectorHex("add(uint256,uint256)"));
        assertEquals("0xa9059cbb", Selectors.selectorHex("transfer(address,uint256)"));
    }

    @Test
    public void test_値としてのセレクタ() {
        assertEquals(new BigInteger("18160ddd", 16), Selectors.selectorValue("totalSupply()"));
        assertEquals(4, Selectors.selector("balanceOf(address)").length);
    }

    @Test
    public void test_メソッドのシグネチャ() {
        Method method = new Method("transfer", ImmutableList.of(new Param("to", AbiType.address()),
                new Param("amount", AbiType.uint(256))), ImmutableList.of(new Param("", AbiType.bool())));
        assertEquals("transfer(address,uint256)", method.getSignature());
        assertEquals("0xa9059cbb", "0x" + Util.bytesToHex(method.getSelector()));
    }
}
