package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static junit.framework.TestCase.*;

public class AbiTypeTest {
    @Test
    public void test_整数型() {
        assertEquals(AbiType.uint(256), AbiType.parse("uint"));
        assertEquals(AbiType.uint(8), AbiType.parse("uint8"));
        assertEquals(AbiType.sint(256), AbiType.parse("int"));
        assertEquals("int128", AbiType.parse("int128").typeName());
        assertTrue(AbiType.parse("address payable").isInteger());
        assertTrue(AbiType.bool().isInteger());
        assertFalse(AbiType.fixedBytes(32).isInteger());
    }

    @Test
    public void test_配列とタプル() {
        AbiType array = AbiType.parse("uint256[2][]");
        assertEquals(AbiType.Kind.ARRAY, array.getKind());
        assertEquals("uint256[2][]", array.typeName());
        assertTrue(array.isDynamic());

        AbiType fixed = AbiType.parse("bytes32[3]");
        assertFalse(fixed.isDynamic());

        AbiType tuple = AbiType.parse("tuple", ImmutableList.of(AbiType.uint(8), AbiType.string()));
        assertEquals("(uint8,string)", tuple.typeName());
        assertTrue(tuple.isDynamic());
    }

    @Test
    public void test_可変長の型() {
        assertTrue(AbiType.parse("bytes").isDynamic());
        assertTrue(AbiType.parse("string").isDynamic());
        assertFalse(AbiType.parse("bytes4").isDynamic());
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_不正なビット数() {
        AbiType.parse("uint7");
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_未対応の型名() {
        AbiType.parse("fixed128x18");
    }
}
