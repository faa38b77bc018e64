package net.katagaitai.kaidoku.solidity;

import net.katagaitai.kaidoku.util.Util;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class Selectors {
    public static byte[] selector(String signature) {
        byte[] hash = Util.keccak256(signature.getBytes(StandardCharsets.US_ASCII));
        return Arrays.copyOf(hash, 4);
    }

    public static BigInteger selectorValue(String signature) {
        return new BigInteger(1, selector(signature));
    }

    public static String selectorHex(String signature) {
        return "0x" + Util.bytesToHex(selector(signature));
    }
}
