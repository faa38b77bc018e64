package net.katagaitai.kaidoku.util;

import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;

public class Util {
    public static byte[] hexToBytes(String hex) {
        String h = StringUtils.removeStart(StringUtils.trimToEmpty(hex), "0x");
        if (h.length() % 2 != 0) {
            throw new IllegalArgumentException("奇数長の16進文字列: " + hex);
        }
        return Hex.decode(h);
    }

    public static String bytesToHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    public static String wordToHex(BigInteger word) {
        return "0x" + word.toString(16);
    }

    // 32バイト固定長のビッグエンディアン
    public static byte[] wordToBytes(BigInteger word) {
        byte[] bytes = word.toByteArray();
        final int byteSize = Constants.WORD_BYTES;
        if (bytes.length < byteSize) {
            byte[] tmp = new byte[byteSize];
            System.arraycopy(bytes, 0, tmp, byteSize - bytes.length, bytes.length);
            bytes = tmp;
        } else if (bytes.length > byteSize) {
            bytes = Arrays.copyOfRange(bytes, bytes.length - byteSize, bytes.length);
        }
        return bytes;
    }

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    public static BigInteger toWord(BigInteger value) {
        return value.mod(Constants.TWO_256);
    }

    public static BigInteger toSigned(BigInteger word) {
        if (word.testBit(Constants.WORD_BITS - 1)) {
            return word.subtract(Constants.TWO_256);
        }
        return word;
    }

    public static int getInt(BigInteger word) {
        if (word.bitLength() > 31) {
            return Integer.MAX_VALUE;
        }
        return word.intValue();
    }
}
