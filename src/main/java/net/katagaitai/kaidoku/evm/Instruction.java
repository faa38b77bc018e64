package net.katagaitai.kaidoku.evm;

import lombok.Value;

import java.math.BigInteger;

@Value
public class Instruction {
    private int offset;
    private int opValue;
    private OpCode opCode;
    private String argHex;

    public boolean isValid() {
        return opCode != null;
    }

    public int size() {
        return 1 + (argHex == null ? 0 : argHex.length() / 2);
    }

    public BigInteger getArg() {
        if (argHex == null || argHex.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(argHex, 16);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (opCode == null) {
            sb.append(String.format("INVALID(%02x)", opValue));
        } else {
            sb.append(opCode);
        }
        if (argHex != null && argHex.length() > 0) {
            sb.append(" 0x").append(argHex);
        }
        return sb.toString();
    }
}
