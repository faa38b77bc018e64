package net.katagaitai.kaidoku.solidity;

import lombok.Value;

import java.math.BigInteger;

@Value
public class LayoutItem {
    private StorageType slotType;
    private int offset;
    private BigInteger slot;
}
